/*************************************************************************
*                                                                        *
*  This file is part of the mrr-toolbox project.                         *
*  mrr-toolbox drives and analyzes broadband rotational spectroscopy.    *
*  Copyright (C) 2024 The mrr-toolbox Authors.                           *
*                                                                        *
*  Please direct all queries to the mrr-toolbox issue tracker.           *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.mrrtoolbox.instruments;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Serial bus reached through a serial-to-ethernet bridge in raw TCP mode.  Line settings (baud rate, parity, data
 * bits) live on the bridge.
 */
public class TcpSerialLink implements SerialLink {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TcpSerialLink.class);

  private final String host;
  private final Integer port;
  private final Socket socket;
  private final OutputStream out;
  private final BufferedReader in;

  public TcpSerialLink(String host, Integer port, Integer timeoutMillis) throws InstrumentUnreachableException {
    this.host = host;
    this.port = port;
    this.socket = new Socket();
    try {
      socket.connect(new InetSocketAddress(host, port), timeoutMillis);
      socket.setSoTimeout(timeoutMillis);
      this.out = socket.getOutputStream();
      this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
    } catch (IOException e) {
      try {
        socket.close();
      } catch (IOException closeError) {
        e.addSuppressed(closeError);
      }
      throw new InstrumentUnreachableException(String.format("Could not reach serial bridge %s:%d", host, port), e);
    }
    LOGGER.info("Connected to serial bridge %s:%d", host, port);
  }

  public TcpSerialLink(InstrumentConfig.Endpoint endpoint) throws InstrumentUnreachableException {
    this(endpoint.getHost(), endpoint.getPort(), endpoint.getTimeoutMillis());
  }

  @Override
  public void write(byte[] data) throws IOException {
    try {
      out.write(data);
      out.flush();
    } catch (IOException e) {
      throw new InstrumentUnreachableException(String.format("Lost serial bridge %s:%d", host, port), e);
    }
  }

  @Override
  public String readLine() throws IOException {
    String line;
    try {
      line = in.readLine();
    } catch (SocketTimeoutException e) {
      throw new InstrumentUnreachableException(String.format("No reply through serial bridge %s:%d", host, port), e);
    }
    if (line == null) {
      throw new InstrumentUnreachableException(String.format("Serial bridge %s:%d closed the connection", host, port));
    }
    return line;
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
