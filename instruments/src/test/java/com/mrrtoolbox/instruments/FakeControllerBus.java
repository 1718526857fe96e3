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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Answers Modbus register reads and writes for a set of controllers, one reply per request.
 */
class FakeControllerBus implements SerialLink {
  private final Map<Integer, int[]> registers = new HashMap<>();
  private String pendingReply;
  private int requests = 0;
  private boolean closed = false;

  void addController(int slave, double processValue, double setPoint) {
    registers.put(slave, new int[]{(int) Math.round(processValue * 10), (int) Math.round(setPoint * 10)});
  }

  int getRequests() {
    return requests;
  }

  boolean isClosed() {
    return closed;
  }

  double getSetPoint(int slave) {
    return registers.get(slave)[1] / 10.0;
  }

  @Override
  public void write(byte[] data) throws IOException {
    requests++;
    byte[] request = ModbusTemperatureController.decodeFrame(new String(data, StandardCharsets.US_ASCII));
    int slave = request[0] & 0xFF;
    int function = request[1] & 0xFF;
    int register = ((request[2] & 0xFF) << 8) | (request[3] & 0xFF);
    int index = register == ModbusTemperatureController.PROCESS_VALUE_REGISTER ? 0 : 1;
    int[] values = registers.get(slave);
    int[] reply;
    if (function == ModbusTemperatureController.READ_HOLDING_REGISTERS) {
      reply = new int[]{slave, function, 2, values[index] >> 8, values[index] & 0xFF};
    } else {
      values[index] = ((request[4] & 0xFF) << 8) | (request[5] & 0xFF);
      reply = new int[request.length];
      for (int i = 0; i < request.length; i++) {
        reply[i] = request[i] & 0xFF;
      }
    }
    pendingReply = new String(ModbusTemperatureController.encodeFrame(reply), StandardCharsets.US_ASCII).trim();
  }

  @Override
  public String readLine() throws IOException {
    if (pendingReply == null) {
      throw new IOException("No request is waiting for a reply");
    }
    String reply = pendingReply;
    pendingReply = null;
    return reply;
  }

  @Override
  public void close() {
    closed = true;
  }
}
