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

import com.mrrtoolbox.errors.InvalidParameterException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * One nozzle temperature controller on a shared Modbus ASCII bus.
 *
 * Frames are ':' followed by the hex encoded slave address, function code, data and LRC, then CR LF.  Temperatures
 * are held in registers with one implied decimal, in degrees Celsius.
 */
public class ModbusTemperatureController {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ModbusTemperatureController.class);

  public static final int PROCESS_VALUE_REGISTER = 0x4700;
  public static final int SET_POINT_REGISTER = 0x4701;

  static final int READ_HOLDING_REGISTERS = 0x03;
  static final int WRITE_SINGLE_REGISTER = 0x06;
  private static final int EXCEPTION_FLAG = 0x80;
  private static final double REGISTER_SCALE = 10.0;

  private static final char FRAME_START = ':';
  private static final String FRAME_END = "\r\n";

  private final SerialLink link;
  private final Integer slaveAddress;

  public ModbusTemperatureController(SerialLink link, Integer slaveAddress) {
    if (slaveAddress < 1 || slaveAddress > 247) {
      throw new InvalidParameterException(String.format("Modbus slave address must be 1-247, got %d", slaveAddress));
    }
    this.link = link;
    this.slaveAddress = slaveAddress;
  }

  public Integer getSlaveAddress() {
    return slaveAddress;
  }

  /**
   * Current nozzle temperature.
   */
  public Double readProcessValue() throws IOException {
    return readRegister(PROCESS_VALUE_REGISTER) / REGISTER_SCALE;
  }

  public Double readSetPoint() throws IOException {
    return readRegister(SET_POINT_REGISTER) / REGISTER_SCALE;
  }

  public void writeSetPoint(Double celsius) throws IOException {
    long raw = Math.round(celsius * REGISTER_SCALE);
    if (raw < 0 || raw > 0xFFFF) {
      throw new InvalidParameterException(String.format("Set point %.1f C does not fit in a register", celsius));
    }
    writeRegister(SET_POINT_REGISTER, (int) raw);
    LOGGER.info("Controller %d set point is now %.1f C", slaveAddress, celsius);
  }

  int readRegister(int register) throws IOException {
    byte[] reply = transact(READ_HOLDING_REGISTERS, new int[]{register >> 8, register & 0xFF, 0x00, 0x01});
    // slave, function, byte count, value high, value low
    if (reply.length != 5 || (reply[2] & 0xFF) != 2) {
      throw new IOException(String.format("Controller %d sent a malformed register read reply", slaveAddress));
    }
    return ((reply[3] & 0xFF) << 8) | (reply[4] & 0xFF);
  }

  void writeRegister(int register, int value) throws IOException {
    int[] data = new int[]{register >> 8, register & 0xFF, value >> 8, value & 0xFF};
    byte[] reply = transact(WRITE_SINGLE_REGISTER, data);
    // A successful write echoes the request.
    if (reply.length != 6) {
      throw new IOException(String.format("Controller %d sent a malformed register write reply", slaveAddress));
    }
    for (int i = 0; i < data.length; i++) {
      if ((reply[i + 2] & 0xFF) != data[i]) {
        throw new IOException(String.format("Controller %d did not confirm the register write", slaveAddress));
      }
    }
  }

  private byte[] transact(int function, int[] data) throws IOException {
    int[] message = new int[data.length + 2];
    message[0] = slaveAddress;
    message[1] = function;
    System.arraycopy(data, 0, message, 2, data.length);
    link.write(encodeFrame(message));

    byte[] reply = decodeFrame(link.readLine());
    if ((reply[0] & 0xFF) != slaveAddress) {
      throw new IOException(String.format("Expected a reply from controller %d, got one from %d",
          slaveAddress, reply[0] & 0xFF));
    }
    int replyFunction = reply[1] & 0xFF;
    if (replyFunction == (function | EXCEPTION_FLAG)) {
      throw new IOException(String.format("Controller %d rejected function %02X with exception code %d",
          slaveAddress, function, reply.length > 2 ? reply[2] & 0xFF : -1));
    }
    if (replyFunction != function) {
      throw new IOException(String.format("Controller %d answered function %02X to a function %02X request",
          slaveAddress, replyFunction, function));
    }
    return reply;
  }

  /**
   * Two's complement of the byte sum.
   */
  static int lrc(int[] message) {
    int sum = 0;
    for (int b : message) {
      sum += b & 0xFF;
    }
    return (-sum) & 0xFF;
  }

  static byte[] encodeFrame(int[] message) {
    StringBuilder sb = new StringBuilder();
    sb.append(FRAME_START);
    for (int b : message) {
      sb.append(String.format("%02X", b & 0xFF));
    }
    sb.append(String.format("%02X", lrc(message)));
    sb.append(FRAME_END);
    return sb.toString().getBytes(StandardCharsets.US_ASCII);
  }

  /**
   * @return The frame's bytes without the LRC.
   * @throws IOException if the frame is malformed or fails its LRC check.
   */
  static byte[] decodeFrame(String line) throws IOException {
    String frame = line.trim();
    if (frame.isEmpty() || frame.charAt(0) != FRAME_START || frame.length() % 2 != 1 || frame.length() < 7) {
      throw new IOException(String.format("Malformed Modbus ASCII frame '%s'", line));
    }
    int n = (frame.length() - 1) / 2;
    int[] bytes = new int[n];
    try {
      for (int i = 0; i < n; i++) {
        bytes[i] = Integer.parseInt(frame.substring(1 + 2 * i, 3 + 2 * i), 16);
      }
    } catch (NumberFormatException e) {
      throw new IOException(String.format("Malformed Modbus ASCII frame '%s'", line), e);
    }
    int[] message = new int[n - 1];
    System.arraycopy(bytes, 0, message, 0, n - 1);
    if (lrc(message) != bytes[n - 1]) {
      throw new IOException(String.format("LRC mismatch in Modbus frame '%s'", line));
    }
    byte[] result = new byte[message.length];
    for (int i = 0; i < message.length; i++) {
      result[i] = (byte) message[i];
    }
    return result;
  }
}
