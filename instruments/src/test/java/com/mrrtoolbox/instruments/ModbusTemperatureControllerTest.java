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
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ModbusTemperatureControllerTest {
  private SerialLink link;
  private ModbusTemperatureController controller;

  @Before
  public void setUp() throws Exception {
    link = Mockito.mock(SerialLink.class);
    controller = new ModbusTemperatureController(link, 3);
  }

  private static String reply(int... message) {
    return new String(ModbusTemperatureController.encodeFrame(message), StandardCharsets.US_ASCII).trim();
  }

  @Test
  public void testEncodeReadRequest() {
    byte[] frame = ModbusTemperatureController.encodeFrame(new int[]{0x03, 0x03, 0x47, 0x00, 0x00, 0x01});
    assertEquals(":030347000001B2\r\n", new String(frame, StandardCharsets.US_ASCII));
    assertEquals(0xB2, ModbusTemperatureController.lrc(new int[]{0x03, 0x03, 0x47, 0x00, 0x00, 0x01}));
  }

  @Test
  public void testDecodeStripsLrc() throws Exception {
    byte[] message = ModbusTemperatureController.decodeFrame(":030347000001B2\r\n");
    assertArrayEquals(new byte[]{0x03, 0x03, 0x47, 0x00, 0x00, 0x01}, message);
  }

  @Test(expected = IOException.class)
  public void testDecodeRejectsBadLrc() throws Exception {
    ModbusTemperatureController.decodeFrame(":030347000001B3");
  }

  @Test(expected = IOException.class)
  public void testDecodeRejectsMissingStart() throws Exception {
    ModbusTemperatureController.decodeFrame("030347000001B2");
  }

  @Test
  public void testReadProcessValue() throws Exception {
    // 253 tenths of a degree.
    when(link.readLine()).thenReturn(reply(0x03, 0x03, 0x02, 0x00, 0xFD));
    assertEquals(25.3, controller.readProcessValue(), 1e-12);
    verify(link).write(":030347000001B2\r\n".getBytes(StandardCharsets.US_ASCII));
  }

  @Test
  public void testRegisterValuesAreUnsigned() throws Exception {
    when(link.readLine()).thenReturn(reply(0x03, 0x03, 0x02, 0xFF, 0xFF));
    assertEquals(6553.5, controller.readSetPoint(), 1e-12);
  }

  @Test
  public void testWriteSetPointChecksEcho() throws Exception {
    when(link.readLine()).thenReturn(reply(0x03, 0x06, 0x47, 0x01, 0x02, 0x58));
    controller.writeSetPoint(60.0);
    verify(link).write(ModbusTemperatureController.encodeFrame(new int[]{0x03, 0x06, 0x47, 0x01, 0x02, 0x58}));
  }

  @Test(expected = IOException.class)
  public void testWrongEchoIsAnError() throws Exception {
    when(link.readLine()).thenReturn(reply(0x03, 0x06, 0x47, 0x01, 0x02, 0x59));
    controller.writeSetPoint(60.0);
  }

  @Test
  public void testExceptionReply() throws Exception {
    when(link.readLine()).thenReturn(reply(0x03, 0x83, 0x02));
    try {
      controller.readProcessValue();
      fail("An exception reply must not be read as a value");
    } catch (IOException e) {
      assertEquals("Controller 3 rejected function 03 with exception code 2", e.getMessage());
    }
  }

  @Test(expected = IOException.class)
  public void testReplyFromAnotherSlave() throws Exception {
    when(link.readLine()).thenReturn(reply(0x04, 0x03, 0x02, 0x00, 0xFD));
    controller.readProcessValue();
  }

  @Test(expected = InvalidParameterException.class)
  public void testNegativeSetPointIsRejected() throws Exception {
    controller.writeSetPoint(-1.0);
  }

  @Test(expected = InvalidParameterException.class)
  public void testBroadcastAddressIsRejected() {
    new ModbusTemperatureController(link, 0);
  }
}
