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

import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ArbitraryWaveformGeneratorTest {
  private ScpiConnection connection;
  private ArbitraryWaveformGenerator awg;

  @Before
  public void setUp() throws Exception {
    connection = Mockito.mock(ScpiConnection.class);
    awg = new ArbitraryWaveformGenerator(connection, new InstrumentConfig.AwgSettings());
    when(connection.query("AWGControl:INTerleave?")).thenReturn("1");
    when(connection.query("AWGControl:INTerleave:ZERoing?")).thenReturn("1");
    when(connection.query("SOURCE1:FREQUENCY?")).thenReturn("2.4000000000E+10");
    when(connection.query("AWGControl:RMODe?")).thenReturn("TRIG");
    when(connection.query("AWGControl:CLOCk:SOURce?")).thenReturn("INT");
    when(connection.query("SOURCE1:ROSCillator:SOURCE?")).thenReturn("EXT");
  }

  @Test
  public void testExpectedSettings() throws Exception {
    assertEquals(Collections.emptyList(), awg.unexpectedSettings());
    awg.run(false);
    verify(connection).write("AWGControl:RUN");
  }

  @Test
  public void testMnemonicPrefixes() {
    assertTrue(ArbitraryWaveformGenerator.sameMnemonic("TRIGgered", "TRIG"));
    assertTrue(ArbitraryWaveformGenerator.sameMnemonic(" int", "INTernal"));
    assertFalse(ArbitraryWaveformGenerator.sameMnemonic("INT", "EXT"));
  }

  @Test
  public void testRunRefusesUnexpectedSettings() throws Exception {
    when(connection.query("AWGControl:RMODe?")).thenReturn("CONT");
    when(connection.query("SOURCE1:FREQUENCY?")).thenReturn("1.2E10");
    assertEquals(Arrays.asList("sample rate", "run mode"), awg.unexpectedSettings());
    try {
      awg.run(false);
      fail("The generator must not play with unexpected settings");
    } catch (IllegalStateException e) {
      assertEquals("Unexpected AWG settings: sample rate, run mode", e.getMessage());
    }
    verify(connection, never()).write("AWGControl:RUN");
  }

  @Test
  public void testRunCanRestoreSettings() throws Exception {
    when(connection.query("AWGControl:INTerleave:ZERoing?")).thenReturn("0");
    awg.run(true);
    verify(connection).write("AWGControl:INTerleave:ZERoing 1");
    verify(connection).write("SOURCE1:FREQUENCY 2.4E10");
    verify(connection).write("AWGControl:RMODe TRIG");
    verify(connection).write("AWGControl:RUN");
  }

  @Test
  public void testSelectWaveformStopsOutputFirst() throws Exception {
    awg.selectWaveform("chirp_2to8");
    InOrder inOrder = Mockito.inOrder(connection);
    inOrder.verify(connection).write("AWGControl:STOP");
    inOrder.verify(connection).write("SOURce1:WAVeform \"chirp_2to8\"");
  }
}
