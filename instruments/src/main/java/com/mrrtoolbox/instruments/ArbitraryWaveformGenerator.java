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

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Arbitrary waveform generator that plays the excitation chirps, driven by SCPI.
 */
public class ArbitraryWaveformGenerator implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ArbitraryWaveformGenerator.class);

  private static final double RELATIVE_TOLERANCE = 1e-9;

  private final ScpiConnection connection;
  private final InstrumentConfig.AwgSettings expected;

  public ArbitraryWaveformGenerator(ScpiConnection connection, InstrumentConfig.AwgSettings expected) {
    this.connection = connection;
    this.expected = expected;
  }

  public static ArbitraryWaveformGenerator connect(InstrumentConfig.AwgSettings settings) throws IOException {
    return new ArbitraryWaveformGenerator(new TcpScpiConnection(settings), settings);
  }

  public String idn() throws IOException {
    return connection.query("*IDN?");
  }

  public Integer getInterleave() throws IOException {
    return Integer.valueOf(connection.query("AWGControl:INTerleave?"));
  }

  public void setInterleave(Integer value) throws IOException {
    connection.write(String.format("AWGControl:INTerleave %d", value));
  }

  public Integer getZeroing() throws IOException {
    return Integer.valueOf(connection.query("AWGControl:INTerleave:ZERoing?"));
  }

  public void setZeroing(Integer value) throws IOException {
    connection.write(String.format("AWGControl:INTerleave:ZERoing %d", value));
  }

  public Double getSampleRate() throws IOException {
    return Double.valueOf(connection.query("SOURCE1:FREQUENCY?"));
  }

  public void setSampleRate(Double rate) throws IOException {
    connection.write(String.format("SOURCE1:FREQUENCY %s", rate));
  }

  public String getRunMode() throws IOException {
    return connection.query("AWGControl:RMODe?");
  }

  public void setRunMode(String mode) throws IOException {
    connection.write(String.format("AWGControl:RMODe %s", mode));
  }

  public String getClockSource() throws IOException {
    return connection.query("AWGControl:CLOCk:SOURce?");
  }

  public void setClockSource(String source) throws IOException {
    connection.write(String.format("AWGControl:CLOCk:SOURce %s", source));
  }

  public String getReferenceSource() throws IOException {
    return connection.query("SOURCE1:ROSCillator:SOURCE?");
  }

  public void setReferenceSource(String source) throws IOException {
    connection.write(String.format("SOURCE1:ROSCillator:SOURCE %s", source));
  }

  public String getWaveform() throws IOException {
    return StringUtils.strip(connection.query("SOURce1:WAVeform?"), "\"");
  }

  /**
   * Switch the output to a waveform already imported into the instrument.  Output is stopped first.
   */
  public void selectWaveform(String name) throws IOException {
    stop();
    connection.write(String.format("SOURce1:WAVeform \"%s\"", name));
  }

  public void setChannelOutput(boolean on) throws IOException {
    connection.write(String.format("OUTPUT1:STATE %d", on ? 1 : 0));
  }

  /**
   * Load a waveform text file from the instrument's disk.
   */
  public void importWaveform(String fileName) throws IOException {
    connection.write(String.format("MMEMory:IMPort %s", fileName));
  }

  public void importSetup(String fileName) throws IOException {
    connection.write(String.format("AWGControl:SREStore \"%s\"", fileName));
  }

  /**
   * Push every configured setting to the instrument.
   */
  public void applyExpectedSettings() throws IOException {
    setInterleave(expected.getInterleave());
    setZeroing(expected.getZeroing());
    setSampleRate(expected.getSampleRate());
    setRunMode(expected.getRunMode());
    setClockSource(expected.getClockSource());
    setReferenceSource(expected.getReferenceSource());
  }

  /**
   * @return Names of settings that differ from the configured ones; empty when it is safe to play.  Mnemonics are
   * compared by prefix, so a reply of TRIG matches a configured TRIGgered.
   */
  public List<String> unexpectedSettings() throws IOException {
    List<String> unexpected = new ArrayList<>();
    if (!expected.getZeroing().equals(getZeroing())) {
      unexpected.add("zeroing");
    }
    if (!expected.getInterleave().equals(getInterleave())) {
      unexpected.add("interleave");
    }
    if (Math.abs(expected.getSampleRate() - getSampleRate()) > RELATIVE_TOLERANCE * expected.getSampleRate()) {
      unexpected.add("sample rate");
    }
    if (!sameMnemonic(expected.getRunMode(), getRunMode())) {
      unexpected.add("run mode");
    }
    if (!sameMnemonic(expected.getClockSource(), getClockSource())) {
      unexpected.add("clock source");
    }
    if (!sameMnemonic(expected.getReferenceSource(), getReferenceSource())) {
      unexpected.add("reference source");
    }
    return unexpected;
  }

  static boolean sameMnemonic(String a, String b) {
    String x = a.trim().toUpperCase();
    String y = b.trim().toUpperCase();
    return x.startsWith(y) || y.startsWith(x);
  }

  /**
   * Start output.  With unexpected settings this either refuses, or when {@code restoreExpected} is set, pushes the
   * configured settings first.
   */
  public void run(boolean restoreExpected) throws IOException {
    List<String> unexpected = unexpectedSettings();
    if (!unexpected.isEmpty()) {
      if (!restoreExpected) {
        throw new IllegalStateException(
            String.format("Unexpected AWG settings: %s", StringUtils.join(unexpected, ", ")));
      }
      LOGGER.warn("Restoring AWG settings before output: %s", StringUtils.join(unexpected, ", "));
      applyExpectedSettings();
    }
    connection.write("AWGControl:RUN");
  }

  public void stop() throws IOException {
    connection.write("AWGControl:STOP");
  }

  @Override
  public void close() throws IOException {
    connection.close();
  }
}
