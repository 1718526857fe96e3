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

import com.mrrtoolbox.fid.WaveformSample;
import com.mrrtoolbox.fid.WaveformSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Digitizing oscilloscope that captures the free induction decay, driven by SCPI.
 */
public class Oscilloscope implements WaveformSource, AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Oscilloscope.class);

  public static final String RUN = "RUN";
  public static final String STOP = "STOP";

  // Acquisition durations that fill the frame at the two supported sample rates (2-8 GHz and 6-18 GHz setups).
  static final Map<Double, Double> EXPECTED_DURATIONS = new HashMap<Double, Double>() {{
    put(25e9, 40e-6);
    put(50e9, 20e-6);
  }};

  private static final double RELATIVE_TOLERANCE = 1e-9;

  private final ScpiConnection connection;
  private final InstrumentConfig.OscilloscopeSettings expected;

  public Oscilloscope(ScpiConnection connection, InstrumentConfig.OscilloscopeSettings expected) {
    this.connection = connection;
    this.expected = expected;
  }

  public static Oscilloscope connect(InstrumentConfig.OscilloscopeSettings settings) throws IOException {
    return new Oscilloscope(new TcpScpiConnection(settings), settings);
  }

  public String idn() throws IOException {
    return connection.query("*IDN?");
  }

  public String getRunState() throws IOException {
    return connection.query("ACQuire:STATE?");
  }

  public void setRunState(String state) throws IOException {
    connection.write(String.format("ACQuire:STATE %s", state));
  }

  public Double getSampleRate() throws IOException {
    return queryDouble("HORizontal:MODe:SAMPLERate?");
  }

  public void setSampleRate(Double rate) throws IOException {
    connection.write(String.format("HORizontal:MODe:SAMPLERate %s", rate));
  }

  public Double getAcquisitionDuration() throws IOException {
    return queryDouble("HORizontal:ACQDURATION?");
  }

  public void setAcquisitionDuration(Double seconds) throws IOException {
    connection.write(String.format("HORizontal:ACQDURATION %s", seconds));
  }

  public Double getHorizontalDelay() throws IOException {
    return queryDouble("HORIZONTAL:DELAY:TIME?");
  }

  public void setHorizontalDelay(Double seconds) throws IOException {
    connection.write(String.format("HORIZONTAL:DELAY:TIME %s", seconds));
  }

  public String getDataSource() throws IOException {
    return unquote(connection.query("DATa:SOUrce?"));
  }

  public void setDataSource(String source) throws IOException {
    connection.write(String.format("DATa:SOUrce %s", source));
  }

  public String getDataEncoding() throws IOException {
    return unquote(connection.query("DATa:ENCdg?"));
  }

  public void setDataEncoding(String encoding) throws IOException {
    connection.write(String.format("DATa:ENCdg %s", encoding));
  }

  /**
   * Select which averaged frames a curve transfer returns.
   */
  public void setFrameRange(Integer start, Integer stop) throws IOException {
    connection.write(String.format("DATa:FRAMESTARt %d", start));
    connection.write(String.format("DATa:FRAMESTOP %d", stop));
  }

  public void setDataRange(Integer start, Integer stop) throws IOException {
    connection.write(String.format("DATa:STARt %d", start));
    connection.write(String.format("DATa:STOP %d", stop));
  }

  public Integer getFramesAcquired() throws IOException {
    return Integer.valueOf(connection.query("ACQuire:NUMFRAMESACQuired?"));
  }

  public void recallSetup(String fileName) throws IOException {
    connection.write(String.format("RECAll:SETUp \"%s\"", fileName));
    sendDataTransferDefaults();
  }

  public void sendDataTransferDefaults() throws IOException {
    setDataSource(expected.getDataSource());
    setDataEncoding(expected.getDataEncoding());
    setFrameRange(expected.getFrameStart(), expected.getFrameStop());
    setDataRange(expected.getDataStart(), expected.getDataStop());
  }

  /**
   * @return Names of settings that differ from the configured ones; empty when the instrument is ready.
   */
  public List<String> unexpectedSettings() throws IOException {
    List<String> unexpected = new ArrayList<>();
    if (!expected.getDataSource().equalsIgnoreCase(getDataSource())) {
      unexpected.add("data source");
    }
    if (!near(expected.getHorizontalDelay(), getHorizontalDelay())) {
      unexpected.add("horizontal delay");
    }
    Double rate = getSampleRate();
    for (Map.Entry<Double, Double> e : EXPECTED_DURATIONS.entrySet()) {
      if (near(e.getKey(), rate) && !near(e.getValue(), getAcquisitionDuration())) {
        unexpected.add("acquisition duration or sample rate");
      }
    }
    if (!expected.getDataEncoding().equalsIgnoreCase(getDataEncoding())) {
      unexpected.add("data encoding");
    }
    checkInteger(unexpected, "starting frame", expected.getFrameStart(), "DATa:FRAMESTARt?");
    checkInteger(unexpected, "ending frame", expected.getFrameStop(), "DATa:FRAMESTOP?");
    checkInteger(unexpected, "starting data point", expected.getDataStart(), "DATa:STARt?");
    checkInteger(unexpected, "ending data point", expected.getDataStop(), "DATa:STOP?");
    return unexpected;
  }

  private void checkInteger(List<String> unexpected, String name, Integer expectedValue, String query)
      throws IOException {
    if (!expectedValue.equals(Integer.valueOf(connection.query(query)))) {
      unexpected.add(name);
    }
  }

  /**
   * Start acquiring.  Refuses when any setting differs from the configured ones unless {@code force} is set.
   */
  public void run(boolean force) throws IOException {
    List<String> unexpected = unexpectedSettings();
    if (!unexpected.isEmpty()) {
      if (!force) {
        throw new IllegalStateException(
            String.format("Unexpected oscilloscope settings: %s", StringUtils.join(unexpected, ", ")));
      }
      LOGGER.warn("Acquiring with unexpected oscilloscope settings: %s", StringUtils.join(unexpected, ", "));
    }
    setRunState(RUN);
  }

  public void stop() throws IOException {
    setRunState(STOP);
  }

  public void clear() throws IOException {
    connection.write("CLEAR ALL");
  }

  /**
   * Transfer the current curve as ASCII and convert it to volts with the waveform preamble.
   */
  @Override
  public WaveformSample acquire() throws IOException {
    double yMult = queryDouble("WFMOutpre:YMUlt?");
    double yOff = queryDouble("WFMOutpre:YOFf?");
    double yZero = queryDouble("WFMOutpre:YZEro?");
    Double rate = getSampleRate();

    String[] fields = connection.query("CURVe?").split(",");
    double[] samples = new double[fields.length];
    for (int i = 0; i < fields.length; i++) {
      samples[i] = (Double.parseDouble(fields[i].trim()) - yOff) * yMult + yZero;
    }
    LOGGER.info("Acquired %d samples at %.3e samples/s", samples.length, rate);
    return new WaveformSample(samples, rate);
  }

  @Override
  public void close() throws IOException {
    connection.close();
  }

  private Double queryDouble(String query) throws IOException {
    return Double.valueOf(connection.query(query));
  }

  private static String unquote(String reply) {
    return StringUtils.strip(reply, "\"");
  }

  private static boolean near(Double expected, Double actual) {
    return Math.abs(expected - actual) <= RELATIVE_TOLERANCE * Math.abs(expected);
  }
}
