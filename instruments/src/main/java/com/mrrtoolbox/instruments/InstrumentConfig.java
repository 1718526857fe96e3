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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Where the instruments live and the settings they are expected to hold.  Passed to each driver's constructor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstrumentConfig {
  public static final String DEFAULT_CONFIG_RESOURCE = "instrument_config.json";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("oscilloscope")
  private OscilloscopeSettings oscilloscope = new OscilloscopeSettings();

  @JsonProperty("awg")
  private AwgSettings awg = new AwgSettings();

  @JsonProperty("temperature_controllers")
  private TemperatureSettings temperatureControllers = new TemperatureSettings();

  public InstrumentConfig() {}

  public static InstrumentConfig load(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, InstrumentConfig.class);
  }

  /**
   * @return The config bundled on the classpath, or built-in defaults if there is none.
   */
  public static InstrumentConfig loadDefault() throws IOException {
    try (InputStream is = InstrumentConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
      if (is == null) {
        return new InstrumentConfig();
      }
      return OBJECT_MAPPER.readValue(is, InstrumentConfig.class);
    }
  }

  public OscilloscopeSettings getOscilloscope() {
    return oscilloscope;
  }

  public AwgSettings getAwg() {
    return awg;
  }

  public TemperatureSettings getTemperatureControllers() {
    return temperatureControllers;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Endpoint {
    @JsonProperty("host")
    private String host;

    @JsonProperty("port")
    private Integer port;

    @JsonProperty("timeout_millis")
    private Integer timeoutMillis;

    Endpoint() {}

    Endpoint(String host, Integer port, Integer timeoutMillis) {
      this.host = host;
      this.port = port;
      this.timeoutMillis = timeoutMillis;
    }

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public Integer getPort() {
      return port;
    }

    public void setPort(Integer port) {
      this.port = port;
    }

    public Integer getTimeoutMillis() {
      return timeoutMillis;
    }

    public void setTimeoutMillis(Integer timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
    }
  }

  /**
   * Digitizer connection and the data transfer settings a capture relies on.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class OscilloscopeSettings extends Endpoint {
    @JsonProperty("data_source")
    private String dataSource = "MATH2";

    @JsonProperty("data_encoding")
    private String dataEncoding = "ASCI";

    @JsonProperty("frame_start")
    private Integer frameStart = 9;

    @JsonProperty("frame_stop")
    private Integer frameStop = 9;

    @JsonProperty("data_start")
    private Integer dataStart = 1;

    @JsonProperty("data_stop")
    private Integer dataStop = 1000000;

    @JsonProperty("horizontal_delay")
    private Double horizontalDelay = 3.0e-6;

    public OscilloscopeSettings() {
      super("169.254.27.62", 4000, 10000);
    }

    public String getDataSource() {
      return dataSource;
    }

    public String getDataEncoding() {
      return dataEncoding;
    }

    public Integer getFrameStart() {
      return frameStart;
    }

    public Integer getFrameStop() {
      return frameStop;
    }

    public Integer getDataStart() {
      return dataStart;
    }

    public Integer getDataStop() {
      return dataStop;
    }

    public Double getHorizontalDelay() {
      return horizontalDelay;
    }
  }

  /**
   * Chirp source connection and the output settings that are safe for the amplifier chain.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class AwgSettings extends Endpoint {
    @JsonProperty("interleave")
    private Integer interleave = 1;

    @JsonProperty("zeroing")
    private Integer zeroing = 1;

    @JsonProperty("sample_rate")
    private Double sampleRate = 24e9;

    @JsonProperty("run_mode")
    private String runMode = "TRIG";

    @JsonProperty("clock_source")
    private String clockSource = "INT";

    @JsonProperty("reference_source")
    private String referenceSource = "EXT";

    public AwgSettings() {
      super("169.254.246.32", 4001, 5000);
    }

    public Integer getInterleave() {
      return interleave;
    }

    public Integer getZeroing() {
      return zeroing;
    }

    public Double getSampleRate() {
      return sampleRate;
    }

    public String getRunMode() {
      return runMode;
    }

    public String getClockSource() {
      return clockSource;
    }

    public String getReferenceSource() {
      return referenceSource;
    }
  }

  /**
   * Serial-over-ethernet bridge to the nozzle temperature controllers and their Modbus slave addresses.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TemperatureSettings extends Endpoint {
    @JsonProperty("slave_addresses")
    private List<Integer> slaveAddresses = new ArrayList<>(Arrays.asList(3, 4, 5));

    public TemperatureSettings() {
      super("192.168.1.200", 4001, 1000);
    }

    public List<Integer> getSlaveAddresses() {
      return slaveAddresses;
    }

    public void setSlaveAddresses(List<Integer> slaveAddresses) {
      this.slaveAddresses = slaveAddresses;
    }
  }
}
