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

package com.mrrtoolbox.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mrrtoolbox.fid.FftParameters;
import com.mrrtoolbox.pickett.PickettRunner;
import com.mrrtoolbox.spectrum.SimulationParameters;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Defaults shared by the command line tools: FFT processing, simulation grid, where the Pickett programs live and the
 * automated fit limits.  Any section left out of a config file keeps its built-in defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolboxConfig {
  public static final String DEFAULT_CONFIG_RESOURCE = "toolbox_config.json";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @JsonProperty("fft")
  private FftParameters fft = new FftParameters();

  @JsonProperty("simulation")
  private SimulationParameters simulation = new SimulationParameters();

  // Directory holding spfit, spcat and piform; null to use the PATH.
  @JsonProperty("pickett_directory")
  private String pickettDirectory;

  @JsonProperty("pickett_timeout_seconds")
  private Long pickettTimeoutSeconds;

  @JsonProperty("final_fit")
  private FinalFitSettings finalFit = new FinalFitSettings();

  public ToolboxConfig() {}

  public static ToolboxConfig load(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, ToolboxConfig.class);
  }

  /**
   * @return The config bundled on the classpath, or built-in defaults if there is none.
   */
  public static ToolboxConfig loadDefault() throws IOException {
    try (InputStream is = ToolboxConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
      if (is == null) {
        return new ToolboxConfig();
      }
      return OBJECT_MAPPER.readValue(is, ToolboxConfig.class);
    }
  }

  public PickettRunner pickettRunner() {
    return new PickettRunner(pickettDirectory == null ? null : new File(pickettDirectory), pickettTimeoutSeconds);
  }

  public FftParameters getFft() {
    return fft;
  }

  public SimulationParameters getSimulation() {
    return simulation;
  }

  public String getPickettDirectory() {
    return pickettDirectory;
  }

  public void setPickettDirectory(String pickettDirectory) {
    this.pickettDirectory = pickettDirectory;
  }

  public Long getPickettTimeoutSeconds() {
    return pickettTimeoutSeconds;
  }

  public FinalFitSettings getFinalFit() {
    return finalFit;
  }
}
