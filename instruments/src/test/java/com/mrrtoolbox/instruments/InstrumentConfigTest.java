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

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;

public class InstrumentConfigTest {
  private File tempDir;

  @Before
  public void setUp() throws Exception {
    tempDir = Files.createTempDirectory("instrument-config").toFile();
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(tempDir);
  }

  @Test
  public void testBundledConfig() throws Exception {
    InstrumentConfig config = InstrumentConfig.loadDefault();
    assertEquals("169.254.27.62", config.getOscilloscope().getHost());
    assertEquals(Integer.valueOf(4000), config.getOscilloscope().getPort());
    assertEquals("MATH2", config.getOscilloscope().getDataSource());
    assertEquals(3.0e-6, config.getOscilloscope().getHorizontalDelay(), 0.0);
    assertEquals(24.0e9, config.getAwg().getSampleRate(), 0.0);
    assertEquals("TRIG", config.getAwg().getRunMode());
    assertEquals(Arrays.asList(3, 4, 5), config.getTemperatureControllers().getSlaveAddresses());
  }

  @Test
  public void testOverridesKeepOtherDefaults() throws Exception {
    File file = new File(tempDir, "lab.json");
    FileUtils.writeStringToFile(file, "{\"temperature_controllers\": {\"host\": \"10.0.0.7\", "
        + "\"slave_addresses\": [1]}, \"awg\": {\"run_mode\": \"CONT\"}, \"unused\": true}", StandardCharsets.UTF_8);

    InstrumentConfig config = InstrumentConfig.load(file);
    assertEquals("10.0.0.7", config.getTemperatureControllers().getHost());
    assertEquals(Integer.valueOf(4001), config.getTemperatureControllers().getPort());
    assertEquals(Arrays.asList(1), config.getTemperatureControllers().getSlaveAddresses());
    assertEquals("CONT", config.getAwg().getRunMode());
    assertEquals("Unset sections keep their defaults", "ASCI", config.getOscilloscope().getDataEncoding());
  }
}
