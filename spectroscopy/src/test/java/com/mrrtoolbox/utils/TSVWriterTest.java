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

package com.mrrtoolbox.utils;

import com.mrrtoolbox.errors.InvalidParameterException;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class TSVWriterTest {
  private File tempDir;

  @Before
  public void setUp() throws Exception {
    tempDir = Files.createTempDirectory("tsv-writer").toFile();
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(tempDir);
  }

  @Test
  public void testHeaderAndRows() throws Exception {
    File file = new File(tempDir, "out.txt");
    try (TSVWriter writer = new TSVWriter(Arrays.asList("freq", "intensity"))) {
      writer.open(file);
      writer.append(new double[]{3000.5, 2.0});
      Map<String, Object> row = new HashMap<>();
      row.put("intensity", 4.0);
      row.put("freq", 3001.0);
      writer.append(row);
    }
    List<String> lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
    assertEquals(Arrays.asList("freq\tintensity", "3000.5\t2.0", "3001.0\t4.0"), lines);
  }

  @Test(expected = InvalidParameterException.class)
  public void testRowWidthMustMatchHeader() throws Exception {
    try (TSVWriter writer = new TSVWriter(Arrays.asList("freq", "intensity"))) {
      writer.open(new File(tempDir, "bad.txt"));
      writer.append(new double[]{1.0});
    }
  }
}
