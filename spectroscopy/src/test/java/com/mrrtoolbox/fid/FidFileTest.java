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

package com.mrrtoolbox.fid;

import com.mrrtoolbox.errors.MalformedFileException;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class FidFileTest {
  private File workingDir;

  @Before
  public void setUp() throws Exception {
    workingDir = Files.createTempDirectory("fid-file-test").toFile();
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(workingDir);
  }

  @Test
  public void testReadSkipsHeaderAndUsesLastColumn() throws Exception {
    File fid = new File(workingDir, "scope.txt");
    FileUtils.writeStringToFile(fid, "Time\tAmplitude\n0.0\t1.5\n4e-11\t-2.25\n\n", StandardCharsets.UTF_8);
    assertArrayEquals(new double[] {1.5, -2.25}, FidFile.readSamples(fid), 0.0);
  }

  @Test(expected = MalformedFileException.class)
  public void testGarbageAfterDataIsMalformed() throws Exception {
    File fid = new File(workingDir, "bad.txt");
    FileUtils.writeStringToFile(fid, "1.0\nnot-a-number\n", StandardCharsets.UTF_8);
    FidFile.readSamples(fid);
  }

  @Test(expected = MalformedFileException.class)
  public void testEmptyFileIsMalformed() throws Exception {
    File fid = new File(workingDir, "empty.txt");
    FileUtils.writeStringToFile(fid, "", StandardCharsets.UTF_8);
    FidFile.readSamples(fid);
  }

  @Test
  public void testSampleRateShorthands() {
    assertEquals(25e9, FidFile.resolveSampleRate(null), 0.0);
    assertEquals(25e9, FidFile.resolveSampleRate(25.0), 0.0);
    assertEquals(50e9, FidFile.resolveSampleRate(50.0), 0.0);
    assertEquals(12.5e9, FidFile.resolveSampleRate(12.5e9), 0.0);
  }

  @Test
  public void testAcquireUsesConfiguredRate() throws Exception {
    File fid = new File(workingDir, "scope.txt");
    FidFile.writeSamples(fid, new double[] {0.125, 0.25, 0.5});
    WaveformSource source = new FidFile(fid, 50.0);
    WaveformSample sample = source.acquire();
    assertEquals(3, sample.size());
    assertEquals(50e9, sample.getSampleRate(), 0.0);
  }
}
