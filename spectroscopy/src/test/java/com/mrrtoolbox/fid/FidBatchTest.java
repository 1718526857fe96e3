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

import com.mrrtoolbox.errors.InvalidParameterException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FidBatchTest {
  private File workingDir;

  @Before
  public void setUp() throws Exception {
    workingDir = Files.createTempDirectory("fid-batch-test").toFile();
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(workingDir);
  }

  @Test
  public void testWeightsComeFromAveragesToken() {
    Pair<Integer, List<Integer>> weights = FidBatch.weightsAndTotalAverages(Arrays.asList(
        new File("Menthol_100k_2to8.txt"), new File("Menthol_50k_2to8.txt")));
    assertEquals(Integer.valueOf(150), weights.getLeft());
    assertEquals(Arrays.asList(100, 50), weights.getRight());
  }

  @Test(expected = InvalidParameterException.class)
  public void testMissingAveragesTokenIsRejected() {
    FidBatch.weightsAndTotalAverages(Arrays.asList(new File("Menthol_2to8.txt")));
  }

  @Test
  public void testCoAddNameReplacesLeadingFieldAndTotal() {
    assertEquals("CoAdd_150k_2to8", FidBatch.coAddName(new File("Menthol_100k_2to8.txt"), 150));
  }

  @Test
  public void testCoAddWeightsByAverages() throws Exception {
    File first = new File(workingDir, "Run1_100k.txt");
    File second = new File(workingDir, "Run2_50k.txt");
    FidFile.writeSamples(first, new double[] {1.0, 2.0, 3.0});
    FidFile.writeSamples(second, new double[] {4.0, 8.0, -3.0});

    Pair<String, WaveformSample> coAdd = FidBatch.coAdd(Arrays.asList(first, second), null);
    assertEquals("CoAdd_150k", coAdd.getLeft());
    assertArrayEquals(new double[] {2.0, 4.0, 1.0}, coAdd.getRight().getSamples(), 1e-9);
    assertEquals(FidFile.DEFAULT_SAMPLE_RATE, coAdd.getRight().getSampleRate());

    File saved = FidBatch.saveCoAdd(workingDir, coAdd);
    assertTrue(saved.exists());
    assertArrayEquals(coAdd.getRight().getSamples(), FidFile.readSamples(saved), 1e-9);
  }

  @Test(expected = InvalidParameterException.class)
  public void testCoAddRejectsMismatchedLengths() throws Exception {
    File first = new File(workingDir, "Run1_10k.txt");
    File second = new File(workingDir, "Run2_10k.txt");
    FidFile.writeSamples(first, new double[] {1.0, 2.0});
    FidFile.writeSamples(second, new double[] {1.0, 2.0, 3.0});
    FidBatch.coAdd(Arrays.asList(first, second), null);
  }

  @Test
  public void testOutputNameEncodesParameters() {
    FftParameters params = new FftParameters(0.5, 9.5, 80.0, 2000.0, 8000.0, false);
    assertEquals("fid_FF5_KB95_TRL80.ft", FidBatch.outputName(new File("fid.txt"), params));
    params.setFullFt(true);
    assertEquals("fid_FF5_KB95_TRL80_full.ft", FidBatch.outputName(new File("fid.txt"), params));
  }
}
