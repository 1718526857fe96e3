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

import com.mrrtoolbox.errors.InvalidParameterException;
import com.mrrtoolbox.pickett.CatFile;
import com.mrrtoolbox.pickett.Transition;
import com.mrrtoolbox.spectrum.Spectrum;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MixtureProfileTest {
  private Spectrum matrix;
  private File tempDir;

  @Before
  public void setUp() throws Exception {
    double[] freqs = new double[10];
    double[][] intensities = new double[3][10];
    for (int i = 0; i < freqs.length; i++) {
      freqs[i] = i;
    }
    // A transition that peaks in the middle sample and one of constant intensity.
    intensities[0][4] = 0.2;
    intensities[1][4] = 1.0;
    intensities[2][4] = 0.2;
    intensities[0][7] = 0.5;
    intensities[1][7] = 0.5;
    intensities[2][7] = 0.5;
    matrix = new Spectrum(new double[][]{freqs, intensities[0], intensities[1], intensities[2]});
    tempDir = Files.createTempDirectory("mixture-profile").toFile();
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(tempDir);
  }

  @Test
  public void testWidthFromTwoCrossings() {
    Pair<Integer, Double> width = MixtureProfile.curveWidth(new double[]{0.2, 1.0, 0.2}, null, null);
    assertEquals(Integer.valueOf(2), width.getLeft());
    assertEquals("Half the distance between 1.375 and 2.625", 0.625, width.getRight(), 1e-12);
  }

  @Test
  public void testWidthFromOneCrossing() {
    Pair<Integer, Double> after = MixtureProfile.curveWidth(new double[]{1.0, 0.2}, null, null);
    assertEquals(Integer.valueOf(1), after.getLeft());
    assertEquals("Crossing after the maximum is the width", 1.625, after.getRight(), 1e-12);

    Pair<Integer, Double> before = MixtureProfile.curveWidth(new double[]{0.2, 1.0}, null, null);
    assertEquals(Integer.valueOf(1), before.getLeft());
    assertEquals("Width runs from the crossing to the last position", 0.625, before.getRight(), 1e-12);
  }

  @Test
  public void testWidthWithoutCrossing() {
    Pair<Integer, Double> width = MixtureProfile.curveWidth(new double[]{1.0, 1.0, 0.8}, null, null);
    assertEquals(Integer.valueOf(0), width.getLeft());
    assertEquals(0.0, width.getRight(), 0.0);
  }

  @Test
  public void testWidthFromManyCrossingsIsOuterSpan() {
    Pair<Integer, Double> width = MixtureProfile.curveWidth(new double[]{0.2, 1.0, 0.2, 1.0}, null, null);
    assertEquals(Integer.valueOf(3), width.getLeft());
    assertEquals(2.0, width.getRight(), 1e-12);
  }

  @Test
  public void testWidthOfEmptyProfile() {
    Pair<Integer, Double> width = MixtureProfile.curveWidth(new double[0], null, null);
    assertEquals(Integer.valueOf(0), width.getLeft());
    assertEquals(0.0, width.getRight(), 0.0);
  }

  @Test
  public void testMeanAndArea() {
    assertEquals(2.0, MixtureProfile.meanXAxis(new double[]{0.0, 2.0}, null, null), 1e-12);
    assertEquals(2.0, MixtureProfile.areaUnderCurve(new double[]{0.0, 2.0, 0.0}, null, null), 1e-12);
    assertEquals("Positions start at 10 in steps of 5", 15.0,
        MixtureProfile.meanXAxis(new double[]{0.0, 2.0}, 10.0, 5.0), 1e-12);
    assertEquals(10.0, MixtureProfile.areaUnderCurve(new double[]{0.0, 2.0, 0.0}, 10.0, 5.0), 1e-12);
  }

  @Test(expected = InvalidParameterException.class)
  public void testNonPositiveIncrementIsRejected() {
    MixtureProfile.meanXAxis(new double[]{1.0}, 1.0, 0.0);
  }

  @Test
  public void testOutlierTestRepeatsUntilStable() throws Exception {
    double[][] rows = new double[21][];
    for (int i = 0; i < 20; i++) {
      rows[i] = new double[]{i, 2.0};
    }
    rows[20] = new double[]{20, 100.0};

    MixtureProfile.OutlierResult result = MixtureProfile.outlierTest(rows, new int[]{1}, null);
    assertEquals(20, result.getRows().length);
    assertEquals(2.0, result.getMeans()[0], 1e-12);
    assertEquals(0.0, result.getStds()[0], 1e-12);

    MixtureProfile.OutlierResult all = MixtureProfile.outlierTest(rows, null, null);
    assertEquals("Every column is tested when none are named", 2, all.getMeans().length);
    assertEquals(20, all.getRows().length);
  }

  @Test
  public void testOutlierTestOnNoRows() throws Exception {
    MixtureProfile.OutlierResult result = MixtureProfile.outlierTest(new double[0][], new int[]{0}, null);
    assertEquals(0, result.getRows().length);
    assertTrue(Double.isNaN(result.getMeans()[0]));
  }

  @Test
  public void testCharacterizeAllDropsFlatProfiles() {
    MixtureProfile.Characterization c = MixtureProfile.characterizeAll(matrix, 0.1);
    assertEquals("The constant transition never crosses half maximum", 1, c.getRows().length);
    assertArrayEquals(new double[]{4.0, 2.0, 1.2, 0.625}, c.getRows()[0], 1e-12);
    assertArrayEquals(new double[]{4.0, 1.0, 0.2, 1.0, 0.2}, c.getNormalized()[0], 1e-12);
  }

  @Test
  public void testCharacterizeFromCatalog() throws Exception {
    LinkedHashMap<Double, List<Transition>> groups = new LinkedHashMap<>();
    groups.put(4.0, Collections.singletonList(Transition.asymmetricTop(4.0, -3.0, 2, 1, 2, 1, 0, 1)));
    groups.put(7.0, Collections.singletonList(Transition.asymmetricTop(7.0, -3.0, 3, 1, 2, 2, 0, 2)));
    CatFile cat = new CatFile("mixture", groups);

    MixtureProfile.Characterization c = MixtureProfile.characterize(matrix, cat, null);
    assertEquals(2, c.getRows().length);
    assertEquals("Strongest transition first", 4.0, c.getRows()[0][MixtureProfile.FREQUENCY_COLUMN], 0.0);
    assertEquals(7.0, c.getRows()[1][MixtureProfile.FREQUENCY_COLUMN], 0.0);
    assertEquals(2.0, c.getRows()[1][MixtureProfile.MEAN_X_COLUMN], 1e-12);
    assertEquals(0.0, c.getRows()[1][MixtureProfile.WIDTH_COLUMN], 0.0);
  }

  @Test
  public void testWriteTsv() throws Exception {
    File out = new File(tempDir, "profile.txt");
    MixtureProfile.characterizeAll(matrix, 0.1).writeTsv(out);

    List<String> lines = FileUtils.readLines(out, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertEquals("Frequency (MHz)\tMean X\tArea\tWidth", lines.get(0));
  }
}
