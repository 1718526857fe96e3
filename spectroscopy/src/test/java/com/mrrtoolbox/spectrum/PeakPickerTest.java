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

package com.mrrtoolbox.spectrum;

import com.mrrtoolbox.errors.InvalidParameterException;
import com.mrrtoolbox.errors.MissingRequiredInputException;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PeakPickerTest {
  private static final double[] FREQS = new double[] {0.0, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0};

  private Spectrum spectrum;

  @Before
  public void setUp() throws Exception {
    spectrum = Spectrum.fromFrequencyAndIntensity(FREQS,
        new double[] {0.0, 2.0, 0.0, 6.0, 0.0, 10.0, 0.0, 4.0, 0.0, 8.0});
  }

  @Test
  public void testPlateauReportsMiddleSample() {
    assertEquals(Collections.singletonList(3), PeakPicker.localMaxima(new double[] {0, 1, 3, 3, 3, 1, 0}));
    assertEquals("Even plateaus report the lower middle sample",
        Collections.singletonList(1), PeakPicker.localMaxima(new double[] {0, 2, 2, 0}));
  }

  @Test
  public void testEdgesAreNeverPeaks() {
    assertTrue(PeakPicker.localMaxima(new double[] {5, 1, 0, 1, 5}).isEmpty());
    assertTrue("A plateau running into the last sample is not a peak",
        PeakPicker.localMaxima(new double[] {0, 1, 1, 1}).isEmpty());
  }

  @Test
  public void testFindPeaksAppliesHeightFloor() {
    double[] signal = new double[] {0, 2, 0, 6, 0};
    assertEquals(Arrays.asList(1, 3), PeakPicker.findPeaks(signal, 2.0));
    assertEquals(Collections.singletonList(3), PeakPicker.findPeaks(signal, 2.5));
  }

  @Test
  public void testThresholdIsMonotonic() {
    double previous = Double.MAX_VALUE;
    for (double threshold : new double[] {1.0, 3.0, 5.0, 7.0, 9.0}) {
      Map<Double, Double> peaks = PeakPicker.peakPick(spectrum, threshold, null);
      assertTrue("Raising the threshold never adds peaks", peaks.size() <= previous);
      for (Double intensity : peaks.values()) {
        assertTrue(intensity >= threshold);
      }
      previous = peaks.size();
    }
    assertEquals("The last sample is never a peak", 4, PeakPicker.peakPick(spectrum, 1.0, null).size());
  }

  @Test
  public void testDynamicRangeFloorIsRelativeToMaximum() {
    assertEquals(2.5, PeakPicker.heightFloor(spectrum, 1, null, 4.0), 1e-12);
    Map<Double, Double> peaks = PeakPicker.peakPick(spectrum, null, 2.0);
    assertEquals(Arrays.asList(3.0, 5.0), Arrays.asList(peaks.keySet().toArray(new Double[0])));
  }

  @Test(expected = InvalidParameterException.class)
  public void testBothThresholdsAreRejected() {
    PeakPicker.peakPick(spectrum, 1.0, 2.0);
  }

  @Test(expected = MissingRequiredInputException.class)
  public void testNeitherThresholdIsRejected() {
    PeakPicker.peakPick(spectrum, null, null);
  }

  @Test
  public void testSortedPeaksStrongestFirst() {
    List<Peak> peaks = PeakPicker.peakPickSorted(spectrum, 1.0, null);
    assertEquals(5.0, peaks.get(0).getFrequency(), 0.0);
    assertEquals(3.0, peaks.get(1).getFrequency(), 0.0);
    assertEquals(7.0, peaks.get(2).getFrequency(), 0.0);
  }

  @Test
  public void testSimulatePeakPickDrawsPickedLines() {
    SimulationParameters params = new SimulationParameters(0.0, 9.0, 0.5, 1.0, null);
    Pair<Map<Double, Double>, Spectrum> result = PeakPicker.simulatePeakPick(spectrum, 1, 9.0, null, params);
    assertEquals(1, result.getLeft().size());
    assertEquals(10.0, result.getRight().getIntensity(5.0), 1e-12);
    assertEquals(10.0, result.getRight().getMaxIntensity(1), 1e-12);
  }

  @Test
  public void testSequenceMeasurementMergesNeighbouringRows() {
    double[] first = new double[] {0, 0, 0, 0.5, 0.2, 0, 0, 0, 0.3, 0};
    double[] second = new double[] {0, 0, 0, 0.3, 0.9, 0.1, 0, 0, 0, 0};
    Spectrum matrix = new Spectrum(new double[][] {FREQS, first, second});

    List<Integer> rows = PeakPicker.peakPickSequenceMeasurement(matrix, null);
    assertEquals("Rows 3 and 4 are one transition, kept at the strongest sample", Arrays.asList(4, 8), rows);
    assertArrayEquals(new double[] {4.0, 0.2, 0.9}, matrix.getRow(rows.get(0)), 0.0);
    assertArrayEquals(new double[] {8.0, 0.3, 0.0}, matrix.getRow(rows.get(1)), 0.0);
  }

  @Test
  public void testSequenceMeasurementThreshold() {
    double[] first = new double[] {0, 0, 0, 0.5, 0.2, 0, 0, 0, 0.3, 0};
    Spectrum matrix = new Spectrum(new double[][] {FREQS, first});
    assertEquals(1, PeakPicker.peakPickSequenceMeasurement(matrix, 0.4).size());
  }
}
