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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Finds local maxima in spectra.
 */
public class PeakPicker {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakPicker.class);

  public static final Double DEFAULT_SEQUENCE_THRESHOLD = 0.001;

  private PeakPicker() {}

  /**
   * Indices of local maxima in a signal.  A sample is a peak if it rises above its left neighbour and the next
   * differing sample to its right is lower; a flat top reports its middle sample (the lower one when the plateau has
   * an even width).  The first and last samples are never peaks.
   */
  public static List<Integer> localMaxima(double[] signal) {
    List<Integer> peaks = new ArrayList<>();
    int i = 1;
    int last = signal.length - 1;
    while (i < last) {
      if (signal[i - 1] < signal[i]) {
        int ahead = i + 1;
        while (ahead < last && signal[ahead] == signal[i]) {
          ahead++;
        }
        if (signal[ahead] < signal[i]) {
          int left = i;
          int right = ahead - 1;
          peaks.add((left + right) / 2);
          i = ahead;
        }
      }
      i++;
    }
    return peaks;
  }

  /**
   * Local maxima of a signal whose height is at least {@code minHeight}.
   */
  public static List<Integer> findPeaks(double[] signal, double minHeight) {
    List<Integer> result = new ArrayList<>();
    for (Integer idx : localMaxima(signal)) {
      if (signal[idx] >= minHeight) {
        result.add(idx);
      }
    }
    return result;
  }

  /**
   * Resolve the height floor from exactly one of an absolute threshold or a dynamic range relative to the strongest
   * sample of the column.
   */
  public static Double heightFloor(Spectrum spectrum, int column, Double threshold, Double dynamicRange) {
    if (threshold != null && dynamicRange != null) {
      throw new InvalidParameterException("Supply either an intensity threshold or a dynamic range, not both");
    }
    if (threshold == null && dynamicRange == null) {
      throw new MissingRequiredInputException("Must provide either intensity threshold or dynamic range");
    }
    if (threshold != null) {
      return threshold;
    }
    if (!(dynamicRange > 0.0)) {
      throw new InvalidParameterException(String.format("Dynamic range must be positive, got %s", dynamicRange));
    }
    return spectrum.getMaxIntensity(column) / dynamicRange;
  }

  /**
   * @return Peak frequency to intensity, in frequency order.
   */
  public static Map<Double, Double> peakPick(Spectrum spectrum, int column, Double threshold, Double dynamicRange) {
    Double floor = heightFloor(spectrum, column, threshold, dynamicRange);
    double[] freqs = spectrum.getFrequencies();
    double[] signal = spectrum.getColumn(column);
    Map<Double, Double> result = new LinkedHashMap<>();
    for (Integer idx : findPeaks(signal, floor)) {
      result.put(freqs[idx], signal[idx]);
    }
    LOGGER.debug("Picked %d peaks at or above %.6f in column %d", result.size(), floor, column);
    return result;
  }

  public static Map<Double, Double> peakPick(Spectrum spectrum, Double threshold, Double dynamicRange) {
    return peakPick(spectrum, Spectrum.DEFAULT_INTENSITY_COLUMN, threshold, dynamicRange);
  }

  /**
   * @return Peaks from strongest to weakest; equal intensities keep frequency order.
   */
  public static List<Peak> peakPickSorted(Spectrum spectrum, int column, Double threshold, Double dynamicRange) {
    List<Peak> peaks = toPeaks(peakPick(spectrum, column, threshold, dynamicRange));
    peaks.sort((a, b) -> Double.compare(b.getIntensity(), a.getIntensity()));
    return peaks;
  }

  public static List<Peak> peakPickSorted(Spectrum spectrum, Double threshold, Double dynamicRange) {
    return peakPickSorted(spectrum, Spectrum.DEFAULT_INTENSITY_COLUMN, threshold, dynamicRange);
  }

  public static List<Peak> toPeaks(Map<Double, Double> peakPick) {
    List<Peak> peaks = new ArrayList<>(peakPick.size());
    for (Map.Entry<Double, Double> e : peakPick.entrySet()) {
      peaks.add(new Peak(e.getKey(), e.getValue()));
    }
    return peaks;
  }

  /**
   * Peak pick followed by a noise-free simulation of the picked lines.
   */
  public static Pair<Map<Double, Double>, Spectrum> simulatePeakPick(
      Spectrum spectrum, int column, Double threshold, Double dynamicRange, SimulationParameters params) {
    Map<Double, Double> pp = peakPick(spectrum, column, threshold, dynamicRange);
    Spectrum simulation = SpectrumSimulator.simulate(toPeaks(pp), params);
    return Pair.of(pp, simulation);
  }

  /**
   * Track transitions across a sequence of spectra held as intensity columns of one matrix.  A row seen as a peak in
   * any column is reported for every column.  Neighbouring peak rows, which are usually one transition straddling two
   * grid points, collapse to the row holding the group's strongest sample.
   *
   * @return The merged peak row indices, ascending.  {@link Spectrum#getRow(int)} gives [freq, I_1, ..., I_N].
   */
  public static List<Integer> peakPickSequenceMeasurement(Spectrum matrix, Double threshold) {
    double floor = threshold == null ? DEFAULT_SEQUENCE_THRESHOLD : threshold;
    TreeSet<Integer> peakRows = new TreeSet<>();
    for (int c = 1; c < matrix.getColumnCount(); c++) {
      peakRows.addAll(findPeaks(matrix.getColumn(c), floor));
    }

    List<List<Integer>> runs = new ArrayList<>();
    List<Integer> current = new ArrayList<>();
    for (Integer row : peakRows) {
      if (!current.isEmpty() && current.get(current.size() - 1) + 1 != row) {
        runs.add(current);
        current = new ArrayList<>();
      }
      current.add(row);
    }
    if (!current.isEmpty()) {
      runs.add(current);
    }

    TreeSet<Integer> finalRows = new TreeSet<>();
    for (List<Integer> run : runs) {
      if (run.size() == 1) {
        finalRows.add(run.get(0));
        continue;
      }
      List<Double> freqs = new ArrayList<>(run.size());
      for (Integer row : run) {
        freqs.add(matrix.getValue(row, Spectrum.FREQUENCY_COLUMN));
      }
      HighPoint best = matrix.signalMax(freqs, 0.0, Spectrum.SignalMaxMode.GROUP).get(0);
      finalRows.add(matrix.freqToRow(best.getFrequency()));
    }

    List<Integer> ordered = new ArrayList<>(finalRows);
    LOGGER.info("Tracked %d transitions across %d spectra", ordered.size(), matrix.getIntensityColumnCount());
    return ordered;
  }
}
