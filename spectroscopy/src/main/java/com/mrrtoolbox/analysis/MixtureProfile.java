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
import com.mrrtoolbox.errors.NoConvergenceException;
import com.mrrtoolbox.pickett.CatFile;
import com.mrrtoolbox.pickett.CatFilter;
import com.mrrtoolbox.spectrum.HighPoint;
import com.mrrtoolbox.spectrum.PeakPicker;
import com.mrrtoolbox.spectrum.Spectrum;
import com.mrrtoolbox.utils.NumericUtils;
import com.mrrtoolbox.utils.TSVWriter;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Signal profiles of transitions across a sequence of spectra, such as a nozzle temperature ramp.
 *
 * Transitions of one species rise and fall together, so the shape of each transition's normalized intensity against
 * the sequence position (its mean position, area and width) groups transitions by carrier.
 */
public class MixtureProfile {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MixtureProfile.class);

  public static final Double DEFAULT_X_MIN = 1.0;
  public static final Double DEFAULT_X_INCREMENT = 1.0;
  public static final Double DEFAULT_NUM_STD = 3.0;
  public static final double HALF_MAX = 0.5;
  public static final int MAX_OUTLIER_PASSES = 1000;

  // Columns of a characterization row.
  public static final int FREQUENCY_COLUMN = 0;
  public static final int MEAN_X_COLUMN = 1;
  public static final int AREA_COLUMN = 2;
  public static final int WIDTH_COLUMN = 3;
  public static final int[] CHARACTERIZATION_COLUMNS = new int[]{MEAN_X_COLUMN, AREA_COLUMN, WIDTH_COLUMN};

  public static final List<String> TSV_HEADER = Collections.unmodifiableList(
      Arrays.asList("Frequency (MHz)", "Mean X", "Area", "Width"));

  private MixtureProfile() {}

  static double[] xValues(int n, Double xmin, Double increment) {
    double start = xmin == null ? DEFAULT_X_MIN : xmin;
    double step = increment == null ? DEFAULT_X_INCREMENT : increment;
    if (!(step > 0.0)) {
      throw new InvalidParameterException(String.format("X increment must be positive, got %f", step));
    }
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = start + i * step;
    }
    return x;
  }

  /**
   * Intensity weighted mean position along the sequence.  Intensities need not be normalized.
   */
  public static double meanXAxis(double[] intensities, Double xmin, Double increment) {
    double[] x = xValues(intensities.length, xmin, increment);
    double weighted = 0.0;
    double total = 0.0;
    for (int i = 0; i < intensities.length; i++) {
      weighted += intensities[i] * x[i];
      total += intensities[i];
    }
    return weighted / total;
  }

  /**
   * Trapezoidal area under the intensity profile.
   */
  public static double areaUnderCurve(double[] intensities, Double xmin, Double increment) {
    double[] x = xValues(intensities.length, xmin, increment);
    double area = 0.0;
    for (int i = 0; i + 1 < intensities.length; i++) {
      area += (x[i + 1] - x[i]) * (intensities[i] + intensities[i + 1]) / 2.0;
    }
    return area;
  }

  /**
   * Width of a normalized profile from its half maximum crossings.
   *
   * Crossings are found by linear interpolation strictly inside each segment.  With one crossing the width runs to the
   * crossing when it follows the maximum, and from the crossing to the last position otherwise.  Two crossings give
   * half their separation, more give the outermost span and none give 0.
   *
   * @return (number of crossings, width)
   */
  public static Pair<Integer, Double> curveWidth(double[] normalized, Double xmin, Double increment) {
    double[] x = xValues(normalized.length, xmin, increment);
    if (normalized.length == 0) {
      return Pair.of(0, 0.0);
    }
    int maxIndex = 0;
    for (int i = 1; i < normalized.length; i++) {
      if (normalized[i] > normalized[maxIndex]) {
        maxIndex = i;
      }
    }
    double xAtMax = x[maxIndex];

    List<Double> crossings = new ArrayList<>();
    for (int i = 0; i + 1 < normalized.length; i++) {
      double slope = (normalized[i + 1] - normalized[i]) / (x[i + 1] - x[i]);
      double intercept = normalized[i] - slope * x[i];
      double crossing = (HALF_MAX - intercept) / slope;
      // A flat segment gives an infinite or NaN crossing, which fails both comparisons.
      if (x[i] < crossing && crossing < x[i + 1]) {
        crossings.add(crossing);
      }
    }

    double width;
    if (crossings.size() == 1) {
      double c = crossings.get(0);
      if (c > xAtMax) {
        width = c;
      } else {
        width = x[x.length - 1] - c;
      }
    } else if (crossings.size() == 2) {
      width = Math.abs(crossings.get(0) - crossings.get(1)) / 2.0;
    } else if (crossings.size() > 2) {
      width = Collections.max(crossings) - Collections.min(crossings);
    } else {
      width = 0.0;
    }
    return Pair.of(crossings.size(), width);
  }

  /**
   * Rows surviving repeated sigma trimming, with the mean and population standard deviation of each tested column on
   * its last pass.
   */
  public static class OutlierResult {
    private final double[][] rows;
    private final double[] means;
    private final double[] stds;

    OutlierResult(double[][] rows, double[] means, double[] stds) {
      this.rows = rows;
      this.means = means;
      this.stds = stds;
    }

    public double[][] getRows() {
      return rows;
    }

    public double[] getMeans() {
      return means;
    }

    public double[] getStds() {
      return stds;
    }
  }

  /**
   * For each column in turn, drop rows whose value lies outside mean +/- numStd * std, recomputing the bounds until a
   * pass drops nothing.  Later columns are tested on the rows earlier columns kept.
   *
   * @param columns Columns to test; null for all.
   * @param numStd Null for 3.
   * @throws NoConvergenceException if a column is still losing rows after {@link #MAX_OUTLIER_PASSES} passes.
   */
  public static OutlierResult outlierTest(double[][] rows, int[] columns, Double numStd)
      throws NoConvergenceException {
    double k = numStd == null ? DEFAULT_NUM_STD : numStd;
    int[] cols = columns;
    if (cols == null) {
      int width = rows.length == 0 ? 0 : rows[0].length;
      cols = new int[width];
      for (int i = 0; i < width; i++) {
        cols[i] = i;
      }
    }

    List<double[]> kept = new ArrayList<>(Arrays.asList(rows));
    double[] means = new double[cols.length];
    double[] stds = new double[cols.length];
    for (int c = 0; c < cols.length; c++) {
      int col = cols[c];
      boolean stable = false;
      for (int pass = 0; pass < MAX_OUTLIER_PASSES && !stable; pass++) {
        double[] values = column(kept, col);
        if (values.length == 0) {
          means[c] = Double.NaN;
          stds[c] = Double.NaN;
          stable = true;
          continue;
        }
        double mean = NumericUtils.mean(values);
        double std = NumericUtils.populationStd(values);
        means[c] = mean;
        stds[c] = std;
        List<double[]> next = new ArrayList<>(kept.size());
        for (double[] row : kept) {
          if (row[col] >= mean - k * std && row[col] <= mean + k * std) {
            next.add(row);
          }
        }
        stable = next.size() == kept.size();
        kept = next;
      }
      if (!stable) {
        throw new NoConvergenceException(
            String.format("Outlier trimming of column %d did not settle", col), MAX_OUTLIER_PASSES);
      }
    }
    LOGGER.debug("Outlier test kept %d of %d rows", kept.size(), rows.length);
    return new OutlierResult(kept.toArray(new double[0][]), means, stds);
  }

  private static double[] column(List<double[]> rows, int col) {
    double[] values = new double[rows.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = rows.get(i)[col];
    }
    return values;
  }

  /**
   * Characterization rows [freq, meanX, area, width] with the normalized profiles they came from.  Each profile is
   * [freq, max, I_1 / max, ..., I_N / max].
   */
  public static class Characterization {
    private final double[][] rows;
    private final double[][] normalized;

    Characterization(double[][] rows, double[][] normalized) {
      this.rows = rows;
      this.normalized = normalized;
    }

    public double[][] getRows() {
      return rows;
    }

    public double[][] getNormalized() {
      return normalized;
    }

    public void writeTsv(File file) throws IOException {
      try (TSVWriter writer = new TSVWriter(TSV_HEADER)) {
        writer.open(file);
        for (double[] row : rows) {
          writer.append(row);
        }
      }
    }
  }

  static double[] characterizationRow(double[] profile) {
    double[] intensities = Arrays.copyOfRange(profile, 2, profile.length);
    return new double[]{
        profile[0],
        meanXAxis(intensities, null, null),
        areaUnderCurve(intensities, null, null),
        curveWidth(intensities, null, null).getRight()
    };
  }

  /**
   * Characterize the predicted transitions of one species.  The catalog is cut to the matrix range and the dynamic
   * range, each line is located at the strongest sample within two grid points, and outliers in mean position, area
   * and width are trimmed at 3 sigma.
   */
  public static Characterization characterize(Spectrum matrix, CatFile cat, Double dynRange)
      throws NoConvergenceException {
    CatFilter filter = new CatFilter().freqMin(matrix.getFreqMin()).freqMax(matrix.getFreqMax()).dynRange(dynRange);
    List<Double> catFreqs = new ArrayList<>(cat.filter(filter).keySet());
    List<HighPoint> highPoints = matrix.signalMax(catFreqs, 2 * matrix.getPointSpacing());

    double[][] normalized = new double[highPoints.size()][];
    double[][] rows = new double[highPoints.size()][];
    for (int i = 0; i < highPoints.size(); i++) {
      normalized[i] = matrix.normalizeTransition(highPoints.get(i).getFrequency());
      rows[i] = characterizationRow(normalized[i]);
    }
    OutlierResult filtered = outlierTest(rows, CHARACTERIZATION_COLUMNS, DEFAULT_NUM_STD);
    LOGGER.info("Characterized %d of %d predicted transitions", filtered.getRows().length, rows.length);
    return new Characterization(filtered.getRows(), normalized);
  }

  /**
   * Characterize every transition found by a sequence peak pick of the matrix.  Profiles that never cross half maximum
   * are dropped.
   */
  public static Characterization characterizeAll(Spectrum matrix, Double threshold) {
    List<Integer> picked = PeakPicker.peakPickSequenceMeasurement(matrix, threshold);
    List<double[]> normalized = new ArrayList<>();
    List<double[]> rows = new ArrayList<>();
    for (Integer row : picked) {
      double[] profile = matrix.normalizeTransition(matrix.rowToFreq(row));
      double[] intensities = Arrays.copyOfRange(profile, 2, profile.length);
      if (curveWidth(intensities, null, null).getLeft() == 0) {
        continue;
      }
      normalized.add(profile);
      rows.add(characterizationRow(profile));
    }
    LOGGER.info("Characterized %d of %d tracked transitions", rows.size(), picked.size());
    return new Characterization(rows.toArray(new double[0][]), normalized.toArray(new double[0][]));
  }
}
