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
import com.mrrtoolbox.utils.NumericUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A frequency-domain spectrum stored column-wise: column 0 is frequency in MHz on a uniform grid, columns 1..N are
 * intensities measured (or simulated) on that grid.
 *
 * The grid spacing is taken from the first two rows; every row/frequency conversion assumes the axis is uniform.
 */
public class Spectrum {
  public static final int FREQUENCY_COLUMN = 0;
  public static final int DEFAULT_INTENSITY_COLUMN = 1;

  public enum SignalMaxMode {
    // Report one maximum per frequency.
    SINGLES,
    // Report one maximum for the block spanning all frequencies.
    GROUP,
  }

  private final double[][] columns;
  private final Double pointSpacing;
  private final Double freqMin;
  private final Double freqMax;
  private final double[] maxIntensity;

  /**
   * @param columns column[0] holds frequencies, the remaining columns intensities; all columns must be the same
   *                length and hold at least two rows.
   */
  public Spectrum(double[][] columns) {
    if (columns == null || columns.length < 2) {
      throw new InvalidParameterException("A spectrum needs a frequency column and at least one intensity column");
    }
    int rows = columns[0].length;
    if (rows < 2) {
      throw new InvalidParameterException(String.format("A spectrum needs at least two rows, got %d", rows));
    }
    this.columns = new double[columns.length][];
    for (int c = 0; c < columns.length; c++) {
      if (columns[c].length != rows) {
        throw new InvalidParameterException(
            String.format("Column %d has %d rows, expected %d", c, columns[c].length, rows));
      }
      this.columns[c] = Arrays.copyOf(columns[c], rows);
    }
    double[] f = this.columns[FREQUENCY_COLUMN];
    this.pointSpacing = f[1] - f[0];
    this.freqMin = f[0];
    this.freqMax = f[rows - 1];
    this.maxIntensity = new double[columns.length - 1];
    for (int c = 1; c < columns.length; c++) {
      double max = Double.NEGATIVE_INFINITY;
      for (double v : this.columns[c]) {
        max = Math.max(max, v);
      }
      this.maxIntensity[c - 1] = max;
    }
  }

  public static Spectrum fromFrequencyAndIntensity(double[] freqs, double[] intensities) {
    return new Spectrum(new double[][] {freqs, intensities});
  }

  public int getRowCount() {
    return columns[FREQUENCY_COLUMN].length;
  }

  public int getColumnCount() {
    return columns.length;
  }

  public int getIntensityColumnCount() {
    return columns.length - 1;
  }

  public Double getPointSpacing() {
    return pointSpacing;
  }

  public Double getFreqMin() {
    return freqMin;
  }

  public Double getFreqMax() {
    return freqMax;
  }

  /**
   * @param column 1-based intensity column.
   */
  public Double getMaxIntensity(int column) {
    checkIntensityColumn(column);
    return maxIntensity[column - 1];
  }

  public double[] getMaxIntensities() {
    return Arrays.copyOf(maxIntensity, maxIntensity.length);
  }

  public double[] getColumn(int column) {
    return Arrays.copyOf(columns[column], columns[column].length);
  }

  public double[] getFrequencies() {
    return getColumn(FREQUENCY_COLUMN);
  }

  public double[][] getColumns() {
    double[][] copy = new double[columns.length][];
    for (int c = 0; c < columns.length; c++) {
      copy[c] = Arrays.copyOf(columns[c], columns[c].length);
    }
    return copy;
  }

  public double getValue(int row, int column) {
    return columns[column][row];
  }

  /**
   * Nearest grid row for a frequency.  No bounds check: frequencies off the grid map to rows outside [0, rows).
   */
  public int freqToRow(Double freq) {
    return NumericUtils.roundToInt((freq - freqMin) / pointSpacing);
  }

  public Double rowToFreq(int row) {
    return NumericUtils.round4(row * pointSpacing + freqMin);
  }

  public boolean containsFrequency(Double freq) {
    int row = freqToRow(freq);
    return row >= 0 && row < getRowCount();
  }

  /**
   * @throws ArrayIndexOutOfBoundsException if the frequency lies off the grid.
   */
  public Double getIntensity(Double freq, int column) {
    checkIntensityColumn(column);
    return columns[column][freqToRow(freq)];
  }

  public Double getIntensity(Double freq) {
    return getIntensity(freq, DEFAULT_INTENSITY_COLUMN);
  }

  /**
   * @return Frequency rounded to 4 decimals to intensity, in grid order.
   */
  public Map<Double, Double> spectrumDictionary(int column) {
    checkIntensityColumn(column);
    Map<Double, Double> result = new LinkedHashMap<>();
    double[] f = columns[FREQUENCY_COLUMN];
    for (int r = 0; r < f.length; r++) {
      result.put(NumericUtils.round4(f[r]), columns[column][r]);
    }
    return result;
  }

  /**
   * The intensities of one row divided by their maximum, for comparing a transition across a sequence of
   * measurements.
   * @return [freq, max, I_1 / max, ..., I_N / max]
   */
  public double[] normalizeTransition(Double freq) {
    int row = freqToRow(freq);
    int n = getIntensityColumnCount();
    double max = Double.NEGATIVE_INFINITY;
    for (int c = 1; c <= n; c++) {
      max = Math.max(max, columns[c][row]);
    }
    double[] result = new double[n + 2];
    result[0] = freq;
    result[1] = max;
    for (int c = 1; c <= n; c++) {
      result[c + 1] = columns[c][row] / max;
    }
    return result;
  }

  /**
   * @return Rows of the matrix at the grid rows nearest each frequency; each row is [freq, I_1, ..., I_N].
   */
  public double[][] getRows(Collection<Double> freqs) {
    double[][] rows = new double[freqs.size()][];
    int i = 0;
    for (Double f : freqs) {
      rows[i++] = getRow(freqToRow(f));
    }
    return rows;
  }

  public double[] getRow(int row) {
    double[] result = new double[columns.length];
    for (int c = 0; c < columns.length; c++) {
      result[c] = columns[c][row];
    }
    return result;
  }

  /**
   * Find the strongest sample near each frequency, searching every intensity column.
   *
   * The window around a row spans {@code rint(deltaFreq / pointSpacing)} rows below and one more than that above.
   * In GROUP mode a single window spans from the lowest frequency to the highest.  Windows are clipped to the grid.
   *
   * @return High points in descending order of intensity; ties keep their input order.
   */
  public List<HighPoint> signalMax(Collection<Double> freqs, Double deltaFreq, SignalMaxMode mode) {
    List<Double> sorted = new ArrayList<>(freqs);
    sorted.sort(Comparator.naturalOrder());
    int neg = NumericUtils.roundToInt((deltaFreq == null ? 0.0 : deltaFreq) / pointSpacing);
    int pos = neg + 1;

    List<HighPoint> result = new ArrayList<>();
    if (sorted.isEmpty()) {
      return result;
    }
    if (mode == SignalMaxMode.GROUP) {
      result.add(windowMax(freqToRow(sorted.get(0)) - neg, freqToRow(sorted.get(sorted.size() - 1)) + pos));
    } else {
      for (Double f : sorted) {
        int row = freqToRow(f);
        result.add(windowMax(row - neg, row + pos));
      }
    }
    result.sort((a, b) -> Double.compare(b.getIntensity(), a.getIntensity()));
    return result;
  }

  public List<HighPoint> signalMax(Collection<Double> freqs, Double deltaFreq) {
    return signalMax(freqs, deltaFreq, SignalMaxMode.SINGLES);
  }

  private HighPoint windowMax(int fromRow, int toRow) {
    int from = Math.max(0, fromRow);
    int to = Math.min(getRowCount(), toRow);
    if (from >= to) {
      throw new InvalidParameterException(
          String.format("Search window rows [%d, %d) does not overlap the spectrum", fromRow, toRow));
    }
    int bestRow = from;
    int bestColumn = 1;
    double best = Double.NEGATIVE_INFINITY;
    // Row-major scan so the first maximum in row order wins.
    for (int r = from; r < to; r++) {
      for (int c = 1; c < columns.length; c++) {
        if (columns[c][r] > best) {
          best = columns[c][r];
          bestRow = r;
          bestColumn = c;
        }
      }
    }
    return new HighPoint(columns[FREQUENCY_COLUMN][bestRow], best, bestColumn);
  }

  /**
   * Combine spectra measured on the same grid into one matrix: the first spectrum's frequencies, followed by every
   * intensity column of every spectrum in order.
   */
  public static Spectrum buildMatrix(List<Spectrum> spectra) {
    if (spectra == null || spectra.isEmpty()) {
      throw new InvalidParameterException("At least one spectrum is needed to build a matrix");
    }
    int rows = spectra.get(0).getRowCount();
    List<double[]> cols = new ArrayList<>();
    cols.add(spectra.get(0).getFrequencies());
    for (Spectrum s : spectra) {
      if (s.getRowCount() != rows) {
        throw new InvalidParameterException(
            String.format("Cannot stack spectra with %d and %d rows", rows, s.getRowCount()));
      }
      for (int c = 1; c < s.getColumnCount(); c++) {
        cols.add(s.getColumn(c));
      }
    }
    return new Spectrum(cols.toArray(new double[0][]));
  }

  /**
   * A copy of this spectrum's grid with new intensities in place of the existing ones.
   */
  public Spectrum withIntensities(double[]... intensities) {
    double[][] cols = new double[intensities.length + 1][];
    cols[0] = getFrequencies();
    System.arraycopy(intensities, 0, cols, 1, intensities.length);
    return new Spectrum(cols);
  }

  private void checkIntensityColumn(int column) {
    if (column < 1 || column >= columns.length) {
      throw new InvalidParameterException(
          String.format("Intensity column %d does not exist; valid columns are 1..%d", column, columns.length - 1));
    }
  }
}
