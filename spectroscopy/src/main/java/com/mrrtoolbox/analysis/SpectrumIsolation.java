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
import com.mrrtoolbox.errors.MalformedFileException;
import com.mrrtoolbox.errors.NoConvergenceException;
import com.mrrtoolbox.fid.FftParameters;
import com.mrrtoolbox.fid.FidFile;
import com.mrrtoolbox.pickett.CatFile;
import com.mrrtoolbox.pickett.CatFilter;
import com.mrrtoolbox.pickett.Transition;
import com.mrrtoolbox.spectrum.Peak;
import com.mrrtoolbox.spectrum.PeakPicker;
import com.mrrtoolbox.spectrum.SimulationParameters;
import com.mrrtoolbox.spectrum.Spectrum;
import com.mrrtoolbox.spectrum.SpectrumFiles;
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Separate the lines of one component from a spectrum, either keeping only the regions around a set of peaks
 * (reveal) or blanking those regions (cut).
 */
public class SpectrumIsolation {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumIsolation.class);

  // The catalog simulation is scaled against its strongest low-Ka lines, which are the most reliably assigned.
  public static final Integer SCALE_KA_MAX = 3;
  public static final Double SCALE_DYN_RANGE = 10.0;

  private static final double EVEN_TOLERANCE = 1e-9;

  private SpectrumIsolation() {}

  /**
   * Widen a line width by one grid step unless it already spans an even number of steps.
   */
  public static double adjustedLineWidth(double lineWidth, double pointSpacing) {
    if (!(lineWidth > 0.0)) {
      throw new InvalidParameterException(String.format("Line width must be positive, got %f", lineWidth));
    }
    double steps = lineWidth / pointSpacing;
    double remainder = steps % 2.0;
    if (remainder > EVEN_TOLERANCE && 2.0 - remainder > EVEN_TOLERANCE) {
      return lineWidth + pointSpacing;
    }
    return lineWidth;
  }

  /**
   * @return Rows [from, to) of the window around a peak, clipped to the spectrum.  Empty when the peak lies off the
   * grid.
   */
  static int[] window(Spectrum target, double peak, double adjustedWidth) {
    double fmin = NumericUtils.round4(target.getFreqMin());
    double ps = target.getPointSpacing();
    int from = (int) ((peak - adjustedWidth / 2.0 - fmin) / ps);
    int to = (int) ((peak + adjustedWidth / 2.0 + ps - fmin) / ps);
    from = Math.max(0, from);
    to = Math.min(target.getRowCount(), to);
    return new int[]{from, Math.max(from, to)};
  }

  /**
   * A spectrum that is zero except around the given peaks, where it copies the target's first intensity column.
   */
  public static Spectrum reveal(Spectrum target, Collection<Double> peakFreqs, Double lineWidth) {
    double lw = adjustedLineWidth(lineWidth, target.getPointSpacing());
    double[] source = target.getColumn(Spectrum.DEFAULT_INTENSITY_COLUMN);
    double[] revealed = new double[source.length];
    for (Double peak : peakFreqs) {
      int[] rows = window(target, peak, lw);
      System.arraycopy(source, rows[0], revealed, rows[0], rows[1] - rows[0]);
    }
    LOGGER.info("Revealed %d peaks with a %.4f MHz window", peakFreqs.size(), lw);
    return target.withIntensities(revealed);
  }

  /**
   * A copy of the target's first intensity column with the regions around the given peaks set to zero.
   */
  public static Spectrum cut(Spectrum target, Collection<Double> peakFreqs, Double lineWidth) {
    double lw = adjustedLineWidth(lineWidth, target.getPointSpacing());
    double[] remaining = target.getColumn(Spectrum.DEFAULT_INTENSITY_COLUMN);
    for (Double peak : peakFreqs) {
      int[] rows = window(target, peak, lw);
      for (int r = rows[0]; r < rows[1]; r++) {
        remaining[r] = 0.0;
      }
    }
    LOGGER.info("Cut %d peaks with a %.4f MHz window", peakFreqs.size(), lw);
    return target.withIntensities(remaining);
  }

  /**
   * Peaks of an experimental spectrum above an absolute threshold, strongest first.
   */
  public static List<Double> peaksFromSpectrum(Spectrum spectrum, Double threshold) {
    return frequencies(PeakPicker.peakPickSorted(spectrum, threshold, null));
  }

  /**
   * Peaks of a simulated spectrum within a dynamic range of its strongest line, strongest first.
   */
  public static List<Double> peaksFromSimulation(Spectrum simulation, Double dynRange) {
    return frequencies(PeakPicker.peakPickSorted(simulation, null, dynRange));
  }

  /**
   * Predicted lines within the target's range and a dynamic range, together with their simulation on the target
   * grid.  The simulation is scaled to the target using the strong low-Ka subset of the catalog.
   *
   * @return (line frequencies in catalog order, scaled simulation)
   */
  public static Pair<List<Double>, Spectrum> peaksFromCat(Spectrum target, CatFile cat, Double dynRange,
                                                          Double lineWidth) throws NoConvergenceException {
    double fmin = NumericUtils.round4(target.getFreqMin());
    double fmax = NumericUtils.round4(target.getFreqMax());
    Map<Double, List<Transition>> lines = cat.filter(new CatFilter().freqMin(fmin).freqMax(fmax).dynRange(dynRange));
    Map<Double, List<Transition>> scaleLines = cat.filter(
        new CatFilter().freqMin(fmin).freqMax(fmax).kaMax(SCALE_KA_MAX).dynRange(SCALE_DYN_RANGE));
    Double scale = CatFile.scaleToSpectrum(target, scaleLines.keySet(), scaleLines, null);

    List<Peak> lineList = CatFile.lineList(lines);
    Spectrum simulation = CatFile.simulate(lines,
        new SimulationParameters(fmin, fmax, target.getPointSpacing(), lineWidth, scale));
    return Pair.of(frequencies(lineList), simulation);
  }

  /**
   * Peak frequencies from a file, chosen by its type: a peak pick above {@code level} for an experimental spectrum or
   * raw FID, a dynamic range of {@code level} for a simulated .prn, or a dynamic range of {@code level} for a catalog.
   */
  public static List<Double> peaksFromFile(File source, Double level, Spectrum target, Double lineWidth,
                                           FftParameters fftParameters)
      throws IOException, MalformedFileException, NoConvergenceException {
    String name = source.getName();
    if (name.endsWith(CatFile.EXTENSION)) {
      return peaksFromCat(target, CatFile.parse(source), level, lineWidth).getLeft();
    }
    if (name.endsWith(SpectrumFiles.PRN_EXTENSION)) {
      return peaksFromSimulation(SpectrumFiles.readColumns(source), level);
    }
    if (name.endsWith(SpectrumFiles.FT_EXTENSION) || name.endsWith(FidFile.EXTENSION)) {
      return peaksFromSpectrum(SpectrumFiles.read(source, fftParameters, null), level);
    }
    throw new InvalidParameterException(String.format("Cannot take peaks from %s", source));
  }

  private static List<Double> frequencies(List<Peak> peaks) {
    List<Double> freqs = new ArrayList<>(peaks.size());
    for (Peak p : peaks) {
      freqs.add(p.getFrequency());
    }
    return freqs;
  }
}
