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

package com.mrrtoolbox.pickett;

import com.mrrtoolbox.errors.InvalidParameterException;
import com.mrrtoolbox.errors.MalformedFileException;
import com.mrrtoolbox.errors.NoConvergenceException;
import com.mrrtoolbox.spectrum.Peak;
import com.mrrtoolbox.spectrum.SimulationParameters;
import com.mrrtoolbox.spectrum.Spectrum;
import com.mrrtoolbox.spectrum.SpectrumSimulator;
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A predicted line list written by SPCAT.  Lines are grouped by frequency, rounded to four decimals, so that blended
 * transitions sharing a frequency travel together through filtering and matching.
 */
public class CatFile {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CatFile.class);

  public static final String EXTENSION = ".cat";

  public static final Double DEFAULT_MATCH_THRESHOLD = 0.020;
  public static final Double DEFAULT_SCALE_THRESHOLD = 0.010;

  // Column widths of the fixed-format catalog line: FREQ ERR LGINT DR ELO GUP TAG QNFMT, then 12 quantum numbers.
  private static final int[] FIELD_WIDTHS = {13, 8, 8, 2, 10, 3, 7, 4, 2, 2, 2, 2, 2, 2, 2, 2, 2, 2, 2, 2};
  private static final int QUANTUM_NUMBER_OFFSET = 8;
  private static final int QUANTUM_NUMBERS_PER_STATE = 6;

  // Outlier rejection when scaling predicted intensities.
  private static final double SCALE_SIGMA_MULTIPLIER = 3.0;
  private static final int MAX_SCALE_ITERATIONS = 1000;

  private final String name;
  private final Map<Double, List<Transition>> transitions;
  private final Peak strongestLine;

  /**
   * The groups are copied, so later changes to the caller's map or lists do not reach this catalog.
   */
  public CatFile(String name, LinkedHashMap<Double, List<Transition>> transitions) {
    this.name = name;
    LinkedHashMap<Double, List<Transition>> copy = new LinkedHashMap<>(transitions.size());
    for (Map.Entry<Double, List<Transition>> e : transitions.entrySet()) {
      copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
    }
    this.transitions = Collections.unmodifiableMap(copy);
    this.strongestLine = copy.isEmpty() ? null : maxIntensity(copy);
  }

  public static CatFile parse(File file) throws IOException, MalformedFileException {
    LinkedHashMap<Double, List<Transition>> groups = new LinkedHashMap<>();
    int lineNumber = 0;
    int count = 0;
    try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.trim().isEmpty()) {
          continue;
        }
        Transition t = parseLine(file, lineNumber, line);
        groups.computeIfAbsent(NumericUtils.round4(t.getFreq()), k -> new ArrayList<>()).add(t);
        count++;
      }
    }
    LOGGER.info("Read %d transitions at %d distinct frequencies from %s", count, groups.size(), file);
    return new CatFile(FilenameUtils.getBaseName(file.getName()), groups);
  }

  static Transition parseLine(File file, int lineNumber, String line) throws MalformedFileException {
    String[] fields = new String[FIELD_WIDTHS.length];
    int pos = 0;
    for (int i = 0; i < FIELD_WIDTHS.length; i++) {
      int end = Math.min(line.length(), pos + FIELD_WIDTHS[i]);
      fields[i] = pos < line.length() ? line.substring(pos, end).trim() : "";
      pos += FIELD_WIDTHS[i];
    }
    try {
      Double freq = Double.parseDouble(fields[0]);
      Double err = Double.parseDouble(fields[1]);
      Double lgint = Double.parseDouble(fields[2]);
      Integer dr = parseOptionalInt(fields[3]);
      Double elo = fields[4].isEmpty() ? null : Double.parseDouble(fields[4]);
      Integer gup = parseOptionalInt(fields[5]);
      Integer tag = parseOptionalInt(fields[6]);
      Integer qnfmt = parseOptionalInt(fields[7]);
      Integer[] upper = new Integer[QUANTUM_NUMBERS_PER_STATE];
      Integer[] lower = new Integer[QUANTUM_NUMBERS_PER_STATE];
      for (int i = 0; i < QUANTUM_NUMBERS_PER_STATE; i++) {
        upper[i] = parseQuantumNumber(fields[QUANTUM_NUMBER_OFFSET + i]);
        lower[i] = parseQuantumNumber(fields[QUANTUM_NUMBER_OFFSET + QUANTUM_NUMBERS_PER_STATE + i]);
      }
      return new Transition(freq, err, lgint, dr, elo, gup, tag, qnfmt, upper, lower);
    } catch (NumberFormatException e) {
      throw new MalformedFileException(file, lineNumber, "Unparseable catalog line: " + e.getMessage(), e);
    }
  }

  private static Integer parseOptionalInt(String field) {
    return field.isEmpty() ? null : Integer.parseInt(field);
  }

  /**
   * Quantum numbers above 99 are written with a letter in the tens place: A0 is 100, B5 is 115.  Negative values
   * below -9 use lower-case letters: a0 is -10.
   */
  static Integer parseQuantumNumber(String field) {
    if (field.isEmpty()) {
      return null;
    }
    char lead = field.charAt(0);
    if (field.length() == 2 && Character.isLetter(lead)) {
      int units = Integer.parseInt(field.substring(1));
      if (Character.isUpperCase(lead)) {
        return (10 + lead - 'A') * 10 + units;
      }
      return -((1 + lead - 'a') * 10 + units);
    }
    return Integer.parseInt(field);
  }

  public String getName() {
    return name;
  }

  /**
   * @return A read-only view of the frequency groups, in catalog order.
   */
  public Map<Double, List<Transition>> getTransitions() {
    return transitions;
  }

  public List<Transition> getGroup(Double key) {
    List<Transition> group = transitions.get(NumericUtils.round4(key));
    return group == null ? Collections.emptyList() : group;
  }

  /**
   * Select the frequency groups satisfying every bound of the filter.  The dynamic-range bound is always measured
   * against the strongest line of this whole catalog.
   */
  public LinkedHashMap<Double, List<Transition>> filter(CatFilter filter) {
    return filter(transitions, filter);
  }

  public LinkedHashMap<Double, List<Transition>> filter(Map<Double, List<Transition>> groups, CatFilter filter) {
    Double floor = null;
    if (filter.getDynRange() != null) {
      if (!(filter.getDynRange() > 0.0)) {
        throw new InvalidParameterException(
            String.format("Dynamic range must be positive, got %s", filter.getDynRange()));
      }
      floor = strongestLine == null ? null : strongestLine.getIntensity() / filter.getDynRange();
    }
    LinkedHashMap<Double, List<Transition>> result = new LinkedHashMap<>();
    for (Map.Entry<Double, List<Transition>> e : groups.entrySet()) {
      boolean keep = true;
      for (Transition t : e.getValue()) {
        if (filter.violatesBounds(t) || (floor != null && t.getIntensity() < floor)) {
          keep = false;
          break;
        }
      }
      if (keep) {
        result.put(e.getKey(), e.getValue());
      }
    }
    LOGGER.debug("Filter kept %d of %d frequency groups", result.size(), groups.size());
    return result;
  }

  public List<Peak> lineList() {
    return lineList(transitions);
  }

  /**
   * @return One (group frequency, 10^lgint) entry per transition, in catalog order.
   */
  public static List<Peak> lineList(Map<Double, List<Transition>> groups) {
    List<Peak> lines = new ArrayList<>();
    for (Map.Entry<Double, List<Transition>> e : groups.entrySet()) {
      for (Transition t : e.getValue()) {
        lines.add(new Peak(e.getKey(), t.getIntensity()));
      }
    }
    return lines;
  }

  public Peak maxIntensity() {
    return strongestLine;
  }

  public static Peak maxIntensity(Map<Double, List<Transition>> groups) {
    Peak best = null;
    for (Peak p : lineList(groups)) {
      if (best == null || p.getIntensity() > best.getIntensity()) {
        best = p;
      }
    }
    if (best == null) {
      throw new InvalidParameterException("Cannot find the strongest line of an empty line list");
    }
    return best;
  }

  public Spectrum simulate(SimulationParameters params) {
    return SpectrumSimulator.simulate(lineList(), params);
  }

  public static Spectrum simulate(Map<Double, List<Transition>> groups, SimulationParameters params) {
    return SpectrumSimulator.simulate(lineList(groups), params);
  }

  /**
   * Pair every experimental peak with every group frequency within the threshold.  A peak may match several groups and
   * a group several peaks; every pairing is kept.
   */
  public static List<LineMatch> spectrumMatches(Collection<Double> peakFreqs, Map<Double, List<Transition>> groups,
                                                Double threshold) {
    double t = threshold == null ? DEFAULT_MATCH_THRESHOLD : threshold;
    List<LineMatch> matches = new ArrayList<>();
    for (Double x : peakFreqs) {
      for (Double y : groups.keySet()) {
        if (y + t >= x && x >= y - t) {
          matches.add(new LineMatch(y, NumericUtils.round4(x)));
        }
      }
    }
    return matches;
  }

  /**
   * The factor that, applied to predicted intensities, best matches an experimental spectrum at the assigned lines.
   * Ratios of experimental to predicted intensity are trimmed at 3 sigma until stable and averaged.
   *
   * @param assigned Experimental frequencies assigned to catalog lines.
   * @throws InvalidParameterException if no assigned line lies on the spectrum with non-zero intensity.
   * @throws NoConvergenceException if trimming does not stabilise.
   */
  public static Double scaleToSpectrum(Spectrum spectrum, Collection<Double> assigned,
                                       Map<Double, List<Transition>> groups, Double threshold)
      throws NoConvergenceException {
    double t = threshold == null ? DEFAULT_SCALE_THRESHOLD : threshold;
    List<Double> ratios = new ArrayList<>();
    for (Peak line : lineList(groups)) {
      double f = line.getFrequency();
      for (Double a : assigned) {
        if (!(f + t >= a && a >= f - t)) {
          continue;
        }
        if (!spectrum.containsFrequency(f)) {
          continue;
        }
        double experimental = spectrum.getIntensity(f);
        if (experimental == 0.0) {
          continue;
        }
        ratios.add(experimental / line.getIntensity());
      }
    }
    if (ratios.isEmpty()) {
      throw new InvalidParameterException("No assigned lines lie on the spectrum; cannot scale the prediction");
    }

    double[] values = NumericUtils.toArray(ratios);
    for (int iteration = 0; iteration < MAX_SCALE_ITERATIONS; iteration++) {
      double mean = NumericUtils.mean(values);
      double std = NumericUtils.populationStd(values);
      double low = mean - SCALE_SIGMA_MULTIPLIER * std;
      double high = mean + SCALE_SIGMA_MULTIPLIER * std;
      List<Double> kept = new ArrayList<>(values.length);
      for (double v : values) {
        if (low <= v && v <= high) {
          kept.add(v);
        }
      }
      if (kept.size() == values.length) {
        LOGGER.debug("Scale factor %.6e from %d ratios after %d passes", mean, values.length, iteration + 1);
        return mean;
      }
      values = NumericUtils.toArray(kept);
    }
    throw new NoConvergenceException(
        String.format("Scale factor outlier rejection did not settle in %d passes", MAX_SCALE_ITERATIONS),
        MAX_SCALE_ITERATIONS);
  }
}
