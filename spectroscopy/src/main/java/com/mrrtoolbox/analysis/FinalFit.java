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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mrrtoolbox.errors.InvalidParameterException;
import com.mrrtoolbox.errors.MalformedFileException;
import com.mrrtoolbox.errors.NoConvergenceException;
import com.mrrtoolbox.pickett.CatFile;
import com.mrrtoolbox.pickett.LinAssignment;
import com.mrrtoolbox.pickett.LinFile;
import com.mrrtoolbox.pickett.LineMatch;
import com.mrrtoolbox.pickett.ParFile;
import com.mrrtoolbox.pickett.PickettConstant;
import com.mrrtoolbox.pickett.PickettRunner;
import com.mrrtoolbox.pickett.PiformReport;
import com.mrrtoolbox.pickett.Transition;
import com.mrrtoolbox.spectrum.Peak;
import com.mrrtoolbox.spectrum.PeakPicker;
import com.mrrtoolbox.spectrum.Spectrum;
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Refines a close initial prediction against a measured spectrum with SPFIT.  This is not a blind search: the .cat
 * it starts from must already be near the final fit, so that lines can be assigned by frequency proximity alone.
 *
 * All files share a base name in one working directory: name.cat is the prediction, name.par the starting
 * constants; name.lin, name.pi and name.var are produced along the way.
 */
public class FinalFit {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FinalFit.class);

  public enum QdcMode {
    // Fit the quartic distortion constants already in the .par file.
    PAR,
    // Fit exactly the requested quartic distortion constants.
    SPECIFIC,
  }

  public static final int MAX_ITERATIONS = 100;

  // Parameter cap and line cap written before the first SPFIT run.
  static final int INITIAL_NPAR = 8;
  static final int INITIAL_NLINE = 1000;

  static final int QUANTUM_NUMBERS_PER_STATE = 3;
  static final int FIT_ROWS_BEFORE = 2;
  static final int FIT_ROWS_AFTER = 3;
  static final double INITIAL_LINE_WIDTH = 0.06;
  static final int CENTER_SEARCH_POINTS = 50;
  static final int MAX_FIT_ITERATIONS = 1000;

  private final PickettRunner runner;
  private final File workingDirectory;
  private final String name;

  public FinalFit(PickettRunner runner, File workingDirectory, String name) {
    this.runner = runner;
    this.workingDirectory = workingDirectory;
    this.name = name;
  }

  public static class Result {
    @JsonProperty("initial_qdcs")
    private List<PickettConstant> initialQdcs;

    @JsonProperty("rejected_qdcs")
    private List<PickettConstant> rejectedQdcs;

    @JsonProperty("iterations")
    private Integer iterations;

    @JsonProperty("rejected_frequencies")
    private List<Double> rejectedFrequencies;

    @JsonProperty("centered_frequencies")
    private List<Double> centeredFrequencies;

    @JsonProperty("max_intensities")
    private List<Double> maxIntensities;

    @JsonProperty("rms")
    private Double rms;

    @JsonProperty("lines_fit")
    private Integer linesFit;

    @JsonProperty("constants")
    private Map<String, String> constants;

    private Result() {}

    public Result(List<PickettConstant> initialQdcs, List<PickettConstant> rejectedQdcs, Integer iterations,
                  List<Double> rejectedFrequencies, List<Double> centeredFrequencies, List<Double> maxIntensities,
                  Double rms, Integer linesFit, Map<String, String> constants) {
      this.initialQdcs = initialQdcs;
      this.rejectedQdcs = rejectedQdcs;
      this.iterations = iterations;
      this.rejectedFrequencies = rejectedFrequencies;
      this.centeredFrequencies = centeredFrequencies;
      this.maxIntensities = maxIntensities;
      this.rms = rms;
      this.linesFit = linesFit;
      this.constants = constants;
    }

    public List<PickettConstant> getInitialQdcs() {
      return initialQdcs;
    }

    public List<PickettConstant> getRejectedQdcs() {
      return rejectedQdcs;
    }

    public Integer getIterations() {
      return iterations;
    }

    public List<Double> getRejectedFrequencies() {
      return rejectedFrequencies;
    }

    public List<Double> getCenteredFrequencies() {
      return centeredFrequencies;
    }

    public List<Double> getMaxIntensities() {
      return maxIntensities;
    }

    public Double getRms() {
      return rms;
    }

    public Integer getLinesFit() {
      return linesFit;
    }

    public Map<String, String> getConstants() {
      return constants;
    }
  }

  File file(String extension) {
    return new File(workingDirectory, name + extension);
  }

  /**
   * Run every stage in order.
   * @param peakPickThreshold Absolute intensity floor for the spectrum peak pick.
   * @param omitted Measured frequencies never to assign.
   */
  public Result run(Spectrum spectrum, CatFile cat, Double peakPickThreshold, QdcMode mode, boolean floating,
                    Collection<PickettConstant> specificConstants, FinalFitSettings settings,
                    Collection<Double> omitted)
      throws IOException, InterruptedException, MalformedFileException, NoConvergenceException {
    settings.validate();
    List<Peak> peaks = PeakPicker.peakPickSorted(spectrum, peakPickThreshold, null);
    initialLineMatch(cat, peaks, settings, omitted);
    List<PickettConstant> initialQdcs = qdcSelector(mode, floating, specificConstants);
    runner.spfit(workingDirectory, name);

    List<PickettConstant> rejectedQdcs = new ArrayList<>(piformBadQdc(floating));
    rejectedQdcs.addAll(qdcLargeUncertainty(floating));
    Pair<List<Double>, Integer> filtered = filterTransitions(settings.getMaxError());
    Pair<List<Double>, List<Double>> centers = fitPeakCenter(spectrum);

    PiformReport report = PiformReport.parse(file(PiformReport.EXTENSION));
    int linesFit = LinFile.parse(file(LinFile.EXTENSION)).size();
    Map<String, String> constants = new LinkedHashMap<>();
    for (Map.Entry<PickettConstant, PiformReport.FittedConstant> e : report.getConstants().entrySet()) {
      constants.put(e.getKey().getLabel(), e.getValue().toParenthesized());
    }
    LOGGER.info("Final fit of %s: %d lines, rms %s, %d lines rejected, %d constants rejected", name, linesFit,
        report.getRms(), filtered.getLeft().size(), rejectedQdcs.size());
    return new Result(initialQdcs, rejectedQdcs, filtered.getRight(), filtered.getLeft(), centers.getLeft(),
        centers.getRight(), report.getRms(), linesFit, constants);
  }

  /**
   * Assign measured peaks to predicted lines and write name.lin.  Every transition of a matched catalog group is
   * assigned the peak's frequency, so blended lines enter the fit together.
   *
   * @param peaks Peak pick of the measured spectrum.
   * @return The written assignments.
   */
  public LinFile initialLineMatch(CatFile cat, List<Peak> peaks, FinalFitSettings settings,
                                  Collection<Double> omitted) throws IOException {
    LinkedHashMap<Double, List<Transition>> groups = cat.filter(settings.toCatFilter());
    List<Double> peakFreqs = new ArrayList<>(peaks.size());
    for (Peak p : peaks) {
      peakFreqs.add(p.getFrequency());
    }
    Set<Double> omit = new HashSet<>();
    if (omitted != null) {
      for (Double f : omitted) {
        omit.add(NumericUtils.round4(f));
      }
    }

    LinFile lin = new LinFile();
    for (LineMatch m : CatFile.spectrumMatches(peakFreqs, groups, settings.getFreqMatch())) {
      if (omit.contains(m.getSpectrumFrequency())) {
        continue;
      }
      for (Transition t : groups.get(m.getCatFrequency())) {
        lin.assign(new LinAssignment(m.getSpectrumFrequency(), nullToZero(t.getN1()), nullToZero(t.getKa1()),
            nullToZero(t.getKc1()), nullToZero(t.getN0()), nullToZero(t.getKa0()), nullToZero(t.getKc0())));
      }
    }
    lin.save(file(LinFile.EXTENSION));
    LOGGER.info("Assigned %d transitions from %d predicted line groups", lin.size(), groups.size());
    return lin;
  }

  private static int nullToZero(Integer qn) {
    return qn == null ? 0 : qn;
  }

  /**
   * Choose the quartic distortion constants of the first fit and write name.par.  Starts from name.par, or name.var
   * when there is no .par.
   *
   * @param specificConstants Only used in SPECIFIC mode.  Requested constants missing from the file start at zero,
   *                          which is only possible when they float.
   * @return The quartic distortion constants the fit starts with.
   */
  public List<PickettConstant> qdcSelector(QdcMode mode, boolean floating,
                                           Collection<PickettConstant> specificConstants)
      throws IOException, MalformedFileException {
    File parPath = file(ParFile.PAR_EXTENSION);
    if (!parPath.isFile()) {
      parPath = file(ParFile.VAR_EXTENSION);
    }
    if (!parPath.isFile()) {
      throw new IOException(String.format("Neither %s.par nor %s.var exists in %s", name, name, workingDirectory));
    }
    ParFile par = ParFile.parse(parPath);
    par.setNline(INITIAL_NLINE);
    par.setNpar(INITIAL_NPAR);

    List<PickettConstant> initial = new ArrayList<>();
    if (mode == QdcMode.SPECIFIC) {
      Collection<PickettConstant> requested =
          specificConstants == null ? Collections.emptyList() : specificConstants;
      for (PickettConstant c : PickettConstant.QUARTIC_DISTORTION) {
        if (!requested.contains(c)) {
          par.removeConstant(c);
          continue;
        }
        initial.add(c);
        if (!par.hasConstant(c)) {
          if (!floating) {
            throw new InvalidParameterException(String.format(
                "%s is not in %s; a distortion constant must be given to be held fixed", c.getLabel(), parPath));
          }
          par.setConstant(c, 0.0);
          par.setStdev(c, true);
        } else {
          par.setStdev(c, floating);
        }
      }
    } else {
      for (PickettConstant c : par.getGivenConstants()) {
        if (c.isQuarticDistortion()) {
          initial.add(c);
        }
      }
      if (floating) {
        par.floatGivenQdc();
      } else {
        par.fixGivenQdc();
      }
    }
    par.save(file(ParFile.PAR_EXTENSION));
    LOGGER.info("Starting fit with distortion constants %s", initial);
    return initial;
  }

  /**
   * Drop the constants SPFIT reports as poorly determined (A, B and C are always kept) and refit until none are
   * reported, then predict name.cat.  Fixed constants are never dropped.
   */
  public List<PickettConstant> piformBadQdc(boolean floating)
      throws IOException, InterruptedException, MalformedFileException, NoConvergenceException {
    List<PickettConstant> rejected = new ArrayList<>();
    if (!floating) {
      return rejected;
    }
    for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
      PiformReport report = PiformReport.parse(file(PiformReport.EXTENSION));
      List<String> bad = report.getBadConstantIds();
      List<PickettConstant> removable = new ArrayList<>();
      if (bad != null) {
        for (int i = bad.size() - 1; i >= 0; i--) {
          PickettConstant c = PickettConstant.fromId(bad.get(i));
          if (c == null) {
            LOGGER.warn("Ignoring unrecognized parameter id %s in %s", bad.get(i), report.getFile());
          } else if (!c.isRotational()) {
            removable.add(c);
          }
        }
      }
      if (removable.isEmpty()) {
        runner.spcat(workingDirectory, name);
        return rejected;
      }
      ParFile par = ParFile.parse(file(ParFile.PAR_EXTENSION));
      for (PickettConstant c : removable) {
        removeFromFit(par, c);
        rejected.add(c);
      }
      par.save(file(ParFile.PAR_EXTENSION));
      LOGGER.info("Removed poorly determined constants %s", removable);
      runner.spfit(workingDirectory, name);
    }
    throw new NoConvergenceException(
        String.format("Constants were still being rejected after %d fits", MAX_ITERATIONS), MAX_ITERATIONS);
  }

  /**
   * Drop quartic distortion constants no larger than their own uncertainty and refit until none remain.
   */
  public List<PickettConstant> qdcLargeUncertainty(boolean floating)
      throws IOException, InterruptedException, MalformedFileException, NoConvergenceException {
    List<PickettConstant> rejected = new ArrayList<>();
    if (!floating) {
      return rejected;
    }
    for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
      List<PickettConstant> failed = PiformReport.parse(file(PiformReport.EXTENSION)).qdcCheck();
      if (failed.isEmpty()) {
        return rejected;
      }
      ParFile par = ParFile.parse(file(ParFile.PAR_EXTENSION));
      for (PickettConstant c : failed) {
        removeFromFit(par, c);
        rejected.add(c);
      }
      par.save(file(ParFile.PAR_EXTENSION));
      LOGGER.info("Removed undetermined distortion constants %s", failed);
      runner.spfit(workingDirectory, name);
    }
    throw new NoConvergenceException(
        String.format("Distortion constants were still undetermined after %d fits", MAX_ITERATIONS), MAX_ITERATIONS);
  }

  private static void removeFromFit(ParFile par, PickettConstant c) {
    // Quadrupole terms are counted when the file is written.
    if (!c.isQuadrupole() && par.hasConstant(c)) {
      par.setNpar(par.getNpar() - 1);
    }
    par.removeConstant(c);
  }

  /**
   * Remove the worst fitted line and refit until every line is within maxError.
   * @param maxError Null for 0.040 MHz.
   * @return Rejected frequencies, and the number of passes (1 when nothing was rejected).
   */
  public Pair<List<Double>, Integer> filterTransitions(Double maxError)
      throws IOException, InterruptedException, MalformedFileException, NoConvergenceException {
    double limit = maxError == null ? FinalFitSettings.DEFAULT_MAX_ERROR : maxError;
    List<Double> rejected = new ArrayList<>();
    int iterations = 1;
    while (true) {
      PiformReport report = PiformReport.parse(file(PiformReport.EXTENSION));
      ParFile par = ParFile.parse(file(ParFile.PAR_EXTENSION));
      LinFile lin = LinFile.parse(file(LinFile.EXTENSION));
      par.setNline(lin.size() + 1);
      par.save(file(ParFile.PAR_EXTENSION));

      if (!report.hasWorstLine()) {
        LOGGER.warn("%s lists no worst fitted line; keeping all %d lines", report.getFile(), lin.size());
        break;
      }
      if (Math.abs(report.worstLineObsMinusCalc()) < limit) {
        break;
      }
      if (iterations > MAX_ITERATIONS) {
        throw new NoConvergenceException(
            String.format("Lines still exceeded %.4f MHz after %d rejections", limit, rejected.size()), iterations);
      }
      iterations++;
      rejected.add(report.worstLineFrequency());
      LinAssignment removed = lin.deleteRow(report.worstLineRow());
      LOGGER.info("Rejected line at %.4f MHz (obs - calc %.4f)", removed.getFreq(), report.worstLineObsMinusCalc());
      lin.save(file(LinFile.EXTENSION));
      runner.spfit(workingDirectory, name);
      runner.spcat(workingDirectory, name);
    }
    return Pair.of(rejected, iterations);
  }

  /**
   * Re-center every fitted line on a Gaussian fit of the measured line shape, rewrite name.lin and refit.  A line
   * whose shape cannot be fit keeps its assigned frequency.
   *
   * @return Centered frequencies for every line, and the peak of each successful Gaussian fit.
   */
  public Pair<List<Double>, List<Double>> fitPeakCenter(Spectrum spectrum)
      throws IOException, InterruptedException, MalformedFileException {
    PiformReport report = PiformReport.parse(file(PiformReport.EXTENSION));
    List<PiformReport.AssignedLine> lines = report.lineListSplit(QUANTUM_NUMBERS_PER_STATE);
    LinFile lin = LinFile.parse(file(LinFile.EXTENSION));
    if (lines.size() != lin.size()) {
      throw new InvalidParameterException(String.format(
          "%s lists %d fitted lines but %s holds %d", report.getFile(), lines.size(), file(LinFile.EXTENSION),
          lin.size()));
    }

    List<Double> centered = new ArrayList<>(lines.size());
    List<Double> maxIntensities = new ArrayList<>(lines.size());
    for (PiformReport.AssignedLine line : lines) {
      Pair<Double, Double> fit = fitGaussian(spectrum, line.getFrequency());
      if (fit == null) {
        centered.add(NumericUtils.round4(line.getFrequency()));
      } else {
        centered.add(NumericUtils.round4(fit.getLeft()));
        maxIntensities.add(fit.getRight());
      }
    }

    LinFile recentered = new LinFile();
    List<LinAssignment> old = lin.getAssignments();
    for (int i = 0; i < old.size(); i++) {
      LinAssignment a = old.get(i);
      recentered.assign(new LinAssignment(centered.get(i), a.getJ1(), a.getKa1(), a.getKc1(), a.getJ0(), a.getKa0(),
          a.getKc0()));
    }
    recentered.save(file(LinFile.EXTENSION));
    runner.spfit(workingDirectory, name);
    runner.spcat(workingDirectory, name);
    return Pair.of(centered, maxIntensities);
  }

  /**
   * Least squares fit of the line shape around a frequency.
   * @return (center, peak height) of the fitted curve sampled at 50 points, or null if the fit fails.
   */
  static Pair<Double, Double> fitGaussian(Spectrum spectrum, double freq) {
    int row = spectrum.freqToRow(freq);
    int first = Math.max(0, row - FIT_ROWS_BEFORE);
    int last = Math.min(spectrum.getRowCount(), row + FIT_ROWS_AFTER);
    if (row < 0 || row >= spectrum.getRowCount() || last - first < Gaussian.PARAMETERS) {
      LOGGER.warn("Line at %.4f MHz is too close to the spectrum edge to fit", freq);
      return null;
    }
    WeightedObservedPoints points = new WeightedObservedPoints();
    for (int r = first; r < last; r++) {
      points.add(spectrum.getValue(r, Spectrum.FREQUENCY_COLUMN),
          spectrum.getValue(r, Spectrum.DEFAULT_INTENSITY_COLUMN));
    }
    double[] start = {
        spectrum.getValue(row, Spectrum.DEFAULT_INTENSITY_COLUMN),
        spectrum.getValue(first, Spectrum.FREQUENCY_COLUMN),
        INITIAL_LINE_WIDTH
    };
    double[] params;
    try {
      params = SimpleCurveFitter.create(new Gaussian(), start)
          .withMaxIterations(MAX_FIT_ITERATIONS)
          .fit(points.toList());
    } catch (MathIllegalStateException e) {
      LOGGER.warn("Gaussian fit failed at %.4f MHz: %s", freq, e.getMessage());
      return null;
    }

    Gaussian g = new Gaussian();
    double[] xs = NumericUtils.linspace(spectrum.getValue(first, Spectrum.FREQUENCY_COLUMN),
        spectrum.getValue(last - 1, Spectrum.FREQUENCY_COLUMN), CENTER_SEARCH_POINTS);
    double bestX = xs[0];
    double bestY = g.value(xs[0], params);
    for (int i = 1; i < xs.length; i++) {
      double y = g.value(xs[i], params);
      if (y > bestY) {
        bestX = xs[i];
        bestY = y;
      }
    }
    return Pair.of(bestX, bestY);
  }

  /**
   * a * exp(-ln2 * ((x - mu) / (w / 2))^2), w being the full width at half maximum.
   */
  static class Gaussian implements ParametricUnivariateFunction {
    static final int PARAMETERS = 3;
    private static final double FOUR_LN2 = 4.0 * Math.log(2.0);

    @Override
    public double value(double x, double... p) {
      double d = x - p[1];
      return p[0] * Math.exp(-FOUR_LN2 * d * d / (p[2] * p[2]));
    }

    @Override
    public double[] gradient(double x, double... p) {
      double d = x - p[1];
      double w2 = p[2] * p[2];
      double e = Math.exp(-FOUR_LN2 * d * d / w2);
      return new double[]{
          e,
          p[0] * e * 2.0 * FOUR_LN2 * d / w2,
          p[0] * e * 2.0 * FOUR_LN2 * d * d / (w2 * p[2]),
      };
    }
  }

  public File getWorkingDirectory() {
    return workingDirectory;
  }

  public String getName() {
    return name;
  }
}
