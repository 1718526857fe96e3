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
import com.mrrtoolbox.errors.MissingRequiredInputException;
import com.mrrtoolbox.pickett.CatFile;
import com.mrrtoolbox.pickett.CatFilter;
import com.mrrtoolbox.pickett.LineMatch;
import com.mrrtoolbox.spectrum.Spectrum;
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enantiomeric excess from chiral tag rotational spectra.
 *
 * A chiral tag complexes with each enantiomer of the analyte to form two diastereomers with distinct spectra.  In a
 * racemic sample both complexes are equally abundant; in an enriched sample one dominates.  Comparing the intensity
 * of a transition of each complex between the two spectra, normalized by their ratio in the racemic spectrum, gives
 * the ee.
 */
public class EnantiomericExcess {
  private static final Logger LOGGER = LogManager.getFormatterLogger(EnantiomericExcess.class);

  public static final Double DEFAULT_FREQ_MATCH = 0.020;
  public static final Double DEFAULT_SIGMA_MULTIPLIER = 3.0;
  public static final Double DEFAULT_TAG_EE = 1.0;

  // Peak picks on the same grid may land one point apart for the same transition.
  static final double NEIGHBOUR_OFFSET = 0.0125;
  static final double FREQUENCY_TOLERANCE = 1e-6;

  private EnantiomericExcess() {}

  /**
   * Measure each transition of the two complexes in both spectra.
   *
   * With catalogs for both complexes, transitions are the racemic peaks matching each filtered catalog.  Without
   * them, a racemic peak that also appears in the enriched peak pick is taken as dominant and every other racemic peak
   * as minor; this only works when the enriched sample is pure enough for the minor complex to fall below the enriched
   * peak pick threshold.
   *
   * @param enrichedPeaks Peak pick of the enriched spectrum, frequency to intensity.
   * @param racemicPeaks Peak pick of the racemic spectrum, frequency to intensity.
   * @param freqMatch Match tolerance in MHz for catalog guided mode; null for 0.020.
   * @param filter Applied to both catalogs; may be null.
   */
  public static ScaleFactorResult transitionScaleFactor(Spectrum enriched, Spectrum racemic,
                                                        Map<Double, Double> enrichedPeaks,
                                                        Map<Double, Double> racemicPeaks, Double freqMatch,
                                                        CatFile dominantCat, CatFile minorCat, CatFilter filter) {
    if ((dominantCat == null) != (minorCat == null)) {
      throw new MissingRequiredInputException("Catalogs must be supplied for both complexes or for neither");
    }
    List<Double> dominantFreqs = new ArrayList<>();
    List<Double> minorFreqs = new ArrayList<>();
    if (dominantCat != null) {
      CatFilter f = filter == null ? new CatFilter() : filter;
      double match = freqMatch == null ? DEFAULT_FREQ_MATCH : freqMatch;
      for (LineMatch m : CatFile.spectrumMatches(racemicPeaks.keySet(), dominantCat.filter(f), match)) {
        dominantFreqs.add(m.getSpectrumFrequency());
      }
      for (LineMatch m : CatFile.spectrumMatches(racemicPeaks.keySet(), minorCat.filter(f), match)) {
        minorFreqs.add(m.getSpectrumFrequency());
      }
    } else {
      for (Double f : racemicPeaks.keySet()) {
        if (containsNear(enrichedPeaks.keySet(), f) || containsNear(enrichedPeaks.keySet(), f + NEIGHBOUR_OFFSET) ||
            containsNear(enrichedPeaks.keySet(), f - NEIGHBOUR_OFFSET)) {
          dominantFreqs.add(f);
        } else {
          minorFreqs.add(f);
        }
      }
    }
    LOGGER.info("Measured %d dominant and %d minor transitions", dominantFreqs.size(), minorFreqs.size());
    return new ScaleFactorResult(records(enriched, racemic, dominantFreqs), records(enriched, racemic, minorFreqs));
  }

  private static boolean containsNear(Collection<Double> freqs, double target) {
    for (Double f : freqs) {
      if (Math.abs(f - target) <= FREQUENCY_TOLERANCE) {
        return true;
      }
    }
    return false;
  }

  private static List<IntensityRatioRecord> records(Spectrum enriched, Spectrum racemic, List<Double> freqs) {
    List<IntensityRatioRecord> result = new ArrayList<>(freqs.size());
    for (Double f : freqs) {
      result.add(new IntensityRatioRecord(f, racemic.getIntensity(f), enriched.getIntensity(f)));
    }
    return result;
  }

  /**
   * Keep records whose value in the given column lies within mean +/- multiplier * std of that column.  One pass:
   * the bounds are computed once from the input.
   * @param column 1 racemic intensity, 2 enriched intensity, 3 ratio.
   * @param multiplier Null for 3.
   */
  public static List<IntensityRatioRecord> sigmaFilter(List<IntensityRatioRecord> records, int column,
                                                       Double multiplier) {
    if (column < IntensityRatioRecord.RACEMIC_COLUMN || column > IntensityRatioRecord.RATIO_COLUMN) {
      throw new InvalidParameterException(String.format("Can only sigma filter columns 1 to 3, not %d", column));
    }
    if (records.isEmpty()) {
      return new ArrayList<>();
    }
    double k = multiplier == null ? DEFAULT_SIGMA_MULTIPLIER : multiplier;
    double[] values = new double[records.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = records.get(i).get(column);
    }
    double mean = NumericUtils.mean(values);
    double std = NumericUtils.populationStd(values);
    double low = mean - k * std;
    double high = mean + k * std;

    List<IntensityRatioRecord> kept = new ArrayList<>(records.size());
    for (IntensityRatioRecord r : records) {
      double v = r.get(column);
      if (low <= v && v <= high) {
        kept.add(r);
      }
    }
    LOGGER.debug("Sigma filter on column %d kept %d of %d records", column, kept.size(), records.size());
    return kept;
  }

  /**
   * Compute the ee from every pairing of the first topN dominant and minor records that pass the ratio windows.
   *
   * @param omitted Frequencies excluded by hand, compared after rounding to four decimals.
   * @param tagEe Enantiopurity of the chiral tag; null for 1.
   */
  public static EeResult calculateEe(List<IntensityRatioRecord> dominant, List<IntensityRatioRecord> minor, int topN,
                                     double rmin1, double rmax1, double rmin2, double rmax2, Double tagEe,
                                     Collection<Double> omitted) {
    if (topN < 1) {
      throw new InvalidParameterException(String.format("Top N must be at least 1, got %d", topN));
    }
    double tag = tagEe == null ? DEFAULT_TAG_EE : tagEe;
    Set<Double> omit = new HashSet<>();
    if (omitted != null) {
      for (Double f : omitted) {
        omit.add(NumericUtils.round4(f));
      }
    }

    List<IntensityRatioRecord> topDominant = top(ratioWindow(dominant, rmin1, rmax1, omit), topN, "dominant");
    List<IntensityRatioRecord> topMinor = top(ratioWindow(minor, rmin2, rmax2, omit), topN, "minor");

    double[] ee = new double[topN * topN];
    int k = 0;
    for (IntensityRatioRecord a : topDominant) {
      for (IntensityRatioRecord b : topMinor) {
        double norm = 1.0 / (a.getRacemicIntensity() / b.getRacemicIntensity());
        double r = a.getEnrichedIntensity() / b.getEnrichedIntensity();
        double rn = r * norm;
        ee[k++] = ((rn - 1.0) / (rn + 1.0)) / tag;
      }
    }
    EeStatistics stats = EeStatistics.of(ee, topN);
    LOGGER.info("ee %.5f +/- %.5f from %d transition pairs", stats.getMean(), stats.getStdErr(), ee.length);
    return new EeResult(ee, topDominant, topMinor, stats);
  }

  private static List<IntensityRatioRecord> ratioWindow(List<IntensityRatioRecord> records, double rmin, double rmax,
                                                        Set<Double> omit) {
    List<IntensityRatioRecord> kept = new ArrayList<>(records.size());
    for (IntensityRatioRecord r : records) {
      double ratio = r.getRatio();
      if (rmin <= ratio && ratio <= rmax && ratio != 0.0 && !omit.contains(NumericUtils.round4(r.getFrequency()))) {
        kept.add(r);
      }
    }
    return kept;
  }

  private static List<IntensityRatioRecord> top(List<IntensityRatioRecord> records, int topN, String species) {
    if (records.size() < topN) {
      throw new InvalidParameterException(String.format(
          "Only %d %s transitions pass the ratio window, fewer than the %d requested", records.size(), species, topN));
    }
    return Collections.unmodifiableList(new ArrayList<>(records.subList(0, topN)));
  }
}
