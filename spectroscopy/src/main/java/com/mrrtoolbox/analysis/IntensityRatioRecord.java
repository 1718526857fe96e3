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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mrrtoolbox.errors.InvalidParameterException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One transition measured in both the racemic and the enantioenriched spectrum.
 */
public class IntensityRatioRecord {
  public static final int FREQUENCY_COLUMN = 0;
  public static final int RACEMIC_COLUMN = 1;
  public static final int ENRICHED_COLUMN = 2;
  public static final int RATIO_COLUMN = 3;

  public static final List<String> TSV_HEADER = Collections.unmodifiableList(Arrays.asList(
      "Frequency (MHz)", "Intensity Racemic (mV)", "Intensity Enriched (mV)", "Ratio"));

  @JsonProperty("frequency")
  private Double frequency;

  @JsonProperty("racemic_intensity")
  private Double racemicIntensity;

  @JsonProperty("enriched_intensity")
  private Double enrichedIntensity;

  // enriched / racemic
  @JsonProperty("ratio")
  private Double ratio;

  private IntensityRatioRecord() {}

  public IntensityRatioRecord(Double frequency, Double racemicIntensity, Double enrichedIntensity) {
    this.frequency = frequency;
    this.racemicIntensity = racemicIntensity;
    this.enrichedIntensity = enrichedIntensity;
    this.ratio = enrichedIntensity / racemicIntensity;
  }

  public Double getFrequency() {
    return frequency;
  }

  public Double getRacemicIntensity() {
    return racemicIntensity;
  }

  public Double getEnrichedIntensity() {
    return enrichedIntensity;
  }

  public Double getRatio() {
    return ratio;
  }

  /**
   * @param column 0 frequency, 1 racemic intensity, 2 enriched intensity, 3 ratio.
   */
  public Double get(int column) {
    switch (column) {
      case FREQUENCY_COLUMN:
        return frequency;
      case RACEMIC_COLUMN:
        return racemicIntensity;
      case ENRICHED_COLUMN:
        return enrichedIntensity;
      case RATIO_COLUMN:
        return ratio;
      default:
        throw new InvalidParameterException(String.format("No column %d in an intensity ratio record", column));
    }
  }

  @JsonIgnore
  public double[] toRow() {
    return new double[]{frequency, racemicIntensity, enrichedIntensity, ratio};
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%.4f: %.6f / %.6f = %.6f",
        frequency, enrichedIntensity, racemicIntensity, ratio);
  }
}
