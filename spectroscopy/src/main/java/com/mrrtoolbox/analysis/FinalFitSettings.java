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
import com.mrrtoolbox.pickett.CatFilter;

/**
 * Line selection and convergence limits for an automated fit.
 */
public class FinalFitSettings {
  public static final Double DEFAULT_FREQ_MIN = 2000.0;
  public static final Double DEFAULT_FREQ_MAX = 18000.0;
  public static final Integer DEFAULT_KA_MAX = 10;
  public static final Double DEFAULT_DYN_RANGE = 100.0;
  public static final Double DEFAULT_FREQ_MATCH = 0.020;
  public static final Double DEFAULT_MAX_ERROR = 0.040;

  @JsonProperty("freq_min_mhz")
  private Double freqMin = DEFAULT_FREQ_MIN;

  @JsonProperty("freq_max_mhz")
  private Double freqMax = DEFAULT_FREQ_MAX;

  @JsonProperty("ka_max")
  private Integer kaMax = DEFAULT_KA_MAX;

  @JsonProperty("dyn_range")
  private Double dynRange = DEFAULT_DYN_RANGE;

  // Largest |predicted - measured| accepted as an assignment.
  @JsonProperty("freq_match_mhz")
  private Double freqMatch = DEFAULT_FREQ_MATCH;

  // Largest |obs - calc| a line may keep in the final fit.
  @JsonProperty("max_error_mhz")
  private Double maxError = DEFAULT_MAX_ERROR;

  public FinalFitSettings() {}

  public void validate() {
    if (freqMin == null || freqMax == null || !(freqMax > freqMin)) {
      throw new InvalidParameterException(String.format("Fit range [%s, %s] is not a valid range", freqMin, freqMax));
    }
    if (freqMatch == null || !(freqMatch > 0.0)) {
      throw new InvalidParameterException(String.format("Frequency match must be positive, got %s", freqMatch));
    }
    if (maxError == null || !(maxError > 0.0)) {
      throw new InvalidParameterException(String.format("Maximum error must be positive, got %s", maxError));
    }
  }

  public CatFilter toCatFilter() {
    return new CatFilter().freqMin(freqMin).freqMax(freqMax).kaMax(kaMax).dynRange(dynRange);
  }

  public Double getFreqMin() {
    return freqMin;
  }

  public void setFreqMin(Double freqMin) {
    this.freqMin = freqMin;
  }

  public Double getFreqMax() {
    return freqMax;
  }

  public void setFreqMax(Double freqMax) {
    this.freqMax = freqMax;
  }

  public Integer getKaMax() {
    return kaMax;
  }

  public void setKaMax(Integer kaMax) {
    this.kaMax = kaMax;
  }

  public Double getDynRange() {
    return dynRange;
  }

  public void setDynRange(Double dynRange) {
    this.dynRange = dynRange;
  }

  public Double getFreqMatch() {
    return freqMatch;
  }

  public void setFreqMatch(Double freqMatch) {
    this.freqMatch = freqMatch;
  }

  public Double getMaxError() {
    return maxError;
  }

  public void setMaxError(Double maxError) {
    this.maxError = maxError;
  }
}
