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

package com.mrrtoolbox.fid;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mrrtoolbox.errors.InvalidParameterException;

/**
 * Processing settings for turning a FID into a frequency spectrum.  Defaults reflect a 2-8 GHz chirp.
 */
public class FftParameters {
  public static final Double DEFAULT_FID_FRACTION = 1.0;
  public static final Double DEFAULT_KAISER_BETA = 9.5;
  public static final Double DEFAULT_TOTAL_LENGTH_US = 80.0;
  public static final Double DEFAULT_FREQ_START = 2000.0;
  public static final Double DEFAULT_FREQ_STOP = 8000.0;

  @JsonProperty("fid_fraction")
  private Double fidFraction = DEFAULT_FID_FRACTION;

  @JsonProperty("kaiser_beta")
  private Double kaiserBeta = DEFAULT_KAISER_BETA;

  // Length of the zero-padded FID in microseconds.
  @JsonProperty("total_length_us")
  private Double totalLengthUs = DEFAULT_TOTAL_LENGTH_US;

  @JsonProperty("freq_start_mhz")
  private Double freqStart = DEFAULT_FREQ_START;

  @JsonProperty("freq_stop_mhz")
  private Double freqStop = DEFAULT_FREQ_STOP;

  // Emit real and imaginary columns instead of the magnitude.
  @JsonProperty("full_ft")
  private Boolean fullFt = false;

  public FftParameters() {}

  public FftParameters(Double fidFraction, Double kaiserBeta, Double totalLengthUs,
                       Double freqStart, Double freqStop, Boolean fullFt) {
    this.fidFraction = fidFraction;
    this.kaiserBeta = kaiserBeta;
    this.totalLengthUs = totalLengthUs;
    this.freqStart = freqStart;
    this.freqStop = freqStop;
    this.fullFt = fullFt;
  }

  public void validate() {
    if (fidFraction == null || !(fidFraction > 0.0) || fidFraction > 1.0) {
      throw new InvalidParameterException(String.format("FID fraction must be in (0, 1], got %s", fidFraction));
    }
    if (kaiserBeta == null || kaiserBeta.isNaN()) {
      throw new InvalidParameterException("Kaiser-Bessel parameter must be a number");
    }
    if (totalLengthUs == null || !(totalLengthUs > 0.0)) {
      throw new InvalidParameterException(String.format("Total length must be positive, got %s", totalLengthUs));
    }
    if (freqStart == null || freqStop == null || freqStart > freqStop) {
      throw new InvalidParameterException(
          String.format("Frequency window [%s, %s] is not a valid range", freqStart, freqStop));
    }
  }

  public Double getFidFraction() {
    return fidFraction;
  }

  public void setFidFraction(Double fidFraction) {
    this.fidFraction = fidFraction;
  }

  public Double getKaiserBeta() {
    return kaiserBeta;
  }

  public void setKaiserBeta(Double kaiserBeta) {
    this.kaiserBeta = kaiserBeta;
  }

  public Double getTotalLengthUs() {
    return totalLengthUs;
  }

  public void setTotalLengthUs(Double totalLengthUs) {
    this.totalLengthUs = totalLengthUs;
  }

  public Double getFreqStart() {
    return freqStart;
  }

  public void setFreqStart(Double freqStart) {
    this.freqStart = freqStart;
  }

  public Double getFreqStop() {
    return freqStop;
  }

  public void setFreqStop(Double freqStop) {
    this.freqStop = freqStop;
  }

  public Boolean getFullFt() {
    return fullFt;
  }

  public void setFullFt(Boolean fullFt) {
    this.fullFt = fullFt;
  }
}
