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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mrrtoolbox.errors.InvalidParameterException;

public class SimulationParameters {
  public static final Double DEFAULT_FREQ_MIN = 2000.0;
  public static final Double DEFAULT_FREQ_MAX = 8000.0;
  public static final Double DEFAULT_STEP = 0.0125;
  public static final Double DEFAULT_FWHM = 0.060;

  @JsonProperty("freq_min_mhz")
  private Double freqMin = DEFAULT_FREQ_MIN;

  @JsonProperty("freq_max_mhz")
  private Double freqMax = DEFAULT_FREQ_MAX;

  @JsonProperty("step_mhz")
  private Double step = DEFAULT_STEP;

  @JsonProperty("fwhm_mhz")
  private Double fwhm = DEFAULT_FWHM;

  // Multiplies the simulated intensities; null leaves them unscaled.
  @JsonProperty("scale_factor")
  private Double scaleFactor;

  public SimulationParameters() {}

  public SimulationParameters(Double freqMin, Double freqMax, Double step, Double fwhm, Double scaleFactor) {
    this.freqMin = freqMin;
    this.freqMax = freqMax;
    this.step = step;
    this.fwhm = fwhm;
    this.scaleFactor = scaleFactor;
  }

  public void validate() {
    if (freqMin == null || freqMax == null || !(freqMax > freqMin)) {
      throw new InvalidParameterException(
          String.format("Simulation range [%s, %s] is not a valid range", freqMin, freqMax));
    }
    if (step == null || !(step > 0.0)) {
      throw new InvalidParameterException(String.format("Step size must be positive, got %s", step));
    }
    if (fwhm == null || !(fwhm > 0.0)) {
      throw new InvalidParameterException(String.format("Line width must be positive, got %s", fwhm));
    }
  }

  public SimulationParameters withScaleFactor(Double scaleFactor) {
    return new SimulationParameters(freqMin, freqMax, step, fwhm, scaleFactor);
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

  public Double getStep() {
    return step;
  }

  public void setStep(Double step) {
    this.step = step;
  }

  public Double getFwhm() {
    return fwhm;
  }

  public void setFwhm(Double fwhm) {
    this.fwhm = fwhm;
  }

  public Double getScaleFactor() {
    return scaleFactor;
  }

  public void setScaleFactor(Double scaleFactor) {
    this.scaleFactor = scaleFactor;
  }
}
