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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bounds for selecting catalog lines.  Every bound is optional; quantum-number bounds apply to the upper state.
 * A frequency group is removed when any of its transitions falls outside any bound that is set.
 */
public class CatFilter {
  @JsonProperty("freq_min")
  private Double freqMin;
  @JsonProperty("freq_max")
  private Double freqMax;
  @JsonProperty("N_min")
  private Integer nMin;
  @JsonProperty("N_max")
  private Integer nMax;
  @JsonProperty("Ka_min")
  private Integer kaMin;
  @JsonProperty("Ka_max")
  private Integer kaMax;
  @JsonProperty("Kc_min")
  private Integer kcMin;
  @JsonProperty("Kc_max")
  private Integer kcMax;
  @JsonProperty("J_min")
  private Integer jMin;
  @JsonProperty("J_max")
  private Integer jMax;
  @JsonProperty("F1_min")
  private Integer f1Min;
  @JsonProperty("F1_max")
  private Integer f1Max;
  @JsonProperty("F_min")
  private Integer fMin;
  @JsonProperty("F_max")
  private Integer fMax;
  // Drop lines weaker than the strongest line of the whole catalog divided by this.
  @JsonProperty("dyn_range")
  private Double dynRange;

  public CatFilter() {}

  /**
   * @return true if the transition violates one of the bounds other than dynamic range.
   */
  boolean violatesBounds(Transition t) {
    return below(t.getFreq(), freqMin) || above(t.getFreq(), freqMax)
        || below(t.getN1(), nMin) || above(t.getN1(), nMax)
        || below(t.getKa1(), kaMin) || above(t.getKa1(), kaMax)
        || below(t.getKc1(), kcMin) || above(t.getKc1(), kcMax)
        || below(t.getJ1(), jMin) || above(t.getJ1(), jMax)
        || below(t.getF11(), f1Min) || above(t.getF11(), f1Max)
        || below(t.getF1(), fMin) || above(t.getF1(), fMax);
  }

  private static <T extends Comparable<T>> boolean below(T value, T bound) {
    return value != null && bound != null && value.compareTo(bound) < 0;
  }

  private static <T extends Comparable<T>> boolean above(T value, T bound) {
    return value != null && bound != null && value.compareTo(bound) > 0;
  }

  public CatFilter freqMin(Double freqMin) {
    this.freqMin = freqMin;
    return this;
  }

  public CatFilter freqMax(Double freqMax) {
    this.freqMax = freqMax;
    return this;
  }

  public CatFilter nMin(Integer nMin) {
    this.nMin = nMin;
    return this;
  }

  public CatFilter nMax(Integer nMax) {
    this.nMax = nMax;
    return this;
  }

  public CatFilter kaMin(Integer kaMin) {
    this.kaMin = kaMin;
    return this;
  }

  public CatFilter kaMax(Integer kaMax) {
    this.kaMax = kaMax;
    return this;
  }

  public CatFilter kcMin(Integer kcMin) {
    this.kcMin = kcMin;
    return this;
  }

  public CatFilter kcMax(Integer kcMax) {
    this.kcMax = kcMax;
    return this;
  }

  public CatFilter jMin(Integer jMin) {
    this.jMin = jMin;
    return this;
  }

  public CatFilter jMax(Integer jMax) {
    this.jMax = jMax;
    return this;
  }

  public CatFilter f1Min(Integer f1Min) {
    this.f1Min = f1Min;
    return this;
  }

  public CatFilter f1Max(Integer f1Max) {
    this.f1Max = f1Max;
    return this;
  }

  public CatFilter fMin(Integer fMin) {
    this.fMin = fMin;
    return this;
  }

  public CatFilter fMax(Integer fMax) {
    this.fMax = fMax;
    return this;
  }

  public CatFilter dynRange(Double dynRange) {
    this.dynRange = dynRange;
    return this;
  }

  public Double getFreqMin() {
    return freqMin;
  }

  public Double getFreqMax() {
    return freqMax;
  }

  public Integer getKaMax() {
    return kaMax;
  }

  public Double getDynRange() {
    return dynRange;
  }
}
