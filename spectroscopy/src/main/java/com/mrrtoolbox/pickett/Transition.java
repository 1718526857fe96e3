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
 * One predicted line from an SPCAT catalog.  Quantum numbers that are blank in the catalog are null.
 * Upper-state quantum numbers carry the suffix 1 and lower-state ones the suffix 0.
 */
public class Transition {
  @JsonProperty("freq")
  private Double freq;
  @JsonProperty("err")
  private Double err;
  // log10 of the line intensity
  @JsonProperty("lgint")
  private Double lgint;
  @JsonProperty("dr")
  private Integer dr;
  @JsonProperty("elo")
  private Double elo;
  @JsonProperty("gup")
  private Integer gup;
  @JsonProperty("tag")
  private Integer tag;
  @JsonProperty("qnfmt")
  private Integer qnfmt;

  @JsonProperty("N1")
  private Integer n1;
  @JsonProperty("Ka1")
  private Integer ka1;
  @JsonProperty("Kc1")
  private Integer kc1;
  @JsonProperty("J1")
  private Integer j1;
  @JsonProperty("F11")
  private Integer f11;
  @JsonProperty("F1")
  private Integer f1;
  @JsonProperty("N0")
  private Integer n0;
  @JsonProperty("Ka0")
  private Integer ka0;
  @JsonProperty("Kc0")
  private Integer kc0;
  @JsonProperty("J0")
  private Integer j0;
  @JsonProperty("F10")
  private Integer f10;
  @JsonProperty("F0")
  private Integer f0;

  public Transition() {}

  public Transition(Double freq, Double err, Double lgint, Integer dr, Double elo, Integer gup, Integer tag,
                    Integer qnfmt, Integer[] upper, Integer[] lower) {
    this.freq = freq;
    this.err = err;
    this.lgint = lgint;
    this.dr = dr;
    this.elo = elo;
    this.gup = gup;
    this.tag = tag;
    this.qnfmt = qnfmt;
    this.n1 = upper[0];
    this.ka1 = upper[1];
    this.kc1 = upper[2];
    this.j1 = upper[3];
    this.f11 = upper[4];
    this.f1 = upper[5];
    this.n0 = lower[0];
    this.ka0 = lower[1];
    this.kc0 = lower[2];
    this.j0 = lower[3];
    this.f10 = lower[4];
    this.f0 = lower[5];
  }

  /**
   * An asymmetric-top transition with only N, Ka and Kc assigned.
   */
  public static Transition asymmetricTop(Double freq, Double lgint, int n1, int ka1, int kc1,
                                         int n0, int ka0, int kc0) {
    return new Transition(freq, 0.0, lgint, 3, 0.0, 2 * n1 + 1, 0, 303,
        new Integer[] {n1, ka1, kc1, null, null, null}, new Integer[] {n0, ka0, kc0, null, null, null});
  }

  /**
   * @return 10^lgint
   */
  public Double getIntensity() {
    return Math.pow(10.0, lgint);
  }

  public Double getFreq() {
    return freq;
  }

  public Double getErr() {
    return err;
  }

  public Double getLgint() {
    return lgint;
  }

  public Integer getDr() {
    return dr;
  }

  public Double getElo() {
    return elo;
  }

  public Integer getGup() {
    return gup;
  }

  public Integer getTag() {
    return tag;
  }

  public Integer getQnfmt() {
    return qnfmt;
  }

  public Integer getN1() {
    return n1;
  }

  public Integer getKa1() {
    return ka1;
  }

  public Integer getKc1() {
    return kc1;
  }

  public Integer getJ1() {
    return j1;
  }

  public Integer getF11() {
    return f11;
  }

  public Integer getF1() {
    return f1;
  }

  public Integer getN0() {
    return n0;
  }

  public Integer getKa0() {
    return ka0;
  }

  public Integer getKc0() {
    return kc0;
  }

  public Integer getJ0() {
    return j0;
  }

  public Integer getF10() {
    return f10;
  }

  public Integer getF0() {
    return f0;
  }
}
