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

import java.util.Collections;
import java.util.List;

/**
 * Enantiomeric excess computed from every pairing of the top N dominant and minor transitions.  The ee of dominant
 * transition i paired with minor transition j sits at index i * topN + j.
 */
public class EeResult {
  @JsonProperty("ee")
  private double[] ee;

  @JsonProperty("top_n_dominant")
  private List<IntensityRatioRecord> topDominant;

  @JsonProperty("top_n_minor")
  private List<IntensityRatioRecord> topMinor;

  @JsonProperty("statistics")
  private EeStatistics statistics;

  private EeResult() {}

  public EeResult(double[] ee, List<IntensityRatioRecord> topDominant, List<IntensityRatioRecord> topMinor,
                  EeStatistics statistics) {
    this.ee = ee;
    this.topDominant = topDominant;
    this.topMinor = topMinor;
    this.statistics = statistics;
  }

  public double[] getEe() {
    return ee.clone();
  }

  public List<IntensityRatioRecord> getTopDominant() {
    return Collections.unmodifiableList(topDominant);
  }

  public List<IntensityRatioRecord> getTopMinor() {
    return Collections.unmodifiableList(topMinor);
  }

  public EeStatistics getStatistics() {
    return statistics;
  }
}
