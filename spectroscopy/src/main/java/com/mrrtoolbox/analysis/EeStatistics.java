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
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.commons.math3.stat.StatUtils;

public class EeStatistics {
  @JsonProperty("mean")
  private Double mean;

  @JsonProperty("std_dev")
  private Double stdDev;

  // std / sqrt(top N), not sqrt of the number of pairs
  @JsonProperty("std_err")
  private Double stdErr;

  @JsonProperty("max")
  private Double max;

  @JsonProperty("min")
  private Double min;

  private EeStatistics() {}

  public EeStatistics(Double mean, Double stdDev, Double stdErr, Double max, Double min) {
    this.mean = mean;
    this.stdDev = stdDev;
    this.stdErr = stdErr;
    this.max = max;
    this.min = min;
  }

  public static EeStatistics of(double[] ee, int topN) {
    if (ee.length == 0 || topN < 1) {
      throw new InvalidParameterException("Cannot summarize an empty set of ee calculations");
    }
    double std = NumericUtils.populationStd(ee);
    return new EeStatistics(NumericUtils.mean(ee), std, std / Math.sqrt(topN), StatUtils.max(ee), StatUtils.min(ee));
  }

  public Double getMean() {
    return mean;
  }

  public Double getStdDev() {
    return stdDev;
  }

  public Double getStdErr() {
    return stdErr;
  }

  public Double getMax() {
    return max;
  }

  public Double getMin() {
    return min;
  }
}
