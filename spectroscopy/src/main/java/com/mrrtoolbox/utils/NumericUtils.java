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

package com.mrrtoolbox.utils;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.util.Precision;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Rounding and summary statistics shared by the spectrum and analysis code.  Rounding is half-even throughout so
 * frequencies quantize the same way wherever they are used as keys.
 */
public class NumericUtils {
  public static final int FREQUENCY_DECIMALS = 4;

  private NumericUtils() {}

  public static Double round4(Double value) {
    return round(value, FREQUENCY_DECIMALS);
  }

  public static Double round(Double value, int decimals) {
    return Precision.round(value, decimals, BigDecimal.ROUND_HALF_EVEN);
  }

  /**
   * Round to the nearest integer, ties to even.
   */
  public static int roundToInt(double value) {
    return (int) Math.rint(value);
  }

  public static double mean(double[] values) {
    return new Mean().evaluate(values);
  }

  /**
   * The population (biased) standard deviation.
   */
  public static double populationStd(double[] values) {
    return new StandardDeviation(false).evaluate(values);
  }

  public static double[] toArray(Collection<Double> values) {
    double[] result = new double[values.size()];
    int i = 0;
    for (Double v : values) {
      result[i++] = v;
    }
    return result;
  }

  /**
   * Evenly spaced values over [start, stop], both ends included.
   */
  public static double[] linspace(double start, double stop, int num) {
    double[] result = new double[Math.max(num, 0)];
    if (num == 1) {
      result[0] = start;
      return result;
    }
    double step = (stop - start) / (num - 1);
    for (int i = 0; i < num; i++) {
      result[i] = start + i * step;
    }
    if (num > 1) {
      result[num - 1] = stop;
    }
    return result;
  }
}
