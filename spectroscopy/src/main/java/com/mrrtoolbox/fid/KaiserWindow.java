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

import com.mrrtoolbox.errors.InvalidParameterException;

/**
 * Kaiser-Bessel tapering window, w[n] = I0(beta * sqrt(1 - ((n - alpha) / alpha)^2)) / I0(beta) with
 * alpha = (M - 1) / 2.
 */
public class KaiserWindow {
  // The I0 power series converges quickly for the betas used on FIDs; this bounds pathological inputs.
  private static final int MAX_SERIES_TERMS = 500;
  private static final double SERIES_TOLERANCE = 1e-17;

  private KaiserWindow() {}

  public static double[] window(int length, double beta) {
    if (length < 0) {
      throw new InvalidParameterException(String.format("Window length must be non-negative, got %d", length));
    }
    if (length == 0) {
      return new double[0];
    }
    if (length == 1) {
      return new double[] {1.0};
    }
    double alpha = (length - 1) / 2.0;
    double denominator = besselI0(beta);
    double[] w = new double[length];
    for (int n = 0; n < length; n++) {
      double ratio = (n - alpha) / alpha;
      double radicand = Math.max(0.0, 1.0 - ratio * ratio);
      w[n] = besselI0(beta * Math.sqrt(radicand)) / denominator;
    }
    return w;
  }

  /**
   * Zeroth-order modified Bessel function of the first kind, via its power series.
   */
  public static double besselI0(double x) {
    double quarterSquare = x * x / 4.0;
    double term = 1.0;
    double sum = 1.0;
    for (int k = 1; k < MAX_SERIES_TERMS; k++) {
      term *= quarterSquare / ((double) k * k);
      sum += term;
      if (term < SERIES_TOLERANCE * sum) {
        break;
      }
    }
    return sum;
  }
}
