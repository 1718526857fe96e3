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

import com.mrrtoolbox.utils.NumericUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Renders a list of line positions and intensities as a noise-free spectrum of Gaussian line shapes.
 */
public class SpectrumSimulator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumSimulator.class);

  private static final double LN2 = Math.log(2.0);
  // Each line is drawn out to four half-widths on either side of its center.
  private static final double HALF_WIDTHS_DRAWN = 4.0;

  private SpectrumSimulator() {}

  /**
   * Lines strictly inside (freqMin, freqMax) contribute I * exp(-ln2 * ((x - f) / h)^2), h = fwhm / 2, to every
   * grid point within 4h.  Overlapping lines add.
   */
  public static Spectrum simulate(List<Peak> lines, SimulationParameters params) {
    params.validate();
    double fmin = params.getFreqMin();
    double fmax = params.getFreqMax();
    double step = params.getStep();
    double halfWidth = params.getFwhm() / 2.0;

    int num = NumericUtils.roundToInt((fmax + step - fmin) / step);
    double[] freqs = NumericUtils.linspace(fmin, fmax, num);
    double[] intensities = new double[num];

    int drawn = 0;
    for (Peak line : lines) {
      double f = line.getFrequency();
      if (!(f > fmin && f < fmax)) {
        continue;
      }
      int low = (int) Math.floor((f - HALF_WIDTHS_DRAWN * halfWidth - fmin) / step);
      int high = (int) Math.ceil((f + HALF_WIDTHS_DRAWN * halfWidth - fmin) / step);
      for (int row = Math.max(0, low); row <= Math.min(num - 1, high); row++) {
        double x = row * step + fmin;
        double offset = (x - f) / halfWidth;
        intensities[row] += line.getIntensity() * Math.exp(-LN2 * offset * offset);
      }
      drawn++;
    }

    if (params.getScaleFactor() != null) {
      for (int i = 0; i < num; i++) {
        intensities[i] *= params.getScaleFactor();
      }
    }
    LOGGER.debug("Simulated %d of %d lines on a %d point grid", drawn, lines.size(), num);
    return Spectrum.fromFrequencyAndIntensity(freqs, intensities);
  }
}
