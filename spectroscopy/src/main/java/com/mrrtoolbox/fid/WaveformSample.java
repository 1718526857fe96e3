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

import java.util.Arrays;

/**
 * An immutable time-domain capture: amplitudes plus the rate at which they were digitized.
 */
public class WaveformSample {
  private final double[] samples;
  private final Double sampleRate;

  public WaveformSample(double[] samples, Double sampleRate) {
    if (samples == null || samples.length < 1) {
      throw new InvalidParameterException("A waveform must contain at least one sample");
    }
    if (sampleRate == null || !(sampleRate > 0.0)) {
      throw new InvalidParameterException(String.format("Sample rate must be positive, got %s", sampleRate));
    }
    this.samples = Arrays.copyOf(samples, samples.length);
    this.sampleRate = sampleRate;
  }

  public double[] getSamples() {
    return Arrays.copyOf(samples, samples.length);
  }

  public int size() {
    return samples.length;
  }

  /**
   * @return Samples per second.
   */
  public Double getSampleRate() {
    return sampleRate;
  }

  /**
   * @return Total capture duration in seconds.
   */
  public Double getDuration() {
    return samples.length / sampleRate;
  }
}
