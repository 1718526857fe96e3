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
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jtransforms.fft.DoubleFFT_1D;

import java.util.Arrays;

/**
 * Turns a free induction decay into a frequency-domain spectrum: gate, Kaiser-Bessel window, zero-pad, FFT, then
 * extraction of a frequency window from the positive half of the transform.
 *
 * The stages can be run one at a time, in which case every intermediate array is kept for inspection, or all at once
 * through {@link #quickFft(FftParameters)}.  Both paths share the same arithmetic and produce identical output.
 */
public class FidProcessor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FidProcessor.class);

  // FFT amplitudes are reported divided by this constant so they land in a convenient intensity range.
  private static final Double FFT_SCALE = 100.0;
  private static final Double HZ_PER_MHZ = 1e6;
  private static final Double SECONDS_PER_US = 1e-6;

  private final WaveformSample fid;

  private Double fidFraction;
  private double[] gated;
  private Double kaiserBeta;
  private double[] windowed;
  private double[] windowedNormalized;
  private Double totalLengthUs;
  private double[] zeroPadded;

  public FidProcessor(WaveformSample fid) {
    this.fid = fid;
  }

  public WaveformSample getFid() {
    return fid;
  }

  /**
   * Keep the leading fraction of the FID.
   * @param ff Fraction to retain, in (0, 1].
   * @return The gated samples.
   */
  public double[] gate(Double ff) {
    this.gated = gateSamples(fid.getSamples(), ff);
    this.fidFraction = ff;
    this.windowed = null;
    this.windowedNormalized = null;
    this.zeroPadded = null;
    return Arrays.copyOf(gated, gated.length);
  }

  /**
   * Apply a Kaiser-Bessel window to the gated FID, gating the full FID first if {@link #gate(Double)} was not called.
   * Also computes the absolute-valued, max-normalized copy of the windowed signal.
   * @param kb Kaiser-Bessel beta.
   * @return The windowed samples.
   */
  public double[] kaiserWindow(Double kb) {
    if (gated == null) {
      gate(FftParameters.DEFAULT_FID_FRACTION);
    }
    this.windowed = applyWindow(gated, kb);
    this.windowedNormalized = absNormalize(windowed);
    this.kaiserBeta = kb;
    this.zeroPadded = null;
    return Arrays.copyOf(windowed, windowed.length);
  }

  /**
   * Copy the windowed FID into a zero buffer spanning the requested total duration.  A FID longer than that duration
   * is truncated.
   * @param trlUs Total duration in microseconds.
   * @return The padded samples.
   */
  public double[] zeroPad(Double trlUs) {
    if (windowed == null) {
      kaiserWindow(FftParameters.DEFAULT_KAISER_BETA);
    }
    this.zeroPadded = pad(windowed, paddedLength(trlUs, fid.getSampleRate()));
    this.totalLengthUs = trlUs;
    return Arrays.copyOf(zeroPadded, zeroPadded.length);
  }

  /**
   * Transform the most processed stage available and extract [fstart, fstop).
   * @return Columns of the spectrum: frequency then magnitude, or frequency, real and imaginary if fullFt is set.
   */
  public double[][] fft(Double fstart, Double fstop, Boolean fullFt) {
    double[] signal;
    if (zeroPadded != null) {
      signal = zeroPadded;
    } else {
      if (windowed == null) {
        kaiserWindow(FftParameters.DEFAULT_KAISER_BETA);
      }
      signal = windowed;
    }
    return transform(signal, fid.getSampleRate(), fstart, fstop, Boolean.TRUE.equals(fullFt));
  }

  /**
   * Run the full pipeline in one pass without storing intermediate stages.
   */
  public double[][] quickFft(FftParameters params) {
    return quickFft(fid, params);
  }

  public static double[][] quickFft(WaveformSample fid, FftParameters params) {
    params.validate();
    double[] signal = gateSamples(fid.getSamples(), params.getFidFraction());
    signal = applyWindow(signal, params.getKaiserBeta());
    signal = pad(signal, paddedLength(params.getTotalLengthUs(), fid.getSampleRate()));
    return transform(signal, fid.getSampleRate(), params.getFreqStart(), params.getFreqStop(),
        Boolean.TRUE.equals(params.getFullFt()));
  }

  static double[] gateSamples(double[] samples, Double ff) {
    if (ff == null || !(ff > 0.0) || ff > 1.0) {
      throw new InvalidParameterException(String.format("FID fraction must be in (0, 1], got %s", ff));
    }
    int keep = NumericUtils.roundToInt(samples.length * ff);
    if (keep == 0) {
      throw new InvalidParameterException(
          String.format("Gating %d samples at fraction %s leaves nothing to process", samples.length, ff));
    }
    return Arrays.copyOf(samples, keep);
  }

  static double[] applyWindow(double[] samples, Double kb) {
    if (kb == null || kb.isNaN()) {
      throw new InvalidParameterException("Kaiser-Bessel parameter must be a number");
    }
    double[] w = KaiserWindow.window(samples.length, kb);
    double[] result = new double[samples.length];
    for (int i = 0; i < samples.length; i++) {
      result[i] = samples[i] * w[i];
    }
    return result;
  }

  static double[] absNormalize(double[] samples) {
    double max = 0.0;
    for (double s : samples) {
      max = Math.max(max, Math.abs(s));
    }
    double[] result = new double[samples.length];
    if (max == 0.0) {
      return result;
    }
    for (int i = 0; i < samples.length; i++) {
      result[i] = Math.abs(samples[i]) / max;
    }
    return result;
  }

  static int paddedLength(Double trlUs, Double sampleRate) {
    if (trlUs == null || !(trlUs > 0.0)) {
      throw new InvalidParameterException(String.format("Total length must be positive, got %s", trlUs));
    }
    int length = NumericUtils.roundToInt(trlUs * SECONDS_PER_US * sampleRate);
    if (length < 2) {
      throw new InvalidParameterException(
          String.format("Total length %s us at %.3e Sa/s is too short to transform", trlUs, sampleRate));
    }
    return length;
  }

  static double[] pad(double[] samples, int length) {
    if (samples.length > length) {
      LOGGER.debug("Truncating %d samples to %d points while zero-padding", samples.length, length);
    }
    return Arrays.copyOf(samples, length);
  }

  /**
   * Frequency in MHz of each bin of an n-point transform, using the standard layout where bins past the midpoint hold
   * negative frequencies.
   */
  public static double[] frequencyAxis(int n, double sampleRate) {
    double spacing = 1.0 / sampleRate;
    double binWidth = 1.0 / (n * spacing);
    int positive = (n - 1) / 2 + 1;
    double[] freqs = new double[n];
    for (int k = 0; k < n; k++) {
      int index = k < positive ? k : k - n;
      freqs[k] = index * binWidth / HZ_PER_MHZ;
    }
    return freqs;
  }

  static double[][] transform(double[] signal, double sampleRate, Double fstart, Double fstop, boolean fullFt) {
    if (fstart == null || fstop == null || fstart > fstop) {
      throw new InvalidParameterException(
          String.format("Frequency window [%s, %s] is not a valid range", fstart, fstop));
    }
    int n = signal.length;
    double[] data = new double[2 * n];
    System.arraycopy(signal, 0, data, 0, n);
    new DoubleFFT_1D(n).realForwardFull(data);

    double[] freqs = frequencyAxis(n, sampleRate);
    double freqRes = NumericUtils.round4(1.0 / (n / sampleRate) / HZ_PER_MHZ);
    int positive = (n - 1) / 2 + 1;
    int start = clamp(NumericUtils.roundToInt((fstart - freqs[0]) / freqRes), 0, positive);
    int stop = clamp(NumericUtils.roundToInt((fstop - freqs[0]) / freqRes), start, positive);
    int rows = stop - start;
    if (rows == 0) {
      LOGGER.warn("Frequency window [%.4f, %.4f] MHz selects no points of a %d point transform", fstart, fstop, n);
    }

    double[][] columns = new double[fullFt ? 3 : 2][rows];
    for (int r = 0; r < rows; r++) {
      int k = start + r;
      double re = data[2 * k] / FFT_SCALE;
      double im = data[2 * k + 1] / FFT_SCALE;
      columns[0][r] = freqs[k];
      if (fullFt) {
        columns[1][r] = re;
        columns[2][r] = im;
      } else {
        columns[1][r] = Math.hypot(re, im);
      }
    }
    return columns;
  }

  private static int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(max, value));
  }

  /**
   * Time axis in microseconds for an array sampled at the FID's rate, for plotting intermediate stages.
   */
  public double[] timeAxisUs(int length) {
    double[] t = new double[length];
    for (int i = 0; i < length; i++) {
      t[i] = i / fid.getSampleRate() / SECONDS_PER_US;
    }
    return t;
  }

  public Double getFidFraction() {
    return fidFraction;
  }

  public double[] getGated() {
    return gated == null ? null : Arrays.copyOf(gated, gated.length);
  }

  public Double getKaiserBeta() {
    return kaiserBeta;
  }

  public double[] getWindowed() {
    return windowed == null ? null : Arrays.copyOf(windowed, windowed.length);
  }

  public double[] getWindowedNormalized() {
    return windowedNormalized == null ? null : Arrays.copyOf(windowedNormalized, windowedNormalized.length);
  }

  public Double getTotalLengthUs() {
    return totalLengthUs;
  }

  public double[] getZeroPadded() {
    return zeroPadded == null ? null : Arrays.copyOf(zeroPadded, zeroPadded.length);
  }
}
