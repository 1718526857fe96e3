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

package com.mrrtoolbox.instruments;

import com.mrrtoolbox.errors.InvalidParameterException;
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * Linear frequency sweeps with the two TTL markers that gate the amplifier and trigger the digitizer, laid out as the
 * three column text files the waveform generator imports.
 */
public class ChirpGenerator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ChirpGenerator.class);

  public static final Double DEFAULT_DELAY = 1.5e-6;
  // Chirps shorter than this are delayed by the difference so every chirp ends at the same time.
  public static final Double ALIGNED_CHIRP_END = 4.0e-6;
  public static final Double DEFAULT_MARKER1_BUFFER = 0.5e-6;
  public static final Double DEFAULT_MARKER2_BUFFER = 0.5e-6;
  public static final Double DEFAULT_MARKER1_DURATION = 1.0e-6;
  public static final Double DEFAULT_MARKER2_DURATION = 1.0e-6;
  public static final Double DEFAULT_END_BUFFER = 45.0e-6;
  public static final Integer DEFAULT_FRAMES = 8;

  // Marker 1 never starts before row 2400 nor ends before row 26400.
  static final int MARKER1_MIN_START_ROW = 2400;
  static final int MARKER1_MIN_STOP_ROW = 26400;

  private static final String ROW_FORMAT = "%.6f\t%d\t%d\n";

  private ChirpGenerator() {}

  /**
   * sin(2 pi f0 t + 2 pi (f1 - f0) t^2 / (2 T)) sampled at rint(rate * T) evenly spaced times over [0, T].
   *
   * @param sampleRate Samples per second.
   * @param freqStart Hz.
   * @param freqStop Hz.
   * @param duration Seconds.
   */
  public static double[] linearChirp(double sampleRate, double freqStart, double freqStop, double duration) {
    if (!(sampleRate > 0.0) || !(duration > 0.0)) {
      throw new InvalidParameterException(
          String.format("Sample rate and chirp duration must be positive, got %e and %e", sampleRate, duration));
    }
    double[] t = NumericUtils.linspace(0.0, duration, (int) Math.rint(sampleRate * duration));
    double[] chirp = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      double first = 2 * Math.PI * freqStart * t[i];
      double second = 2 * Math.PI * (freqStop - freqStart) * (t[i] * t[i] / (2 * duration));
      chirp[i] = Math.sin(first + second);
    }
    return chirp;
  }

  /**
   * Chirp amplitude and the two marker channels, one entry per sample.
   */
  public static class ChirpWaveform {
    private final double[] waveform;
    private final int[] marker1;
    private final int[] marker2;

    ChirpWaveform(double[] waveform, int[] marker1, int[] marker2) {
      this.waveform = waveform;
      this.marker1 = marker1;
      this.marker2 = marker2;
    }

    public int size() {
      return waveform.length;
    }

    public double[] getWaveform() {
      return waveform;
    }

    public int[] getMarker1() {
      return marker1;
    }

    public int[] getMarker2() {
      return marker2;
    }

    public void write(File file) throws IOException {
      try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
        for (int i = 0; i < waveform.length; i++) {
          writer.print(String.format(Locale.ROOT, ROW_FORMAT, waveform[i], marker1[i], marker2[i]));
        }
        if (writer.checkError()) {
          throw new IOException("Failed writing " + file);
        }
      }
      LOGGER.info("Wrote %d sample waveform to %s", waveform.length, file);
    }
  }

  public static ChirpWaveform generateWaveform(double sampleRate, double freqStart, double freqStop,
                                               double chirpDuration) {
    return generateWaveform(sampleRate, freqStart, freqStop, chirpDuration,
        null, null, null, null, null, null, null);
  }

  /**
   * Stack identical frames of: delay, marker 1 ending one buffer before the chirp, the chirp, one buffer, marker 2 and
   * the end buffer.  Any null argument takes its default.
   *
   * @param delay Time before the chirp; the chirp is further delayed by {@code 4 us - chirpDuration}.
   */
  public static ChirpWaveform generateWaveform(double sampleRate, double freqStart, double freqStop,
                                               double chirpDuration, Double delay, Double marker1Buffer,
                                               Double marker2Buffer, Double marker1Duration,
                                               Double marker2Duration, Double endBuffer, Integer frames) {
    double d = (delay == null ? DEFAULT_DELAY : delay) + (ALIGNED_CHIRP_END - chirpDuration);
    double m1Buffer = marker1Buffer == null ? DEFAULT_MARKER1_BUFFER : marker1Buffer;
    double m2Buffer = marker2Buffer == null ? DEFAULT_MARKER2_BUFFER : marker2Buffer;
    double m1Duration = marker1Duration == null ? DEFAULT_MARKER1_DURATION : marker1Duration;
    double m2Duration = marker2Duration == null ? DEFAULT_MARKER2_DURATION : marker2Duration;
    double end = endBuffer == null ? DEFAULT_END_BUFFER : endBuffer;
    int numFrames = frames == null ? DEFAULT_FRAMES : frames;
    if (numFrames < 1) {
      throw new InvalidParameterException(String.format("Need at least one frame, got %d", numFrames));
    }

    double frameTime = d + chirpDuration + m2Buffer + m2Duration + end;
    double frameRows = frameTime * sampleRate;
    double totalTime = NumericUtils.round(frameTime * numFrames, 11);
    int totalRows = (int) (totalTime * sampleRate);

    double[] waveform = new double[totalRows];
    int[] marker1 = new int[totalRows];
    int[] marker2 = new int[totalRows];
    double[] chirp = linearChirp(sampleRate, freqStart, freqStop, chirpDuration);

    for (int f = 0; f < numFrames; f++) {
      int chirpStart = (int) (d * sampleRate + f * frameRows);
      int chirpStop = chirpStart + chirp.length;

      int m1Start = Math.max(MARKER1_MIN_START_ROW,
          (int) (chirpStart - m1Buffer * sampleRate - m1Duration * sampleRate));
      int m1Stop = Math.max(MARKER1_MIN_STOP_ROW, (int) (chirpStart - m1Buffer * sampleRate));
      int m2Start = (int) (chirpStop + m2Buffer * sampleRate);
      int m2Stop = (int) (m2Start + m2Duration * sampleRate);

      System.arraycopy(chirp, 0, waveform, chirpStart, Math.max(0, Math.min(chirp.length, totalRows - chirpStart)));
      fill(marker1, m1Start, m1Stop);
      fill(marker2, m2Start, m2Stop);
    }
    LOGGER.debug("Generated %d frames of %.3e s chirp, %d samples", numFrames, chirpDuration, totalRows);
    return new ChirpWaveform(waveform, marker1, marker2);
  }

  private static void fill(int[] marker, int from, int to) {
    for (int i = Math.max(0, from); i < Math.min(marker.length, to); i++) {
      marker[i] = 1;
    }
  }
}
