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

import com.mrrtoolbox.errors.MalformedFileException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A raw free induction decay stored as text, one sample per line.  Older captures carry a header and a tab-separated
 * time column; for those the last field of each line is the amplitude.
 */
public class FidFile implements WaveformSource {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FidFile.class);

  public static final String EXTENSION = ".txt";
  public static final Double DEFAULT_SAMPLE_RATE = 25e9;

  // Digitizer rates are commonly given in GSa/s.
  private static final Double SHORTHAND_25 = 25.0;
  private static final Double SHORTHAND_50 = 50.0;

  private final File file;
  private final Double sampleRate;

  public FidFile(File file, Double sampleRate) {
    this.file = file;
    this.sampleRate = resolveSampleRate(sampleRate);
  }

  public FidFile(File file) {
    this(file, null);
  }

  public static Double resolveSampleRate(Double sampleRate) {
    if (sampleRate == null || SHORTHAND_25.equals(sampleRate)) {
      return DEFAULT_SAMPLE_RATE;
    }
    if (SHORTHAND_50.equals(sampleRate)) {
      return 50e9;
    }
    return sampleRate;
  }

  public File getFile() {
    return file;
  }

  public Double getSampleRate() {
    return sampleRate;
  }

  @Override
  public WaveformSample acquire() throws IOException {
    try {
      return new WaveformSample(readSamples(file), sampleRate);
    } catch (MalformedFileException e) {
      throw new IOException(e.getMessage(), e);
    }
  }

  public WaveformSample load() throws IOException, MalformedFileException {
    return new WaveformSample(readSamples(file), sampleRate);
  }

  public static double[] readSamples(File file) throws IOException, MalformedFileException {
    List<Double> values = new ArrayList<>();
    int lineNumber = 0;
    try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        String[] fields = StringUtils.split(trimmed, '\t');
        String field = fields[fields.length - 1].trim();
        try {
          values.add(Double.parseDouble(field));
        } catch (NumberFormatException e) {
          if (values.isEmpty()) {
            LOGGER.debug("Skipping header line %d of %s", lineNumber, file);
            continue;
          }
          throw new MalformedFileException(file, lineNumber, String.format("Not a sample value: '%s'", field), e);
        }
      }
    }
    if (values.isEmpty()) {
      throw new MalformedFileException(file, null, "File contains no samples");
    }
    double[] samples = new double[values.size()];
    for (int i = 0; i < samples.length; i++) {
      samples[i] = values.get(i);
    }
    LOGGER.debug("Read %d samples from %s", samples.length, file);
    return samples;
  }

  /**
   * Writes one sample per line in scientific notation with five fractional digits.
   */
  public static void writeSamples(File file, double[] samples) throws IOException {
    try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
      for (double s : samples) {
        writer.print(String.format(Locale.ROOT, "%.5E\n", s));
      }
      if (writer.checkError()) {
        throw new IOException("Failed writing " + file);
      }
    }
  }
}
