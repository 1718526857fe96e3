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

import com.mrrtoolbox.errors.MalformedFileException;
import com.mrrtoolbox.fid.FftParameters;
import com.mrrtoolbox.fid.FidFile;
import com.mrrtoolbox.fid.FidProcessor;
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
 * Reading and writing of frequency-domain spectra.  Measured spectra are stored as .ft files and simulations as .prn
 * files, both whitespace-delimited with frequency in the first column.  A raw .txt FID can also be loaded, in which
 * case it is transformed on the fly.
 */
public class SpectrumFiles {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumFiles.class);

  public static final String FT_EXTENSION = ".ft";
  public static final String PRN_EXTENSION = ".prn";

  private static final String FREQUENCY_FORMAT = "%.4f";
  private static final String INTENSITY_FORMAT = "%.8f";
  private static final String SIMULATION_FORMAT = "%.5e";

  private SpectrumFiles() {}

  public static Spectrum read(File file) throws IOException, MalformedFileException {
    return read(file, new FftParameters(), null);
  }

  /**
   * @param fftParameters Used only when the file is a raw FID.
   * @param sampleRate Used only when the file is a raw FID; null selects the digitizer default.
   */
  public static Spectrum read(File file, FftParameters fftParameters, Double sampleRate)
      throws IOException, MalformedFileException {
    if (file.getName().endsWith(FidFile.EXTENSION)) {
      FidFile fid = new FidFile(file, sampleRate);
      LOGGER.info("Transforming raw FID %s", file);
      return new Spectrum(FidProcessor.quickFft(fid.load(), fftParameters));
    }
    return readColumns(file);
  }

  public static Spectrum readColumns(File file) throws IOException, MalformedFileException {
    List<double[]> rows = new ArrayList<>();
    int width = -1;
    int lineNumber = 0;
    try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String[] tokens = StringUtils.split(line.trim());
        if (tokens.length == 0) {
          continue;
        }
        if (width == -1) {
          width = tokens.length;
        } else if (tokens.length != width) {
          throw new MalformedFileException(file, lineNumber,
              String.format("Expected %d columns, found %d", width, tokens.length));
        }
        double[] row = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
          try {
            row[i] = Double.parseDouble(tokens[i]);
          } catch (NumberFormatException e) {
            throw new MalformedFileException(file, lineNumber, String.format("Not a number: '%s'", tokens[i]), e);
          }
        }
        rows.add(row);
      }
    }
    if (rows.size() < 2 || width < 2) {
      throw new MalformedFileException(file, null,
          "A spectrum file needs at least two rows of frequency and intensity");
    }
    double[][] columns = new double[width][rows.size()];
    for (int r = 0; r < rows.size(); r++) {
      for (int c = 0; c < width; c++) {
        columns[c][r] = rows.get(r)[c];
      }
    }
    LOGGER.debug("Read %d rows x %d columns from %s", rows.size(), width, file);
    return new Spectrum(columns);
  }

  public static void writeFt(File file, Spectrum spectrum) throws IOException {
    write(file, spectrum.getColumns(), INTENSITY_FORMAT);
  }

  public static void writeFt(File file, double[][] columns) throws IOException {
    write(file, columns, INTENSITY_FORMAT);
  }

  public static void writePrn(File file, Spectrum spectrum) throws IOException {
    write(file, spectrum.getColumns(), SIMULATION_FORMAT);
  }

  /**
   * Writes rows of [freq, I...] as produced by the peak pickers.
   */
  public static void writeRows(File file, double[][] rows) throws IOException {
    int width = rows.length == 0 ? 0 : rows[0].length;
    double[][] columns = new double[width][rows.length];
    for (int r = 0; r < rows.length; r++) {
      for (int c = 0; c < width; c++) {
        columns[c][r] = rows[r][c];
      }
    }
    write(file, columns, INTENSITY_FORMAT);
  }

  private static void write(File file, double[][] columns, String intensityFormat) throws IOException {
    int rows = columns.length == 0 ? 0 : columns[0].length;
    try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
      StringBuilder sb = new StringBuilder();
      for (int r = 0; r < rows; r++) {
        sb.setLength(0);
        sb.append(String.format(Locale.ROOT, FREQUENCY_FORMAT, columns[0][r]));
        for (int c = 1; c < columns.length; c++) {
          sb.append(' ').append(String.format(Locale.ROOT, intensityFormat, columns[c][r]));
        }
        sb.append('\n');
        writer.print(sb);
      }
      if (writer.checkError()) {
        throw new IOException("Failed writing " + file);
      }
    }
    LOGGER.info("Wrote %d rows to %s", rows, file);
  }
}
