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
import com.mrrtoolbox.errors.MalformedFileException;
import com.mrrtoolbox.spectrum.SpectrumFiles;
import com.mrrtoolbox.utils.NumericUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Operations over sets of FID captures.  Capture files are named with underscore-separated fields, one of which
 * gives the number of averaged FIDs in thousands with a trailing 'k' (e.g. {@code sample_100k_20C.txt}).
 */
public class FidBatch {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FidBatch.class);

  private static final String NAME_DELIMITER = "_";
  private static final String AVERAGES_SUFFIX = "k";
  private static final String COADD_PREFIX = "CoAdd";

  private FidBatch() {}

  /**
   * Parse the number of averages (in thousands) out of each file name.
   * @return The total, and the per-file weights in input order.
   */
  public static Pair<Integer, List<Integer>> weightsAndTotalAverages(List<File> files) {
    int total = 0;
    List<Integer> weights = new ArrayList<>(files.size());
    for (File f : files) {
      Integer weight = null;
      for (String token : StringUtils.split(FilenameUtils.getBaseName(f.getName()), NAME_DELIMITER)) {
        Integer averages = parseAverages(token);
        if (averages != null) {
          weight = weight == null ? averages : weight + averages;
        }
      }
      if (weight == null) {
        throw new InvalidParameterException(
            String.format("File name %s does not give a number of averages such as '100k'", f.getName()));
      }
      weights.add(weight);
      total += weight;
    }
    return Pair.of(total, weights);
  }

  private static Integer parseAverages(String token) {
    if (!token.endsWith(AVERAGES_SUFFIX)) {
      return null;
    }
    try {
      return Integer.parseInt(token.substring(0, token.length() - AVERAGES_SUFFIX.length()));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Average FIDs weighted by their number of averages.
   * @return The co-added file's base name and its samples.
   */
  public static Pair<String, WaveformSample> coAdd(List<File> files, Double sampleRate)
      throws IOException, MalformedFileException {
    if (files.isEmpty()) {
      throw new InvalidParameterException("No files to co-add");
    }
    Pair<Integer, List<Integer>> weights = weightsAndTotalAverages(files);
    Integer total = weights.getLeft();
    Double rate = FidFile.resolveSampleRate(sampleRate);

    double[] sum = null;
    for (int i = 0; i < files.size(); i++) {
      double[] samples = FidFile.readSamples(files.get(i));
      if (sum == null) {
        sum = new double[samples.length];
      } else if (samples.length != sum.length) {
        throw new InvalidParameterException(String.format("%s has %d samples, expected %d",
            files.get(i).getName(), samples.length, sum.length));
      }
      double weight = weights.getRight().get(i) / (double) total;
      for (int j = 0; j < samples.length; j++) {
        sum[j] += samples[j] * weight;
      }
    }

    String name = coAddName(files.get(0), total);
    LOGGER.info("Co-added %d files (%dk averages) as %s", files.size(), total, name);
    return Pair.of(name, new WaveformSample(sum, rate));
  }

  /**
   * The first file's name with its leading field replaced by "CoAdd" and its averages field replaced by the total.
   */
  static String coAddName(File first, Integer total) {
    String[] tokens = StringUtils.split(FilenameUtils.getBaseName(first.getName()), NAME_DELIMITER);
    List<String> parts = new ArrayList<>();
    parts.add(COADD_PREFIX);
    for (int i = 1; i < tokens.length; i++) {
      parts.add(parseAverages(tokens[i]) != null ? total + AVERAGES_SUFFIX : tokens[i]);
    }
    return StringUtils.join(parts, NAME_DELIMITER);
  }

  public static File saveCoAdd(File directory, Pair<String, WaveformSample> coAdd) throws IOException {
    File out = new File(directory, coAdd.getLeft() + FidFile.EXTENSION);
    FidFile.writeSamples(out, coAdd.getRight().getSamples());
    return out;
  }

  /**
   * Transform each file and write it next to the input as
   * {@code <name>_FF<ff*10>_KB<kb*10>_TRL<trl>.ft}, with a {@code _full} suffix for real/imaginary output.
   * @return The files written.
   */
  public static List<File> quickFftFiles(List<File> files, Double sampleRate, FftParameters params)
      throws IOException, MalformedFileException {
    params.validate();
    List<File> written = new ArrayList<>(files.size());
    for (File f : files) {
      WaveformSample fid = new FidFile(f, sampleRate).load();
      double[][] ft = FidProcessor.quickFft(fid, params);
      File out = new File(f.getParentFile(), outputName(f, params));
      SpectrumFiles.writeFt(out, ft);
      written.add(out);
    }
    return written;
  }

  static String outputName(File input, FftParameters params) {
    String suffix = String.format(Locale.ROOT, "_FF%d_KB%d_TRL%d",
        NumericUtils.roundToInt(params.getFidFraction() * 10),
        NumericUtils.roundToInt(params.getKaiserBeta() * 10),
        NumericUtils.roundToInt(params.getTotalLengthUs()));
    if (Boolean.TRUE.equals(params.getFullFt())) {
      suffix += "_full";
    }
    return FilenameUtils.getBaseName(input.getName()) + suffix + SpectrumFiles.FT_EXTENSION;
  }
}
