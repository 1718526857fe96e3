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
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Batch conversion of raw FID captures into .ft spectra, optionally co-adding them first.
 */
public class FidTransformer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FidTransformer.class);

  private static final String OPTION_INPUT_FILES = "i";
  private static final String OPTION_SAMPLE_RATE = "r";
  private static final String OPTION_FID_FRACTION = "f";
  private static final String OPTION_KAISER_BETA = "k";
  private static final String OPTION_TOTAL_LENGTH = "t";
  private static final String OPTION_FREQ_START = "s";
  private static final String OPTION_FREQ_STOP = "e";
  private static final String OPTION_FULL_FT = "u";
  private static final String OPTION_COADD = "c";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class transforms raw time-domain FID captures (one sample per line) into frequency-domain .ft files, ",
      "written next to each input.  With --coadd, the inputs are first averaged, weighted by the number of averages ",
      "in their names (e.g. 100k), and only the co-added capture is transformed."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_FILES)
        .argName("input files")
        .desc("FID .txt files to transform")
        .hasArgs().valueSeparator(',').required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_SAMPLE_RATE)
        .argName("sample rate")
        .desc("Digitizer sample rate in Sa/s; 25 and 50 are read as GSa/s (default 25e9)")
        .hasArg()
        .longOpt("sample-rate")
    );
    add(Option.builder(OPTION_FID_FRACTION)
        .argName("fraction")
        .desc("Fraction of the FID to keep, in (0, 1] (default 1)")
        .hasArg()
        .longOpt("fid-fraction")
    );
    add(Option.builder(OPTION_KAISER_BETA)
        .argName("beta")
        .desc("Kaiser-Bessel window parameter (default 9.5)")
        .hasArg()
        .longOpt("kaiser-beta")
    );
    add(Option.builder(OPTION_TOTAL_LENGTH)
        .argName("microseconds")
        .desc("Zero-padded FID length in microseconds (default 80)")
        .hasArg()
        .longOpt("total-length")
    );
    add(Option.builder(OPTION_FREQ_START)
        .argName("MHz")
        .desc("First frequency to keep (default 2000)")
        .hasArg()
        .longOpt("freq-start")
    );
    add(Option.builder(OPTION_FREQ_STOP)
        .argName("MHz")
        .desc("Frequency at which to stop (default 8000)")
        .hasArg()
        .longOpt("freq-stop")
    );
    add(Option.builder(OPTION_FULL_FT)
        .argName("full ft")
        .desc("Write real and imaginary columns instead of the magnitude")
        .longOpt("full-ft")
    );
    add(Option.builder(OPTION_COADD)
        .argName("coadd")
        .desc("Co-add the inputs before transforming")
        .longOpt("coadd")
    );
    add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );
  }};

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();

  static {
    HELP_FORMATTER.setWidth(100);
  }

  public static FftParameters parametersFromCommandLine(CommandLine cl) {
    FftParameters params = new FftParameters();
    if (cl.hasOption(OPTION_FID_FRACTION)) {
      params.setFidFraction(Double.parseDouble(cl.getOptionValue(OPTION_FID_FRACTION)));
    }
    if (cl.hasOption(OPTION_KAISER_BETA)) {
      params.setKaiserBeta(Double.parseDouble(cl.getOptionValue(OPTION_KAISER_BETA)));
    }
    if (cl.hasOption(OPTION_TOTAL_LENGTH)) {
      params.setTotalLengthUs(Double.parseDouble(cl.getOptionValue(OPTION_TOTAL_LENGTH)));
    }
    if (cl.hasOption(OPTION_FREQ_START)) {
      params.setFreqStart(Double.parseDouble(cl.getOptionValue(OPTION_FREQ_START)));
    }
    if (cl.hasOption(OPTION_FREQ_STOP)) {
      params.setFreqStop(Double.parseDouble(cl.getOptionValue(OPTION_FREQ_STOP)));
    }
    params.setFullFt(cl.hasOption(OPTION_FULL_FT));
    return params;
  }

  public static void main(String[] args) throws Exception {
    Options opts = new Options();
    for (Option.Builder b : OPTION_BUILDERS) {
      opts.addOption(b.build());
    }

    CommandLine cl = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cl = parser.parse(opts, args);
    } catch (ParseException e) {
      System.err.format("Argument parsing failed: %s\n", e.getMessage());
      HELP_FORMATTER.printHelp(FidTransformer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(FidTransformer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    List<File> inputs = new ArrayList<>();
    for (String path : cl.getOptionValues(OPTION_INPUT_FILES)) {
      File f = new File(path);
      if (!f.isFile()) {
        System.err.format("Input file %s does not exist\n", path);
        System.exit(1);
      }
      inputs.add(f);
    }
    Double sampleRate = cl.hasOption(OPTION_SAMPLE_RATE) ?
        Double.parseDouble(cl.getOptionValue(OPTION_SAMPLE_RATE)) : null;
    FftParameters params = parametersFromCommandLine(cl);

    try {
      if (cl.hasOption(OPTION_COADD)) {
        Pair<String, WaveformSample> coAdd = FidBatch.coAdd(inputs, sampleRate);
        File saved = FidBatch.saveCoAdd(inputs.get(0).getAbsoluteFile().getParentFile(), coAdd);
        LOGGER.info("Wrote co-added FID to %s", saved);
        inputs = Collections.singletonList(saved);
      }
      for (File out : FidBatch.quickFftFiles(inputs, sampleRate, params)) {
        LOGGER.info("Wrote %s", out);
      }
    } catch (MalformedFileException | IOException e) {
      LOGGER.error("Unable to transform FID files: %s", e.getMessage());
      System.exit(1);
    }
  }
}
