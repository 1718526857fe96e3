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

package com.mrrtoolbox.pickett;

import com.mrrtoolbox.errors.MalformedFileException;
import com.mrrtoolbox.spectrum.SimulationParameters;
import com.mrrtoolbox.spectrum.Spectrum;
import com.mrrtoolbox.spectrum.SpectrumFiles;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Renders SPCAT predictions as Gaussian line-shape spectra (.prn) for overlay on measured spectra.
 */
public class CatSimulator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CatSimulator.class);

  private static final String OPTION_INPUT_FILES = "i";
  private static final String OPTION_OUTPUT_DIRECTORY = "o";
  private static final String OPTION_FREQ_MIN = "s";
  private static final String OPTION_FREQ_MAX = "e";
  private static final String OPTION_STEP = "p";
  private static final String OPTION_FWHM = "w";
  private static final String OPTION_KA_MAX = "k";
  private static final String OPTION_DYN_RANGE = "d";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class simulates the spectrum predicted by one or more SPCAT .cat files, writing one .prn file per ",
      "input.  Lines can be limited by Ka and by dynamic range before simulation."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_FILES)
        .argName("cat files")
        .desc("SPCAT .cat files to simulate")
        .hasArgs().valueSeparator(',').required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT_DIRECTORY)
        .argName("directory")
        .desc("Where to write the .prn files (default: next to each input)")
        .hasArg()
        .longOpt("output-dir")
    );
    add(Option.builder(OPTION_FREQ_MIN)
        .argName("MHz")
        .desc("Low end of the simulated grid (default 2000)")
        .hasArg()
        .longOpt("freq-min")
    );
    add(Option.builder(OPTION_FREQ_MAX)
        .argName("MHz")
        .desc("High end of the simulated grid (default 8000)")
        .hasArg()
        .longOpt("freq-max")
    );
    add(Option.builder(OPTION_STEP)
        .argName("MHz")
        .desc("Grid spacing (default 0.0125)")
        .hasArg()
        .longOpt("step")
    );
    add(Option.builder(OPTION_FWHM)
        .argName("MHz")
        .desc("Full width at half maximum of each line (default 0.060)")
        .hasArg()
        .longOpt("fwhm")
    );
    add(Option.builder(OPTION_KA_MAX)
        .argName("Ka")
        .desc("Drop transitions with an upper-state Ka above this")
        .hasArg()
        .longOpt("ka-max")
    );
    add(Option.builder(OPTION_DYN_RANGE)
        .argName("ratio")
        .desc("Drop transitions weaker than the strongest line divided by this")
        .hasArg()
        .longOpt("dyn-range")
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

  public static SimulationParameters parametersFromCommandLine(CommandLine cl) {
    SimulationParameters params = new SimulationParameters();
    if (cl.hasOption(OPTION_FREQ_MIN)) {
      params.setFreqMin(Double.parseDouble(cl.getOptionValue(OPTION_FREQ_MIN)));
    }
    if (cl.hasOption(OPTION_FREQ_MAX)) {
      params.setFreqMax(Double.parseDouble(cl.getOptionValue(OPTION_FREQ_MAX)));
    }
    if (cl.hasOption(OPTION_STEP)) {
      params.setStep(Double.parseDouble(cl.getOptionValue(OPTION_STEP)));
    }
    if (cl.hasOption(OPTION_FWHM)) {
      params.setFwhm(Double.parseDouble(cl.getOptionValue(OPTION_FWHM)));
    }
    params.validate();
    return params;
  }

  /**
   * Simulate a catalog after restricting it to the grid and the optional Ka and dynamic range limits.
   */
  public static Spectrum simulate(CatFile cat, SimulationParameters params, Integer kaMax, Double dynRange) {
    CatFilter filter = new CatFilter()
        .freqMin(params.getFreqMin())
        .freqMax(params.getFreqMax())
        .kaMax(kaMax)
        .dynRange(dynRange);
    LinkedHashMap<Double, List<Transition>> groups = cat.filter(filter);
    LOGGER.info("Simulating %d of %d line groups from %s", groups.size(), cat.getTransitions().size(), cat.getName());
    return CatFile.simulate(groups, params);
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
      HELP_FORMATTER.printHelp(CatSimulator.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(CatSimulator.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    SimulationParameters params = parametersFromCommandLine(cl);
    Integer kaMax = cl.hasOption(OPTION_KA_MAX) ? Integer.valueOf(cl.getOptionValue(OPTION_KA_MAX)) : null;
    Double dynRange = cl.hasOption(OPTION_DYN_RANGE) ? Double.valueOf(cl.getOptionValue(OPTION_DYN_RANGE)) : null;
    File outputDirectory = cl.hasOption(OPTION_OUTPUT_DIRECTORY) ?
        new File(cl.getOptionValue(OPTION_OUTPUT_DIRECTORY)) : null;
    if (outputDirectory != null && !outputDirectory.isDirectory()) {
      System.err.format("Output directory %s does not exist\n", outputDirectory);
      System.exit(1);
    }

    for (String path : cl.getOptionValues(OPTION_INPUT_FILES)) {
      File input = new File(path);
      try {
        CatFile cat = CatFile.parse(input);
        File dir = outputDirectory != null ? outputDirectory : input.getAbsoluteFile().getParentFile();
        File output = new File(dir, FilenameUtils.getBaseName(input.getName()) + SpectrumFiles.PRN_EXTENSION);
        SpectrumFiles.writePrn(output, simulate(cat, params, kaMax, dynRange));
        LOGGER.info("Wrote %s", output);
      } catch (MalformedFileException | IOException e) {
        LOGGER.error("Unable to simulate %s: %s", input, e.getMessage());
        System.exit(1);
      }
    }
  }
}
