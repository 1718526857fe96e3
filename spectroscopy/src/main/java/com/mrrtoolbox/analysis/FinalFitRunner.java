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

package com.mrrtoolbox.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mrrtoolbox.errors.InvalidParameterException;
import com.mrrtoolbox.errors.MalformedFileException;
import com.mrrtoolbox.errors.NoConvergenceException;
import com.mrrtoolbox.pickett.CatFile;
import com.mrrtoolbox.pickett.PickettConstant;
import com.mrrtoolbox.pickett.PickettRunner;
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
import java.util.List;

/**
 * Command line driver for the automated SPFIT refinement of a predicted spectrum against a measured one.
 */
public class FinalFitRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FinalFitRunner.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.configure(SerializationFeature.INDENT_OUTPUT, true);
  }

  private static final String OPTION_SPECTRUM = "s";
  private static final String OPTION_CAT = "c";
  private static final String OPTION_THRESHOLD = "t";
  private static final String OPTION_QDC_MODE = "m";
  private static final String OPTION_QDCS = "q";
  private static final String OPTION_FIX_QDCS = "x";
  private static final String OPTION_MAX_ERROR = "e";
  private static final String OPTION_FREQ_MATCH = "fm";
  private static final String OPTION_FREQ_MIN = "fmin";
  private static final String OPTION_FREQ_MAX = "fmax";
  private static final String OPTION_KA_MAX = "kamax";
  private static final String OPTION_DYN_RANGE = "dr";
  private static final String OPTION_OMIT = "omit";
  private static final String OPTION_PICKETT_DIR = "p";
  private static final String OPTION_CONFIG = "config";
  private static final String OPTION_OUTPUT = "o";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class refines a close SPCAT prediction (name.cat, with name.par beside it) against a measured spectrum. ",
      "Peaks are assigned to predicted lines by frequency, poorly determined distortion constants and badly fit ",
      "lines are dropped, and line centers are refined by Gaussian fits before a final SPFIT run.  name.lin, ",
      "name.par, name.pi and name.var are rewritten in the catalog's directory."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_SPECTRUM)
        .argName("spectrum")
        .desc("Measured spectrum (.ft, .prn or raw FID .txt)")
        .hasArg().required()
        .longOpt("spectrum")
    );
    add(Option.builder(OPTION_CAT)
        .argName("cat file")
        .desc("SPCAT prediction close to the final fit")
        .hasArg().required()
        .longOpt("cat")
    );
    add(Option.builder(OPTION_THRESHOLD)
        .argName("mV")
        .desc("Peak pick threshold for the measured spectrum")
        .hasArg().required()
        .longOpt("threshold")
    );
    add(Option.builder(OPTION_QDC_MODE)
        .argName("mode")
        .desc("PAR to fit the distortion constants of the .par file, SPECIFIC to fit those given with -q " +
            "(default PAR)")
        .hasArg()
        .longOpt("qdc-mode")
    );
    add(Option.builder(OPTION_QDCS)
        .argName("constants")
        .desc("Distortion constants to fit in SPECIFIC mode: DJ, DJK, DK, dJ, dK")
        .hasArgs().valueSeparator(',')
        .longOpt("qdcs")
    );
    add(Option.builder(OPTION_FIX_QDCS)
        .argName("fix")
        .desc("Hold distortion constants fixed instead of fitting them")
        .longOpt("fix-qdcs")
    );
    add(Option.builder(OPTION_MAX_ERROR)
        .argName("MHz")
        .desc("Largest obs - calc a line may keep")
        .hasArg()
        .longOpt("max-error")
    );
    add(Option.builder(OPTION_FREQ_MATCH)
        .argName("MHz")
        .desc("Largest predicted to measured difference for an assignment")
        .hasArg()
        .longOpt("freq-match")
    );
    add(Option.builder(OPTION_FREQ_MIN)
        .argName("MHz")
        .desc("Lowest predicted frequency to assign")
        .hasArg()
        .longOpt("freq-min")
    );
    add(Option.builder(OPTION_FREQ_MAX)
        .argName("MHz")
        .desc("Highest predicted frequency to assign")
        .hasArg()
        .longOpt("freq-max")
    );
    add(Option.builder(OPTION_KA_MAX)
        .argName("Ka")
        .desc("Highest upper-state Ka to assign")
        .hasArg()
        .longOpt("ka-max")
    );
    add(Option.builder(OPTION_DYN_RANGE)
        .argName("ratio")
        .desc("Dynamic range of predicted lines to assign")
        .hasArg()
        .longOpt("dyn-range")
    );
    add(Option.builder(OPTION_OMIT)
        .argName("MHz list")
        .desc("Measured frequencies never to assign")
        .hasArgs().valueSeparator(',')
        .longOpt("omit")
    );
    add(Option.builder(OPTION_PICKETT_DIR)
        .argName("directory")
        .desc("Directory holding spfit, spcat and piform; they are copied next to the catalog if missing there")
        .hasArg()
        .longOpt("pickett-dir")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("json file")
        .desc("Toolbox configuration to use instead of the bundled defaults")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("json file")
        .desc("Where to write the fit summary")
        .hasArg()
        .longOpt("output")
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

  /**
   * Command line values override the configured fit settings.
   */
  public static FinalFitSettings settingsFromCommandLine(CommandLine cl, FinalFitSettings settings) {
    if (cl.hasOption(OPTION_MAX_ERROR)) {
      settings.setMaxError(Double.valueOf(cl.getOptionValue(OPTION_MAX_ERROR)));
    }
    if (cl.hasOption(OPTION_FREQ_MATCH)) {
      settings.setFreqMatch(Double.valueOf(cl.getOptionValue(OPTION_FREQ_MATCH)));
    }
    if (cl.hasOption(OPTION_FREQ_MIN)) {
      settings.setFreqMin(Double.valueOf(cl.getOptionValue(OPTION_FREQ_MIN)));
    }
    if (cl.hasOption(OPTION_FREQ_MAX)) {
      settings.setFreqMax(Double.valueOf(cl.getOptionValue(OPTION_FREQ_MAX)));
    }
    if (cl.hasOption(OPTION_KA_MAX)) {
      settings.setKaMax(Integer.valueOf(cl.getOptionValue(OPTION_KA_MAX)));
    }
    if (cl.hasOption(OPTION_DYN_RANGE)) {
      settings.setDynRange(Double.valueOf(cl.getOptionValue(OPTION_DYN_RANGE)));
    }
    settings.validate();
    return settings;
  }

  public static List<PickettConstant> qdcsFromCommandLine(CommandLine cl) {
    List<PickettConstant> qdcs = new ArrayList<>();
    if (!cl.hasOption(OPTION_QDCS)) {
      return qdcs;
    }
    for (String label : cl.getOptionValues(OPTION_QDCS)) {
      PickettConstant c = PickettConstant.fromLabel(label.trim());
      if (c == null || !c.isQuarticDistortion()) {
        throw new InvalidParameterException(String.format("'%s' is not a quartic distortion constant", label));
      }
      qdcs.add(c);
    }
    return qdcs;
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
      HELP_FORMATTER.printHelp(FinalFitRunner.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(FinalFitRunner.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    ToolboxConfig config = cl.hasOption(OPTION_CONFIG) ?
        ToolboxConfig.load(new File(cl.getOptionValue(OPTION_CONFIG))) : ToolboxConfig.loadDefault();
    File catPath = new File(cl.getOptionValue(OPTION_CAT)).getAbsoluteFile();
    File workingDirectory = catPath.getParentFile();

    try {
      FinalFitSettings settings = settingsFromCommandLine(cl, config.getFinalFit());
      FinalFit.QdcMode mode = FinalFit.QdcMode.valueOf(cl.getOptionValue(OPTION_QDC_MODE, "PAR").toUpperCase());
      List<Double> omitted = new ArrayList<>();
      if (cl.hasOption(OPTION_OMIT)) {
        for (String f : cl.getOptionValues(OPTION_OMIT)) {
          omitted.add(Double.valueOf(f));
        }
      }

      PickettRunner runner = config.pickettRunner();
      if (cl.hasOption(OPTION_PICKETT_DIR)) {
        PickettRunner.copyExecutables(new File(cl.getOptionValue(OPTION_PICKETT_DIR)), workingDirectory);
        runner = new PickettRunner(workingDirectory, config.getPickettTimeoutSeconds());
      }

      Spectrum spectrum = SpectrumFiles.read(new File(cl.getOptionValue(OPTION_SPECTRUM)), config.getFft(), null);
      CatFile cat = CatFile.parse(catPath);
      FinalFit fit = new FinalFit(runner, workingDirectory, FilenameUtils.getBaseName(catPath.getName()));
      FinalFit.Result result = fit.run(spectrum, cat, Double.valueOf(cl.getOptionValue(OPTION_THRESHOLD)), mode,
          !cl.hasOption(OPTION_FIX_QDCS), qdcsFromCommandLine(cl), settings, omitted);

      if (cl.hasOption(OPTION_OUTPUT)) {
        OBJECT_MAPPER.writeValue(new File(cl.getOptionValue(OPTION_OUTPUT)), result);
      } else {
        System.out.println(OBJECT_MAPPER.writeValueAsString(result));
      }
    } catch (MalformedFileException | IOException | NoConvergenceException e) {
      LOGGER.error("Final fit failed: %s", e.getMessage());
      System.exit(1);
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid input: %s", e.getMessage());
      System.exit(1);
    }
  }
}
