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
import com.mrrtoolbox.pickett.CatFile;
import com.mrrtoolbox.pickett.CatFilter;
import com.mrrtoolbox.spectrum.PeakPicker;
import com.mrrtoolbox.spectrum.Spectrum;
import com.mrrtoolbox.spectrum.SpectrumFiles;
import com.mrrtoolbox.utils.TSVWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Command line enantiomeric excess determination from a racemic and an enriched chiral tag spectrum.
 */
public class EnantiomericExcessAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(EnantiomericExcessAnalyzer.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.configure(SerializationFeature.INDENT_OUTPUT, true);
  }

  private static final String OPTION_RACEMIC = "r";
  private static final String OPTION_ENRICHED = "e";
  private static final String OPTION_RACEMIC_THRESHOLD = "rt";
  private static final String OPTION_ENRICHED_THRESHOLD = "et";
  private static final String OPTION_DOMINANT_CAT = "d";
  private static final String OPTION_MINOR_CAT = "m";
  private static final String OPTION_FREQ_MIN = "fmin";
  private static final String OPTION_FREQ_MAX = "fmax";
  private static final String OPTION_N_MAX = "nmax";
  private static final String OPTION_KA_MAX = "kamax";
  private static final String OPTION_DYN_RANGE = "dr";
  private static final String OPTION_FREQ_MATCH = "fm";
  private static final String OPTION_SIGMA_FILTER = "s";
  private static final String OPTION_TOP_N = "n";
  private static final String OPTION_DOMINANT_RATIO = "dw";
  private static final String OPTION_MINOR_RATIO = "mw";
  private static final String OPTION_TAG_EE = "t";
  private static final String OPTION_OMIT = "x";
  private static final String OPTION_OUTPUT_PREFIX = "o";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class determines the enantiomeric excess of a sample from the spectra of its chiral tag complexes. ",
      "Transitions of the two diastereomeric complexes are measured in a racemic and an enriched spectrum, either ",
      "by matching catalogs for both complexes or, without catalogs, by comparing peak picks.  Results are written ",
      "as JSON and as tab-separated tables sharing the output prefix."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_RACEMIC)
        .argName("spectrum")
        .desc("Racemic spectrum (.ft, .prn or raw FID .txt)")
        .hasArg().required()
        .longOpt("racemic")
    );
    add(Option.builder(OPTION_ENRICHED)
        .argName("spectrum")
        .desc("Enantioenriched spectrum (.ft, .prn or raw FID .txt)")
        .hasArg().required()
        .longOpt("enriched")
    );
    add(Option.builder(OPTION_RACEMIC_THRESHOLD)
        .argName("mV")
        .desc("Peak pick threshold for the racemic spectrum")
        .hasArg().required()
        .longOpt("racemic-threshold")
    );
    add(Option.builder(OPTION_ENRICHED_THRESHOLD)
        .argName("mV")
        .desc("Peak pick threshold for the enriched spectrum")
        .hasArg().required()
        .longOpt("enriched-threshold")
    );
    add(Option.builder(OPTION_DOMINANT_CAT)
        .argName("cat file")
        .desc("Predicted lines of the complex dominant in the enriched sample")
        .hasArg()
        .longOpt("dominant-cat")
    );
    add(Option.builder(OPTION_MINOR_CAT)
        .argName("cat file")
        .desc("Predicted lines of the minor complex")
        .hasArg()
        .longOpt("minor-cat")
    );
    add(Option.builder(OPTION_FREQ_MIN)
        .argName("MHz")
        .desc("Lowest catalog frequency to use")
        .hasArg()
        .longOpt("freq-min")
    );
    add(Option.builder(OPTION_FREQ_MAX)
        .argName("MHz")
        .desc("Highest catalog frequency to use")
        .hasArg()
        .longOpt("freq-max")
    );
    add(Option.builder(OPTION_N_MAX)
        .argName("N")
        .desc("Highest upper-state N to use")
        .hasArg()
        .longOpt("n-max")
    );
    add(Option.builder(OPTION_KA_MAX)
        .argName("Ka")
        .desc("Highest upper-state Ka to use")
        .hasArg()
        .longOpt("ka-max")
    );
    add(Option.builder(OPTION_DYN_RANGE)
        .argName("ratio")
        .desc("Catalog dynamic range relative to its strongest line")
        .hasArg()
        .longOpt("dyn-range")
    );
    add(Option.builder(OPTION_FREQ_MATCH)
        .argName("MHz")
        .desc("Largest catalog to spectrum frequency difference for a match (default 0.020)")
        .hasArg()
        .longOpt("freq-match")
    );
    add(Option.builder(OPTION_SIGMA_FILTER)
        .argName("sigma filter")
        .desc("Drop transitions whose intensity ratio lies beyond 3 standard deviations of the mean")
        .longOpt("sigma-filter")
    );
    add(Option.builder(OPTION_TOP_N)
        .argName("count")
        .desc("Number of transitions of each complex to pair")
        .hasArg().required()
        .longOpt("top-n")
    );
    add(Option.builder(OPTION_DOMINANT_RATIO)
        .argName("min,max")
        .desc("Accepted enriched/racemic ratio window for the dominant complex (default 0,inf)")
        .hasArgs().valueSeparator(',')
        .longOpt("dominant-ratio")
    );
    add(Option.builder(OPTION_MINOR_RATIO)
        .argName("min,max")
        .desc("Accepted enriched/racemic ratio window for the minor complex (default 0,inf)")
        .hasArgs().valueSeparator(',')
        .longOpt("minor-ratio")
    );
    add(Option.builder(OPTION_TAG_EE)
        .argName("ee")
        .desc("Enantiopurity of the chiral tag (default 1)")
        .hasArg()
        .longOpt("tag-ee")
    );
    add(Option.builder(OPTION_OMIT)
        .argName("MHz list")
        .desc("Frequencies to leave out of the calculation")
        .hasArgs().valueSeparator(',')
        .longOpt("omit")
    );
    add(Option.builder(OPTION_OUTPUT_PREFIX)
        .argName("prefix")
        .desc("Path prefix for the output files")
        .hasArg().required()
        .longOpt("output-prefix")
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

  private static Double optionalDouble(CommandLine cl, String option) {
    return cl.hasOption(option) ? Double.valueOf(cl.getOptionValue(option)) : null;
  }

  private static Integer optionalInteger(CommandLine cl, String option) {
    return cl.hasOption(option) ? Integer.valueOf(cl.getOptionValue(option)) : null;
  }

  private static double[] ratioWindow(CommandLine cl, String option) {
    if (!cl.hasOption(option)) {
      return new double[]{0.0, Double.POSITIVE_INFINITY};
    }
    String[] values = cl.getOptionValues(option);
    if (values.length != 2) {
      throw new InvalidParameterException(String.format("-%s takes two values, min and max", option));
    }
    return new double[]{Double.parseDouble(values[0]), Double.parseDouble(values[1])};
  }

  public static CatFilter catFilterFromCommandLine(CommandLine cl) {
    return new CatFilter()
        .freqMin(optionalDouble(cl, OPTION_FREQ_MIN))
        .freqMax(optionalDouble(cl, OPTION_FREQ_MAX))
        .nMax(optionalInteger(cl, OPTION_N_MAX))
        .kaMax(optionalInteger(cl, OPTION_KA_MAX))
        .dynRange(optionalDouble(cl, OPTION_DYN_RANGE));
  }

  /**
   * Write prefix_ee.json with the full result, plus prefix_dominant_diastereomer.tsv, prefix_minor_diastereomer.tsv
   * and prefix_ee_calculations.tsv.
   * @return The files written.
   */
  public static List<File> writeResults(EeResult result, String prefix) throws IOException {
    List<File> written = new ArrayList<>();
    File json = new File(prefix + "_ee.json");
    OBJECT_MAPPER.writeValue(json, result);
    written.add(json);

    File dominant = new File(prefix + "_dominant_diastereomer.tsv");
    writeRecords(dominant, result.getTopDominant());
    written.add(dominant);
    File minor = new File(prefix + "_minor_diastereomer.tsv");
    writeRecords(minor, result.getTopMinor());
    written.add(minor);

    File calculations = new File(prefix + "_ee_calculations.tsv");
    try (TSVWriter writer = new TSVWriter(Collections.singletonList("ee"))) {
      writer.open(calculations);
      for (double ee : result.getEe()) {
        writer.append(new double[]{ee});
      }
      writer.flush();
    }
    written.add(calculations);
    return written;
  }

  private static void writeRecords(File file, List<IntensityRatioRecord> records) throws IOException {
    try (TSVWriter writer = new TSVWriter(IntensityRatioRecord.TSV_HEADER)) {
      writer.open(file);
      for (IntensityRatioRecord r : records) {
        writer.append(r.toRow());
      }
      writer.flush();
    }
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
      HELP_FORMATTER.printHelp(EnantiomericExcessAnalyzer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(EnantiomericExcessAnalyzer.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    ToolboxConfig config = ToolboxConfig.loadDefault();
    try {
      Spectrum racemic = SpectrumFiles.read(new File(cl.getOptionValue(OPTION_RACEMIC)), config.getFft(), null);
      Spectrum enriched = SpectrumFiles.read(new File(cl.getOptionValue(OPTION_ENRICHED)), config.getFft(), null);
      Map<Double, Double> racemicPeaks = PeakPicker.peakPick(racemic,
          Double.valueOf(cl.getOptionValue(OPTION_RACEMIC_THRESHOLD)), null);
      Map<Double, Double> enrichedPeaks = PeakPicker.peakPick(enriched,
          Double.valueOf(cl.getOptionValue(OPTION_ENRICHED_THRESHOLD)), null);
      CatFile dominantCat = cl.hasOption(OPTION_DOMINANT_CAT) ?
          CatFile.parse(new File(cl.getOptionValue(OPTION_DOMINANT_CAT))) : null;
      CatFile minorCat = cl.hasOption(OPTION_MINOR_CAT) ?
          CatFile.parse(new File(cl.getOptionValue(OPTION_MINOR_CAT))) : null;

      ScaleFactorResult ratios = EnantiomericExcess.transitionScaleFactor(enriched, racemic, enrichedPeaks,
          racemicPeaks, optionalDouble(cl, OPTION_FREQ_MATCH), dominantCat, minorCat, catFilterFromCommandLine(cl));
      List<IntensityRatioRecord> dominant = ratios.getDominant();
      List<IntensityRatioRecord> minor = ratios.getMinor();
      if (cl.hasOption(OPTION_SIGMA_FILTER)) {
        dominant = EnantiomericExcess.sigmaFilter(dominant, IntensityRatioRecord.RATIO_COLUMN, null);
        minor = EnantiomericExcess.sigmaFilter(minor, IntensityRatioRecord.RATIO_COLUMN, null);
      }

      List<Double> omitted = new ArrayList<>();
      if (cl.hasOption(OPTION_OMIT)) {
        for (String f : cl.getOptionValues(OPTION_OMIT)) {
          omitted.add(Double.valueOf(f));
        }
      }
      double[] dominantWindow = ratioWindow(cl, OPTION_DOMINANT_RATIO);
      double[] minorWindow = ratioWindow(cl, OPTION_MINOR_RATIO);
      EeResult result = EnantiomericExcess.calculateEe(dominant, minor,
          Integer.parseInt(cl.getOptionValue(OPTION_TOP_N)), dominantWindow[0], dominantWindow[1], minorWindow[0],
          minorWindow[1], optionalDouble(cl, OPTION_TAG_EE), omitted);

      for (File f : writeResults(result, cl.getOptionValue(OPTION_OUTPUT_PREFIX))) {
        LOGGER.info("Wrote %s", f);
      }
      EeStatistics stats = result.getStatistics();
      System.out.format("ee = %.5f (std dev %.5f, std err %.5f, min %.5f, max %.5f)\n", stats.getMean(),
          stats.getStdDev(), stats.getStdErr(), stats.getMin(), stats.getMax());
    } catch (MalformedFileException | IOException e) {
      LOGGER.error("Unable to compute the enantiomeric excess: %s", e.getMessage());
      System.exit(1);
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid input: %s", e.getMessage());
      System.exit(1);
    }
  }
}
