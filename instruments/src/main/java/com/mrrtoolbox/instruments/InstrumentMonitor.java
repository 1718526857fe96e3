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

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.joda.JodaModule;
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
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Polls the nozzle temperature controllers and reports instrument readiness.
 */
public class InstrumentMonitor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(InstrumentMonitor.class);

  private static final String OPTION_CONFIG = "c";
  private static final String OPTION_INTERVAL = "i";
  private static final String OPTION_COUNT = "n";
  private static final String OPTION_OUTPUT_DIR = "o";
  private static final String OPTION_SET_POINT = "s";
  private static final String OPTION_TOLERANCE = "t";
  private static final String OPTION_CHECK = "k";

  public static final String LATEST_READING_FILE = "temperatures.json";
  public static final String READING_LOG_FILE = "temperatures.log";
  private static final Long DEFAULT_INTERVAL_SECONDS = 5L;

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.registerModule(new JodaModule());
    OBJECT_MAPPER.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    OBJECT_MAPPER.configure(SerializationFeature.INDENT_OUTPUT, true);
  }

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class polls the nozzle temperature controllers, optionally changing their set point first, and writes ",
      "each round of readings as JSON.  With -k it instead reports oscilloscope and waveform generator settings ",
      "that differ from the configured ones."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_CONFIG)
        .argName("json file")
        .desc("Instrument configuration to use instead of the bundled defaults")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_INTERVAL)
        .argName("seconds")
        .desc("Time between readings (default 5)")
        .hasArg()
        .longOpt("interval")
    );
    add(Option.builder(OPTION_COUNT)
        .argName("count")
        .desc("Rounds of readings to take; 0 polls until interrupted (default 1)")
        .hasArg()
        .longOpt("count")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("directory")
        .desc("Directory for the latest reading and the reading log; readings go to stdout without it")
        .hasArg()
        .longOpt("output-dir")
    );
    add(Option.builder(OPTION_SET_POINT)
        .argName("celsius")
        .desc("Set point to send to every controller before polling")
        .hasArg()
        .longOpt("set-point")
    );
    add(Option.builder(OPTION_TOLERANCE)
        .argName("celsius")
        .desc("Report whether every nozzle is within this many degrees below its set point")
        .hasArg()
        .longOpt("tolerance")
    );
    add(Option.builder(OPTION_CHECK)
        .argName("check")
        .desc("Check oscilloscope and waveform generator settings instead of polling temperatures")
        .longOpt("check-instruments")
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

  private final TemperatureControllers controllers;
  private final File latestReadingFile;
  private final JsonGenerator logGenerator;

  /**
   * @param outputDirectory Null to print readings instead of writing them.
   */
  public InstrumentMonitor(TemperatureControllers controllers, File outputDirectory) throws IOException {
    this.controllers = controllers;
    if (outputDirectory == null) {
      this.latestReadingFile = null;
      this.logGenerator = null;
      return;
    }
    if (!outputDirectory.exists() && !outputDirectory.mkdirs()) {
      throw new IOException(String.format("Could not create output directory %s", outputDirectory));
    }
    this.latestReadingFile = new File(outputDirectory, LATEST_READING_FILE);
    this.logGenerator = OBJECT_MAPPER.getFactory().createGenerator(
        new File(outputDirectory, READING_LOG_FILE), JsonEncoding.UTF8);
  }

  /**
   * Take one round of readings and record it.
   */
  public List<TemperatureReading> poll() throws IOException {
    List<TemperatureReading> readings = controllers.readAll();
    if (latestReadingFile == null) {
      System.out.println(OBJECT_MAPPER.writeValueAsString(readings));
      return readings;
    }
    // Readers of the latest reading never see a partial file.
    File tmp = new File(latestReadingFile.getParentFile(), latestReadingFile.getName() + ".tmp");
    OBJECT_MAPPER.writeValue(tmp, readings);
    Files.move(tmp.toPath(), latestReadingFile.toPath(),
        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    OBJECT_MAPPER.writeValue(logGenerator, readings);
    logGenerator.flush();
    return readings;
  }

  public void close() throws IOException {
    if (logGenerator != null) {
      logGenerator.close();
    }
  }

  static boolean allWithinTolerance(List<TemperatureReading> readings, Double tolerance) {
    for (TemperatureReading r : readings) {
      if (!r.withinTolerance(tolerance)) {
        return false;
      }
    }
    return true;
  }

  private static void checkInstruments(InstrumentConfig config) throws IOException {
    try (Oscilloscope scope = Oscilloscope.connect(config.getOscilloscope())) {
      List<String> unexpected = scope.unexpectedSettings();
      LOGGER.info("Oscilloscope %s: %s", scope.idn(),
          unexpected.isEmpty() ? "ready" : "unexpected " + StringUtils.join(unexpected, ", "));
    }
    try (ArbitraryWaveformGenerator awg = ArbitraryWaveformGenerator.connect(config.getAwg())) {
      List<String> unexpected = awg.unexpectedSettings();
      LOGGER.info("AWG %s: %s", awg.idn(),
          unexpected.isEmpty() ? "ready" : "unexpected " + StringUtils.join(unexpected, ", "));
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
      HELP_FORMATTER.printHelp(InstrumentMonitor.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(InstrumentMonitor.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return;
    }

    InstrumentConfig config = cl.hasOption(OPTION_CONFIG) ?
        InstrumentConfig.load(new File(cl.getOptionValue(OPTION_CONFIG))) : InstrumentConfig.loadDefault();

    if (cl.hasOption(OPTION_CHECK)) {
      try {
        checkInstruments(config);
      } catch (InstrumentUnreachableException e) {
        LOGGER.error("Instrument unreachable: %s", e.getMessage());
        System.exit(1);
      }
      return;
    }

    long intervalMillis = 1000L * Long.parseLong(
        cl.getOptionValue(OPTION_INTERVAL, DEFAULT_INTERVAL_SECONDS.toString()));
    int count = Integer.parseInt(cl.getOptionValue(OPTION_COUNT, "1"));
    File outputDir = cl.hasOption(OPTION_OUTPUT_DIR) ? new File(cl.getOptionValue(OPTION_OUTPUT_DIR)) : null;

    try (TemperatureControllers controllers = TemperatureControllers.connect(config.getTemperatureControllers())) {
      if (cl.hasOption(OPTION_SET_POINT)) {
        controllers.setAllSetPoints(Double.valueOf(cl.getOptionValue(OPTION_SET_POINT)));
      }
      InstrumentMonitor monitor = new InstrumentMonitor(controllers, outputDir);
      try {
        for (int i = 0; count == 0 || i < count; i++) {
          if (i > 0) {
            Thread.sleep(intervalMillis);
          }
          List<TemperatureReading> readings = monitor.poll();
          if (cl.hasOption(OPTION_TOLERANCE)) {
            Double tolerance = Double.valueOf(cl.getOptionValue(OPTION_TOLERANCE));
            LOGGER.info("All nozzles within %.1f C of set point: %s", tolerance,
                allWithinTolerance(readings, tolerance));
          }
        }
      } finally {
        monitor.close();
      }
    } catch (InstrumentUnreachableException e) {
      LOGGER.error("Temperature controllers unreachable: %s", e.getMessage());
      System.exit(1);
    }
  }
}
