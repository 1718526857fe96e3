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

import com.mrrtoolbox.errors.InvalidParameterException;
import com.mrrtoolbox.errors.MalformedFileException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The piform rendering (.pi) of an SPFIT run.  Only the final fit iteration is read: its assigned lines, its
 * constants with uncertainties and its summary statistics.  The "worst fitted" sections that piform prepends are
 * read when present.
 */
public class PiformReport {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PiformReport.class);

  public static final String EXTENSION = ".pi";

  private static final String BAD_CONSTANTS_HEADER = " Worst fitted constants, with greater than 20% uncertainty:";
  private static final String WORST_LINES_HEADER = " Worst fitted lines (obs-calc/error):";
  private static final String PARAMETERS_HEADER =
      " PARAMETERS IN FIT WITH STANDARD ERRORS ON THOSE THAT ARE FITTED:";
  private static final Pattern DASHED_RULE = Pattern.compile("^-{20,}$");
  private static final Pattern ITERATION_SEPARATOR = Pattern.compile("^-{20,}=+$");

  // Worst fitted line columns: row label, six quantum numbers, frequency, obs - calc.
  private static final int WORST_LINE_FREQ_TOKEN = 7;
  private static final int WORST_LINE_OMC_TOKEN = 8;

  // Constants reported as a bare bracketed zero were held at zero rather than fitted.
  private static final List<String> ZERO_VALUES = Arrays.asList("[0.]", "[ 0.]", "[0]");

  private final File file;
  private List<String> badConstantIds;
  private String[] worstLine;
  private List<String> lineList = new ArrayList<>();
  private final Map<PickettConstant, FittedConstant> constants = new EnumMap<>(PickettConstant.class);
  private Double rms;
  private Integer distinctFrequencies;
  private Integer distinctParameters;

  /**
   * A constant as printed by piform: a value string and the uncertainty in its last digits.
   */
  public static class FittedConstant {
    private final PickettConstant constant;
    private final String value;
    private final String uncertainty;

    public FittedConstant(PickettConstant constant, String value, String uncertainty) {
      this.constant = constant;
      this.value = value;
      this.uncertainty = uncertainty;
    }

    public PickettConstant getConstant() {
      return constant;
    }

    public String getValue() {
      return value;
    }

    public String getUncertainty() {
      return uncertainty;
    }

    public boolean isHeldAtZero() {
      return ZERO_VALUES.contains(value);
    }

    /**
     * @return e.g. "0.0275(12)"
     */
    public String toParenthesized() {
      return value + "(" + uncertainty + ")";
    }
  }

  private PiformReport(File file) {
    this.file = file;
  }

  public static PiformReport parse(File file) throws IOException, MalformedFileException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.ISO_8859_1);
    PiformReport report = new PiformReport(file);
    report.readBadConstants(lines);
    report.readWorstLine(lines);
    report.readFinalIteration(lines);
    LOGGER.debug("Parsed %s: rms %s, %d lines, %d constants", file, report.rms, report.lineList.size(),
        report.constants.size());
    return report;
  }

  private static boolean isBlank(String line) {
    return line.trim().isEmpty();
  }

  private void readBadConstants(List<String> lines) {
    int header = indexOfPrefix(lines, BAD_CONSTANTS_HEADER, 0);
    if (header < 0) {
      return;
    }
    List<String> ids = new ArrayList<>();
    for (int i = header + 2; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (DASHED_RULE.matcher(line).matches()) {
        this.badConstantIds = ids;
        return;
      }
      String[] tokens = StringUtils.split(line);
      if (tokens.length > 0) {
        ids.add(tokens[0]);
      }
    }
    LOGGER.warn("Unterminated list of poorly determined constants in %s", file);
  }

  private void readWorstLine(List<String> lines) {
    int header = indexOfPrefix(lines, WORST_LINES_HEADER, 0);
    if (header < 0) {
      return;
    }
    for (int i = header + 2; i < lines.size() - 1; i++) {
      if (isBlank(lines.get(i))) {
        this.worstLine = StringUtils.split(lines.get(i + 1).trim());
        return;
      }
    }
  }

  private void readFinalIteration(List<String> lines) throws MalformedFileException {
    int separator = -1;
    int parameters = -1;
    for (int i = lines.size() - 1; i >= 0; i--) {
      String line = lines.get(i);
      if (parameters < 0 && line.startsWith(PARAMETERS_HEADER)) {
        parameters = i;
      }
      if (separator < 0 && ITERATION_SEPARATOR.matcher(line.trim()).matches()) {
        separator = i;
      }
    }
    if (separator < 0 || parameters < 0 || parameters - 3 < separator) {
      throw new MalformedFileException(file, null, "No final fit iteration found");
    }
    List<String> block = lines.subList(separator, parameters - 2);
    try {
      int blank = firstBlank(block, 0);
      this.lineList = new ArrayList<>(block.subList(1, blank - 1));

      int constantsStart = blank + 3;
      int constantsEnd = firstBlank(block, constantsStart);
      for (String row : block.subList(constantsStart, constantsEnd)) {
        readConstantRow(StringUtils.split(row.trim()));
      }

      int summary = constantsEnd + 2;
      this.rms = Double.parseDouble(StringUtils.split(block.get(summary).trim())[3]);
      this.distinctFrequencies = Integer.parseInt(StringUtils.split(block.get(summary + 3).trim())[5]);
      this.distinctParameters = Integer.parseInt(StringUtils.split(block.get(summary + 4).trim())[4]);
    } catch (IndexOutOfBoundsException | NumberFormatException e) {
      throw new MalformedFileException(file, null, "Final fit iteration is not laid out as expected", e);
    }
  }

  private void readConstantRow(String[] tokens) {
    if (tokens.length < 3) {
      return;
    }
    PickettConstant constant = PickettConstant.fromId(tokens[0]);
    if (constant == null) {
      return;
    }
    String field = tokens[2];
    if ("[".equals(field) && tokens.length > 3) {
      constants.put(constant, new FittedConstant(constant, field + " " + tokens[3], "0"));
      return;
    }
    if (field.startsWith("[")) {
      constants.put(constant, new FittedConstant(constant, field, "0"));
      return;
    }
    int open = field.indexOf('(');
    int close = field.indexOf(')');
    if (open < 0 || close < open) {
      LOGGER.debug("Constant %s has no uncertainty in '%s'", constant.getLabel(), field);
      return;
    }
    try {
      String uncertainty = String.valueOf(Integer.parseInt(field.substring(open + 1, close)));
      constants.put(constant, new FittedConstant(constant, field.substring(0, open), uncertainty));
    } catch (NumberFormatException e) {
      LOGGER.debug("Constant %s has an unreadable uncertainty in '%s'", constant.getLabel(), field);
    }
  }

  private static int firstBlank(List<String> lines, int from) {
    for (int i = from; i < lines.size(); i++) {
      if (isBlank(lines.get(i))) {
        return i;
      }
    }
    throw new IndexOutOfBoundsException("No blank line after index " + from);
  }

  private static int indexOfPrefix(List<String> lines, String prefix, int from) {
    for (int i = from; i < lines.size(); i++) {
      if (lines.get(i).startsWith(prefix)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * True when the constant is larger than its uncertainty, comparing significant digits: "0.0275(12)" compares 275
   * against 12.
   */
  public static boolean uncertaintyCheck(String parenthesized) {
    String digits = parenthesized.replace(".", "");
    int start = 0;
    while (start < digits.length() && (digits.charAt(start) == '0' || digits.charAt(start) == '-')) {
      start++;
    }
    digits = digits.substring(start);
    int open = digits.indexOf('(');
    int close = digits.indexOf(')', open + 1);
    if (open <= 0 || close < 0) {
      throw new InvalidParameterException(
          String.format("'%s' is not a value with a parenthesized uncertainty", parenthesized));
    }
    BigInteger constant = new BigInteger(digits.substring(0, open));
    BigInteger uncertainty = new BigInteger(digits.substring(open + 1, close));
    return constant.compareTo(uncertainty) > 0;
  }

  /**
   * @return Quartic distortion constants whose uncertainty is at least as large as the constant.
   */
  public List<PickettConstant> qdcCheck() {
    List<PickettConstant> failed = new ArrayList<>();
    for (PickettConstant c : PickettConstant.QUARTIC_DISTORTION) {
      FittedConstant fc = constants.get(c);
      if (fc == null || fc.isHeldAtZero()) {
        continue;
      }
      if (!uncertaintyCheck(fc.toParenthesized())) {
        failed.add(c);
      }
    }
    return failed;
  }

  /**
   * Split each assigned line of the final iteration into quantum numbers, frequency and obs - calc.
   * @param numQn Quantum numbers per state.
   */
  public List<AssignedLine> lineListSplit(int numQn) throws MalformedFileException {
    int columns = numQn * 2;
    List<AssignedLine> result = new ArrayList<>(lineList.size());
    for (String row : lineList) {
      String[] tokens = StringUtils.split(row.trim());
      int start = 0;
      while (start < tokens.length) {
        if (tokens[start++].endsWith(":")) {
          break;
        }
      }
      if (start + columns + 1 >= tokens.length) {
        throw new MalformedFileException(file, null, "Assigned line is too short: " + row.trim());
      }
      String[] qns = Arrays.copyOfRange(tokens, start, start + columns);
      try {
        result.add(new AssignedLine(qns, Double.parseDouble(tokens[start + columns]),
            Double.parseDouble(tokens[start + columns + 1])));
      } catch (NumberFormatException e) {
        throw new MalformedFileException(file, null, "Assigned line is not numeric: " + row.trim(), e);
      }
    }
    return result;
  }

  public static class AssignedLine {
    private final String[] quantumNumbers;
    private final Double frequency;
    private final Double obsMinusCalc;

    public AssignedLine(String[] quantumNumbers, Double frequency, Double obsMinusCalc) {
      this.quantumNumbers = quantumNumbers;
      this.frequency = frequency;
      this.obsMinusCalc = obsMinusCalc;
    }

    public String[] getQuantumNumbers() {
      return quantumNumbers.clone();
    }

    public Double getFrequency() {
      return frequency;
    }

    public Double getObsMinusCalc() {
      return obsMinusCalc;
    }
  }

  public File getFile() {
    return file;
  }

  /**
   * @return Parameter ids of constants flagged as poorly determined, or null if the report has no such section.
   */
  public List<String> getBadConstantIds() {
    return badConstantIds == null ? null : Collections.unmodifiableList(badConstantIds);
  }

  public boolean hasWorstLine() {
    return worstLine != null && worstLine.length > WORST_LINE_OMC_TOKEN;
  }

  /**
   * @return The 0-based row in the .lin file of the worst fitted line.  The report labels rows "12:" or "12/...".
   */
  public int worstLineRow() {
    requireWorstLine();
    String label = worstLine[0];
    int end = 0;
    while (end < label.length() && Character.isDigit(label.charAt(end))) {
      end++;
    }
    return Integer.parseInt(label.substring(0, end)) - 1;
  }

  public Double worstLineFrequency() {
    requireWorstLine();
    return Math.abs(Double.parseDouble(worstLine[WORST_LINE_FREQ_TOKEN]));
  }

  public Double worstLineObsMinusCalc() {
    requireWorstLine();
    return Double.parseDouble(worstLine[WORST_LINE_OMC_TOKEN]);
  }

  private void requireWorstLine() {
    if (!hasWorstLine()) {
      throw new InvalidParameterException(String.format("%s has no worst fitted line", file));
    }
  }

  public List<String> getLineList() {
    return Collections.unmodifiableList(lineList);
  }

  public FittedConstant getConstant(PickettConstant constant) {
    return constants.get(constant);
  }

  /**
   * @return The printed value of a constant by label, e.g. "A" or "DJK", or null if it was not fitted.
   */
  public String constant(String label) {
    FittedConstant fc = constants.get(requireLabel(label));
    return fc == null ? null : fc.getValue();
  }

  public String uncertainty(String label) {
    FittedConstant fc = constants.get(requireLabel(label));
    return fc == null ? null : fc.getUncertainty();
  }

  private static PickettConstant requireLabel(String label) {
    PickettConstant c = PickettConstant.fromLabel(label);
    if (c == null) {
      throw new InvalidParameterException(String.format("Unknown constant '%s'", label));
    }
    return c;
  }

  public Map<PickettConstant, FittedConstant> getConstants() {
    return Collections.unmodifiableMap(constants);
  }

  public Double getRms() {
    return rms;
  }

  public Integer getDistinctFrequencies() {
    return distinctFrequencies;
  }

  public Integer getDistinctParameters() {
    return distinctParameters;
  }
}
