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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The SPFIT line assignment file: one row per assigned line, twelve quantum number columns followed by frequency,
 * error and weight.
 */
public class LinFile {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LinFile.class);

  public static final String EXTENSION = ".lin";
  public static final int QUANTUM_NUMBER_COLUMNS = 12;
  private static final int COLUMNS = QUANTUM_NUMBER_COLUMNS + 3;

  private final List<LinAssignment> assignments = new ArrayList<>();

  public LinFile() {}

  public LinFile(List<LinAssignment> assignments) {
    this.assignments.addAll(assignments);
  }

  public static LinFile parse(File file) throws IOException, MalformedFileException {
    LinFile lin = new LinFile();
    int lineNumber = 0;
    try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String[] tokens = StringUtils.split(line.trim());
        if (tokens.length == 0) {
          continue;
        }
        if (tokens.length != COLUMNS) {
          throw new MalformedFileException(file, lineNumber,
              String.format("Expected %d columns, found %d", COLUMNS, tokens.length));
        }
        try {
          int[] qns = new int[QUANTUM_NUMBER_COLUMNS];
          for (int i = 0; i < QUANTUM_NUMBER_COLUMNS; i++) {
            qns[i] = (int) Double.parseDouble(tokens[i]);
          }
          lin.assign(new LinAssignment(qns, Double.parseDouble(tokens[12]),
              Double.parseDouble(tokens[13]), Double.parseDouble(tokens[14])));
        } catch (NumberFormatException e) {
          throw new MalformedFileException(file, lineNumber, "Non-numeric column: " + e.getMessage(), e);
        }
      }
    }
    LOGGER.debug("Read %d assignments from %s", lin.size(), file);
    return lin;
  }

  public void assign(LinAssignment assignment) {
    assignments.add(assignment);
  }

  public List<LinAssignment> getAssignments() {
    return Collections.unmodifiableList(assignments);
  }

  public int size() {
    return assignments.size();
  }

  /**
   * @param row 0-based row index.
   */
  public LinAssignment deleteRow(int row) {
    if (row < 0 || row >= assignments.size()) {
      throw new InvalidParameterException(
          String.format("Row %d does not exist in a file of %d assignments", row, assignments.size()));
    }
    return assignments.remove(row);
  }

  /**
   * Remove every assignment at this exact frequency.
   * @return The number of rows removed.
   */
  public int deleteFrequency(Double freq) {
    int before = assignments.size();
    assignments.removeIf(a -> a.getFreq().equals(freq));
    return before - assignments.size();
  }

  /**
   * @return Assignments keyed by frequency, preserving row order.
   */
  public Map<Double, List<LinAssignment>> byFrequency() {
    Map<Double, List<LinAssignment>> result = new LinkedHashMap<>();
    for (LinAssignment a : assignments) {
      result.computeIfAbsent(a.getFreq(), k -> new ArrayList<>()).add(a);
    }
    return result;
  }

  static String formatRow(LinAssignment a) {
    int[] qns = a.getQuantumNumbers();
    List<String> fields = new ArrayList<>(COLUMNS);
    fields.add(String.format(Locale.ROOT, "%3.0f", (double) qns[0]));
    for (int i = 1; i < QUANTUM_NUMBER_COLUMNS; i++) {
      fields.add(String.format(Locale.ROOT, "%2.0f", (double) qns[i]));
    }
    fields.add(String.format(Locale.ROOT, "%12.4f", a.getFreq()));
    fields.add(String.format(Locale.ROOT, "%12.6f", a.getErr()));
    fields.add(String.format(Locale.ROOT, "%12.2E", a.getWt()));
    return StringUtils.join(fields, " ");
  }

  public void save(File file) throws IOException {
    try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
      for (LinAssignment a : assignments) {
        writer.print(formatRow(a));
        writer.print('\n');
      }
      if (writer.checkError()) {
        throw new IOException("Failed writing " + file);
      }
    }
    LOGGER.info("Wrote %d assignments to %s", assignments.size(), file);
  }
}
