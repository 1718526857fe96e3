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

package com.mrrtoolbox.utils;

import com.mrrtoolbox.errors.InvalidParameterException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tab-separated tables with a header row, used for analysis results meant for spreadsheets.
 */
public class TSVWriter implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private final List<String> header;
  private CSVPrinter printer;

  public TSVWriter(List<String> header) {
    this.header = header;
  }

  public void open(File f) throws IOException {
    printer = new CSVPrinter(new FileWriter(f, StandardCharsets.UTF_8),
        TSV_FORMAT.withHeader(header.toArray(new String[header.size()])));
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  public void append(Map<String, ?> row) throws IOException {
    List<Object> vals = new ArrayList<>(header.size());
    for (String field : header) {
      vals.add(row.get(field));
    }
    printer.printRecord(vals);
  }

  /**
   * Append one row of numbers in header order.
   */
  public void append(double[] row) throws IOException {
    if (row.length != header.size()) {
      throw new InvalidParameterException(
          String.format("Row has %d values but the header has %d fields", row.length, header.size()));
    }
    List<Object> vals = new ArrayList<>(row.length);
    for (double v : row) {
      vals.add(v);
    }
    printer.printRecord(vals);
  }

  public void flush() throws IOException {
    printer.flush();
  }

  public List<String> getHeader() {
    return header;
  }
}
