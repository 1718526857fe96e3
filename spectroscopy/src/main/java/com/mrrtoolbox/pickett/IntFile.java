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
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * SPCAT intensity (.int) file: catalog flags, partition function, frequency and strength limits, and the dipole
 * moment components along the a, b and c axes.
 */
public class IntFile {
  private static final Logger LOGGER = LogManager.getFormatterLogger(IntFile.class);

  public static final String EXTENSION = ".int";

  // Rotational partition function of an asymmetric top: qrot = 5.3311e6 * T^1.5 / sqrt(ABC), constants in MHz.
  private static final double PARTITION_PREFACTOR = 5.3311e6;

  private static final String[] DIPOLE_IDS = {"001", "002", "003"};

  private Integer flags = 0;
  private Integer tag = 91;
  private Double qrot;
  private Integer fbgn = 0;
  private Integer fend = 25;
  private Double str0 = -10.0;
  private Double str1 = -10.0;
  // GHz
  private Double fqlim = 18.0;
  // Kelvin
  private Double temp = 1.0;
  private Integer maxv;
  private Double muA = 1.0;
  private Double muB = 1.0;
  private Double muC = 1.0;

  public IntFile() {}

  public static double partitionFunction(double temperature, double a, double b, double c) {
    if (!(a > 0.0 && b > 0.0 && c > 0.0)) {
      throw new InvalidParameterException(
          String.format("Rotational constants must be positive to compute qrot: %s %s %s", a, b, c));
    }
    return PARTITION_PREFACTOR * Math.pow(temperature, 1.5) * Math.pow(a * b * c, -0.5);
  }

  /**
   * Set qrot from the rotational constants at the current temperature.
   */
  public Double updatePartitionFunction(double a, double b, double c) {
    this.qrot = partitionFunction(temp, a, b, c);
    return qrot;
  }

  public static IntFile parse(File file) throws IOException, MalformedFileException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    if (lines.size() < 2) {
      throw new MalformedFileException(file, null, "An intensity file needs a name line and a flags line");
    }
    IntFile result = new IntFile();
    String[] tokens = StringUtils.split(lines.get(1).trim());
    try {
      result.flags = tokens.length > 0 ? Integer.valueOf(tokens[0]) : null;
      result.tag = tokens.length > 1 ? Integer.valueOf(tokens[1]) : null;
      result.qrot = tokens.length > 2 ? Double.valueOf(tokens[2]) : null;
      result.fbgn = tokens.length > 3 ? Integer.valueOf(tokens[3]) : null;
      result.fend = tokens.length > 4 ? Integer.valueOf(tokens[4]) : null;
      result.str0 = tokens.length > 5 ? Double.valueOf(tokens[5]) : null;
      result.str1 = tokens.length > 6 ? Double.valueOf(tokens[6]) : null;
      result.fqlim = tokens.length > 7 ? Double.valueOf(tokens[7]) : null;
      result.temp = tokens.length > 8 ? Double.valueOf(tokens[8]) : null;
      result.maxv = tokens.length > 9 ? Integer.valueOf(tokens[9]) : null;
    } catch (NumberFormatException e) {
      throw new MalformedFileException(file, 2, "Unparseable flag: " + e.getMessage(), e);
    }
    result.muA = null;
    result.muB = null;
    result.muC = null;
    for (int i = 2; i < lines.size(); i++) {
      String[] row = StringUtils.split(lines.get(i).trim());
      if (row.length < 2) {
        continue;
      }
      try {
        if (DIPOLE_IDS[0].equals(row[0])) {
          result.muA = Double.valueOf(row[1]);
        } else if (DIPOLE_IDS[1].equals(row[0])) {
          result.muB = Double.valueOf(row[1]);
        } else if (DIPOLE_IDS[2].equals(row[0])) {
          result.muC = Double.valueOf(row[1]);
        }
      } catch (NumberFormatException e) {
        throw new MalformedFileException(file, i + 1, "Unparseable dipole: " + e.getMessage(), e);
      }
    }
    return result;
  }

  private static String orEmpty(Object o) {
    return o == null ? "" : o.toString();
  }

  public String write(String name) {
    StringBuilder sb = new StringBuilder();
    sb.append(name).append(" \n");
    sb.append(String.format("%s  %s  %s  %s  %s  %s  %s  %s  %s  %s \n", orEmpty(flags), orEmpty(tag),
        orEmpty(qrot), orEmpty(fbgn), orEmpty(fend), orEmpty(str0), orEmpty(str1), orEmpty(fqlim),
        orEmpty(temp), orEmpty(maxv)));
    Double[] dipoles = {muA, muB, muC};
    for (int i = 0; i < DIPOLE_IDS.length; i++) {
      sb.append(String.format(" %s  %s \n", DIPOLE_IDS[i], orEmpty(dipoles[i])));
    }
    return sb.toString();
  }

  public void save(File file) throws IOException {
    String name = file.getName();
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      name = name.substring(0, dot);
    }
    try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
      writer.print(write(name));
      if (writer.checkError()) {
        throw new IOException("Failed writing " + file);
      }
    }
    LOGGER.info("Wrote intensity file %s", file);
  }

  public Integer getFlags() {
    return flags;
  }

  public void setFlags(Integer flags) {
    this.flags = flags;
  }

  public Integer getTag() {
    return tag;
  }

  public void setTag(Integer tag) {
    this.tag = tag;
  }

  public Double getQrot() {
    return qrot;
  }

  public Integer getFbgn() {
    return fbgn;
  }

  public Integer getFend() {
    return fend;
  }

  public void setFend(Integer fend) {
    this.fend = fend;
  }

  public Double getStr0() {
    return str0;
  }

  public Double getStr1() {
    return str1;
  }

  public Double getFqlim() {
    return fqlim;
  }

  public void setFqlim(Double fqlim) {
    this.fqlim = fqlim;
  }

  public Double getTemp() {
    return temp;
  }

  public void setTemp(Double temp) {
    this.temp = temp;
  }

  public Integer getMaxv() {
    return maxv;
  }

  public Double getMuA() {
    return muA;
  }

  public void setMuA(Double muA) {
    this.muA = muA;
  }

  public Double getMuB() {
    return muB;
  }

  public void setMuB(Double muB) {
    this.muB = muB;
  }

  public Double getMuC() {
    return muC;
  }

  public void setMuC(Double muC) {
    this.muC = muC;
  }
}
