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
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SPFIT parameter (.par) and variance (.var) files for an asymmetric top with up to three quadrupolar nuclei.
 *
 * The parameter count stored here excludes quadrupole terms; the count written to disk adds one per quadrupole
 * constant present, and parsing subtracts them again so a file survives a read/write cycle unchanged.
 */
public class ParFile {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ParFile.class);

  public static final String PAR_EXTENSION = ".par";
  public static final String VAR_EXTENSION = ".var";

  public static final Double FLOATING_STDEV = 1.0E+000;
  public static final Double FIXED_STDEV = 1.0E-020;

  private static final String DEFAULT_NAME = "molecule";
  // Constant ids are right-aligned in this many characters.
  private static final int ID_FIELD_WIDTH = 16;
  private static final String QUADRUPOLE_INDENT = "       ";

  // Nuclear spin to SPFIT spin-degeneracy digit (2I + 1).
  private static final Map<Double, String> SPIN_TO_FLAG = new HashMap<Double, String>() {{
    put(0.5, "2");
    put(1.0, "3");
    put(1.5, "4");
    put(2.0, "5");
    put(2.5, "6");
    put(3.0, "7");
  }};
  private static final Map<Character, Double> FLAG_TO_SPIN = new HashMap<Character, Double>() {{
    for (Map.Entry<Double, String> e : SPIN_TO_FLAG.entrySet()) {
      put(e.getValue().charAt(0), e.getKey());
    }
  }};

  private Integer npar = 8;
  private Integer nline = 1000;
  private Integer nitr = 51;
  private Integer nxpar = 0;
  private String thresh = "0.000E+000";
  private String errtst = "1.00E+005";
  private String frac = "1.00E+000";
  private String cal = "1.0000";

  private String chr = "a";
  private String spind = "1";
  private Integer nvib = 1;
  private Integer knmin = 0;
  private Integer knmax = 99;
  private Integer ixx = 0;
  private Integer iax = 1;
  private Integer wtpl = 1;
  private Integer wtmn = 1;
  private Integer vsym = 1;
  private Integer ewt = -1;
  private Integer diag = 0;
  private Integer xopt = null;

  private final EnumMap<PickettConstant, Double> values = new EnumMap<>(PickettConstant.class);
  private final EnumMap<PickettConstant, Double> stdevs = new EnumMap<>(PickettConstant.class);
  private final List<PickettConstant> givenConstants = new ArrayList<>();

  public ParFile() {
    for (PickettConstant c : PickettConstant.ROTATIONAL) {
      values.put(c, 0.0);
      stdevs.put(c, FLOATING_STDEV);
    }
  }

  public static ParFile parse(File file) throws IOException, MalformedFileException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    if (lines.size() < 3) {
      throw new MalformedFileException(file, null, "A parameter file needs a name, a header and an option line");
    }
    ParFile par = new ParFile();
    par.values.clear();
    par.stdevs.clear();

    String[] header = StringUtils.split(lines.get(1).trim());
    String[] options = StringUtils.split(lines.get(2).trim());
    try {
      par.npar = intToken(header, 0);
      par.nline = intToken(header, 1);
      par.nitr = intToken(header, 2);
      par.nxpar = intToken(header, 3);
      par.thresh = stringToken(header, 4);
      par.errtst = stringToken(header, 5);
      par.frac = stringToken(header, 6);
      par.cal = stringToken(header, 7);
      par.chr = stringToken(options, 0);
      par.spind = stringToken(options, 1);
      par.nvib = intToken(options, 2);
      par.knmin = intToken(options, 3);
      par.knmax = intToken(options, 4);
      par.ixx = intToken(options, 5);
      par.iax = intToken(options, 6);
      par.wtpl = intToken(options, 7);
      par.wtmn = intToken(options, 8);
      par.vsym = intToken(options, 9);
      par.ewt = intToken(options, 10);
      par.diag = intToken(options, 11);
      par.xopt = intToken(options, 12);
    } catch (NumberFormatException e) {
      throw new MalformedFileException(file, 2, "Unparseable header value: " + e.getMessage(), e);
    }

    for (int i = 3; i < lines.size(); i++) {
      String[] tokens = StringUtils.split(lines.get(i).trim());
      if (tokens.length < 3) {
        continue;
      }
      PickettConstant constant = PickettConstant.fromId(tokens[0]);
      if (constant == null) {
        LOGGER.debug("Ignoring unrecognised parameter id %s on line %d of %s", tokens[0], i + 1, file);
        continue;
      }
      try {
        par.values.put(constant, parseFortranDouble(tokens[1]));
        par.stdevs.put(constant, parseFortranDouble(tokens[2]));
      } catch (NumberFormatException e) {
        throw new MalformedFileException(file, i + 1, "Unparseable constant: " + e.getMessage(), e);
      }
      if (!par.givenConstants.contains(constant)) {
        par.givenConstants.add(constant);
      }
    }
    if (par.npar != null) {
      par.npar -= par.quadrupoleCount();
    }
    LOGGER.debug("Read %d constants from %s", par.givenConstants.size(), file);
    return par;
  }

  private static Integer intToken(String[] tokens, int index) {
    return index < tokens.length ? Integer.valueOf(tokens[index]) : null;
  }

  private static String stringToken(String[] tokens, int index) {
    return index < tokens.length ? tokens[index] : null;
  }

  static Double parseFortranDouble(String token) {
    return Double.parseDouble(token.replace('D', 'E').replace('d', 'e'));
  }

  /**
   * The SPFIT spin flag for up to three quadrupolar nuclei: one 2I+1 digit per nucleus, or "1" with none.
   */
  public static String nuclearSpinFlag(Double... spins) {
    StringBuilder flag = new StringBuilder();
    for (Double spin : spins) {
      if (spin == null) {
        continue;
      }
      String digit = SPIN_TO_FLAG.get(spin);
      if (digit == null) {
        throw new InvalidParameterException(String.format("Unsupported nuclear spin %s", spin));
      }
      flag.append(digit);
    }
    return flag.length() == 0 ? "1" : flag.toString();
  }

  /**
   * @return The nuclear spins encoded in the spin flag; empty for "1".
   */
  public List<Double> getNuclearSpins() {
    List<Double> spins = new ArrayList<>();
    if (spind == null || "1".equals(spind)) {
      return spins;
    }
    for (char c : spind.toCharArray()) {
      Double spin = FLAG_TO_SPIN.get(c);
      if (spin == null) {
        throw new InvalidParameterException(String.format("Unrecognised spin flag digit '%c' in %s", c, spind));
      }
      spins.add(spin);
    }
    return spins;
  }

  public void setNuclearSpins(Double... spins) {
    this.spind = nuclearSpinFlag(spins);
  }

  public Double getConstant(PickettConstant constant) {
    return values.get(constant);
  }

  public Double getStdev(PickettConstant constant) {
    return stdevs.get(constant);
  }

  public boolean hasConstant(PickettConstant constant) {
    return values.get(constant) != null;
  }

  public void setConstant(PickettConstant constant, Double value) {
    values.put(constant, value);
    if (!stdevs.containsKey(constant)) {
      stdevs.put(constant, FLOATING_STDEV);
    }
  }

  public void setStdev(PickettConstant constant, boolean floating) {
    stdevs.put(constant, floating ? FLOATING_STDEV : FIXED_STDEV);
  }

  public void removeConstant(PickettConstant constant) {
    values.remove(constant);
    stdevs.remove(constant);
  }

  /**
   * @return Constants that were present in the parsed file, in file order.
   */
  public List<PickettConstant> getGivenConstants() {
    return Collections.unmodifiableList(givenConstants);
  }

  /**
   * @return Quartic distortion constants currently present.
   */
  public List<PickettConstant> presentQuarticDistortionConstants() {
    List<PickettConstant> present = new ArrayList<>();
    for (PickettConstant c : PickettConstant.QUARTIC_DISTORTION) {
      if (hasConstant(c)) {
        present.add(c);
      }
    }
    return present;
  }

  public void floatGivenQdc() {
    for (PickettConstant c : presentQuarticDistortionConstants()) {
      setStdev(c, true);
    }
  }

  public void fixGivenQdc() {
    for (PickettConstant c : presentQuarticDistortionConstants()) {
      setStdev(c, false);
    }
  }

  /**
   * Add every missing quartic distortion constant at zero and float or fix all of them.
   */
  public void includeAllQdc(boolean floating) {
    for (PickettConstant c : PickettConstant.QUARTIC_DISTORTION) {
      if (!hasConstant(c)) {
        setConstant(c, 0.0);
        npar++;
      }
      setStdev(c, floating);
    }
  }

  int quadrupoleCount() {
    int count = 0;
    for (PickettConstant c : values.keySet()) {
      if (c.isQuadrupole() && values.get(c) != null) {
        count++;
      }
    }
    return count;
  }

  private static String orEmpty(Object o) {
    return o == null ? "" : o.toString();
  }

  public String write(String name) {
    StringBuilder sb = new StringBuilder();
    sb.append(name == null ? DEFAULT_NAME : name).append("  \n");
    Integer writtenNpar = npar == null ? null : npar + quadrupoleCount();
    sb.append(String.format("   %s  %s  %s  %s  %s  %s  %s  %s\n", orEmpty(writtenNpar), orEmpty(nline),
        orEmpty(nitr), orEmpty(nxpar), orEmpty(thresh), orEmpty(errtst), orEmpty(frac), orEmpty(cal)));
    sb.append(String.format("%s  %s  %s  %s  %s  %s  %s  %s  %s  %s  %s  %s  %s\n", orEmpty(chr), orEmpty(spind),
        orEmpty(nvib), orEmpty(knmin), orEmpty(knmax), orEmpty(ixx), orEmpty(iax), orEmpty(wtpl), orEmpty(wtmn),
        orEmpty(vsym), orEmpty(ewt), orEmpty(diag), orEmpty(xopt)));
    for (PickettConstant c : PickettConstant.values()) {
      if (c.isQuadrupole() || !hasConstant(c)) {
        continue;
      }
      sb.append(StringUtils.leftPad(c.getId(), ID_FIELD_WIDTH))
          .append(String.format("  %s %s \n", values.get(c), orEmpty(stdevs.get(c))));
    }
    for (PickettConstant c : PickettConstant.values()) {
      if (!c.isQuadrupole() || !hasConstant(c)) {
        continue;
      }
      sb.append(QUADRUPOLE_INDENT).append(c.getId())
          .append(String.format("  %s %s \n", values.get(c), orEmpty(stdevs.get(c))));
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
    LOGGER.info("Wrote parameter file %s", file);
  }

  /**
   * @return Constant labels to values, for reporting.
   */
  public Map<String, Double> constantsByLabel() {
    Map<String, Double> result = new LinkedHashMap<>();
    for (Map.Entry<PickettConstant, Double> e : values.entrySet()) {
      if (e.getValue() != null) {
        result.put(e.getKey().getLabel(), e.getValue());
      }
    }
    return result;
  }

  public Integer getNpar() {
    return npar;
  }

  public void setNpar(Integer npar) {
    this.npar = npar;
  }

  public Integer getNline() {
    return nline;
  }

  public void setNline(Integer nline) {
    this.nline = nline;
  }

  public Integer getNitr() {
    return nitr;
  }

  public void setNitr(Integer nitr) {
    this.nitr = nitr;
  }

  public Integer getNxpar() {
    return nxpar;
  }

  public String getThresh() {
    return thresh;
  }

  public String getErrtst() {
    return errtst;
  }

  public String getFrac() {
    return frac;
  }

  public String getCal() {
    return cal;
  }

  public String getChr() {
    return chr;
  }

  public void setChr(String chr) {
    this.chr = chr;
  }

  public String getSpind() {
    return spind;
  }

  public Integer getNvib() {
    return nvib;
  }

  public Integer getKnmin() {
    return knmin;
  }

  public Integer getKnmax() {
    return knmax;
  }

  public Integer getIxx() {
    return ixx;
  }

  public Integer getIax() {
    return iax;
  }

  public Integer getWtpl() {
    return wtpl;
  }

  public Integer getWtmn() {
    return wtmn;
  }

  public Integer getVsym() {
    return vsym;
  }

  public Integer getEwt() {
    return ewt;
  }

  public Integer getDiag() {
    return diag;
  }

  public Integer getXopt() {
    return xopt;
  }
}
