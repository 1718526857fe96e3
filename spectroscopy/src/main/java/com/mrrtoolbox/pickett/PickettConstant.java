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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Spectroscopic constants understood by the Pickett programs, with the parameter ids SPFIT uses for them.
 */
public enum PickettConstant {
  A("A", "10000"),
  B("B", "20000"),
  C("C", "30000"),
  DJ("DJ", "200"),
  DJK("DJK", "1100"),
  DK("DK", "2000"),
  LOWER_DJ("dJ", "40100"),
  LOWER_DK("dK", "41000"),
  CHI_AA_1("chi_aa_1", "110010000"),
  CHI_BBCC_1("chi_bbcc_1", "110040000"),
  CHI_AB_1("chi_ab_1", "110610000"),
  CHI_BC_1("chi_bc_1", "110210000"),
  CHI_AC_1("chi_ac_1", "110410000"),
  CHI_AA_2("chi_aa_2", "220010000"),
  CHI_BBCC_2("chi_bbcc_2", "220040000"),
  CHI_AB_2("chi_ab_2", "220610000"),
  CHI_BC_2("chi_bc_2", "220210000"),
  CHI_AC_2("chi_ac_2", "220410000"),
  CHI_AA_3("chi_aa_3", "330010000"),
  CHI_BBCC_3("chi_bbcc_3", "330040000"),
  CHI_AB_3("chi_ab_3", "330610000"),
  CHI_BC_3("chi_bc_3", "330210000"),
  CHI_AC_3("chi_ac_3", "330410000"),
  ;

  public static final Set<PickettConstant> ROTATIONAL = Collections.unmodifiableSet(EnumSet.of(A, B, C));
  public static final List<PickettConstant> QUARTIC_DISTORTION =
      Collections.unmodifiableList(Arrays.asList(DJ, DJK, DK, LOWER_DJ, LOWER_DK));

  private static final Map<String, PickettConstant> BY_LABEL = new HashMap<>();
  private static final Map<String, PickettConstant> BY_ID = new HashMap<>();

  static {
    for (PickettConstant c : values()) {
      BY_LABEL.put(c.label, c);
      BY_ID.put(c.id, c);
    }
  }

  private final String label;
  private final String id;

  PickettConstant(String label, String id) {
    this.label = label;
    this.id = id;
  }

  public String getLabel() {
    return label;
  }

  public String getId() {
    return id;
  }

  public boolean isRotational() {
    return ROTATIONAL.contains(this);
  }

  public boolean isQuarticDistortion() {
    return QUARTIC_DISTORTION.contains(this);
  }

  public boolean isQuadrupole() {
    return ordinal() >= CHI_AA_1.ordinal();
  }

  /**
   * @return The constant with this label (case-sensitive: "DJ" and "dJ" differ), or null.
   */
  public static PickettConstant fromLabel(String label) {
    return BY_LABEL.get(label);
  }

  public static PickettConstant fromId(String id) {
    return BY_ID.get(id);
  }
}
