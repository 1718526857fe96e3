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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Intensity ratio records of the two diastereomeric complexes: the one dominant in the enriched sample and the minor
 * one.
 */
public class ScaleFactorResult {
  @JsonProperty("dominant")
  private List<IntensityRatioRecord> dominant;

  @JsonProperty("minor")
  private List<IntensityRatioRecord> minor;

  private ScaleFactorResult() {}

  public ScaleFactorResult(List<IntensityRatioRecord> dominant, List<IntensityRatioRecord> minor) {
    this.dominant = dominant;
    this.minor = minor;
  }

  public List<IntensityRatioRecord> getDominant() {
    return Collections.unmodifiableList(dominant);
  }

  public List<IntensityRatioRecord> getMinor() {
    return Collections.unmodifiableList(minor);
  }
}
