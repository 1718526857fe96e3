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

package com.mrrtoolbox.spectrum;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The strongest sample found in a search window, with the intensity column it came from.
 */
public class HighPoint {
  @JsonProperty("frequency")
  private Double frequency;

  @JsonProperty("intensity")
  private Double intensity;

  @JsonProperty("column")
  private Integer column;

  public HighPoint(Double frequency, Double intensity, Integer column) {
    this.frequency = frequency;
    this.intensity = intensity;
    this.column = column;
  }

  public HighPoint() {}

  public Double getFrequency() {
    return frequency;
  }

  public Double getIntensity() {
    return intensity;
  }

  public Integer getColumn() {
    return column;
  }
}
