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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A predicted catalog line paired with an experimental peak lying within the match tolerance.
 */
public class LineMatch {
  @JsonProperty("cat_frequency")
  private Double catFrequency;

  @JsonProperty("spectrum_frequency")
  private Double spectrumFrequency;

  public LineMatch(Double catFrequency, Double spectrumFrequency) {
    this.catFrequency = catFrequency;
    this.spectrumFrequency = spectrumFrequency;
  }

  public LineMatch() {}

  public Double getCatFrequency() {
    return catFrequency;
  }

  public Double getSpectrumFrequency() {
    return spectrumFrequency;
  }
}
