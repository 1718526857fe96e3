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

import com.mrrtoolbox.errors.InvalidParameterException;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;

public class SpectrumSimulatorTest {
  private static final SimulationParameters PARAMS = new SimulationParameters(0.0, 10.0, 0.5, 1.0, null);

  @Test
  public void testGridIncludesBothEnds() {
    Spectrum sim = SpectrumSimulator.simulate(Arrays.asList(new Peak(5.0, 1.0)), PARAMS);
    assertEquals(21, sim.getRowCount());
    assertEquals(10.0, sim.getFreqMax(), 0.0);
  }

  @Test
  public void testLineShapeIsGaussianWithRequestedWidth() {
    Spectrum sim = SpectrumSimulator.simulate(Arrays.asList(new Peak(5.0, 2.0)), PARAMS);
    assertEquals(2.0, sim.getIntensity(5.0), 1e-12);
    assertEquals("Half maximum at half the FWHM from the center", 1.0, sim.getIntensity(5.5), 1e-12);
    assertEquals(1.0, sim.getIntensity(4.5), 1e-12);
    assertEquals("Nothing drawn beyond four half-widths", 0.0, sim.getIntensity(8.0), 0.0);
  }

  @Test
  public void testOverlappingLinesAdd() {
    Spectrum sim = SpectrumSimulator.simulate(Arrays.asList(new Peak(5.0, 1.0), new Peak(5.0, 1.0)), PARAMS);
    assertEquals(2.0, sim.getIntensity(5.0), 1e-12);

    sim = SpectrumSimulator.simulate(Arrays.asList(new Peak(5.0, 1.0), new Peak(6.0, 1.0)), PARAMS);
    assertEquals("Halfway point gets half of each line", 1.0, sim.getIntensity(5.5), 1e-12);
  }

  @Test
  public void testLinesOnOrOutsideRangeAreSkipped() {
    Spectrum sim = SpectrumSimulator.simulate(
        Arrays.asList(new Peak(0.0, 1.0), new Peak(10.0, 1.0), new Peak(12.0, 1.0)), PARAMS);
    assertEquals(0.0, sim.getMaxIntensity(1), 0.0);
  }

  @Test
  public void testScaleFactorMultipliesIntensities() {
    Spectrum sim = SpectrumSimulator.simulate(Arrays.asList(new Peak(5.0, 1.0)), PARAMS.withScaleFactor(3.0));
    assertEquals(3.0, sim.getIntensity(5.0), 1e-12);
  }

  @Test(expected = InvalidParameterException.class)
  public void testNonPositiveWidthIsRejected() {
    SpectrumSimulator.simulate(Arrays.asList(new Peak(5.0, 1.0)), new SimulationParameters(0.0, 10.0, 0.5, 0.0, null));
  }
}
