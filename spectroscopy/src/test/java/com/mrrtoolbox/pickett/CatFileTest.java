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
import com.mrrtoolbox.spectrum.Peak;
import com.mrrtoolbox.spectrum.SimulationParameters;
import com.mrrtoolbox.spectrum.Spectrum;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class CatFileTest {
  private CatFile cat;

  @Before
  public void setUp() throws Exception {
    cat = CatFile.parse(new File(this.getClass().getResource("sample.cat").getFile()));
  }

  @Test
  public void testParseGroupsBlendedLines() {
    assertEquals("sample", cat.getName());
    assertEquals("Two lines share 3000 MHz", 4, cat.getTransitions().size());
    assertEquals(2, cat.getGroup(3000.0).size());
    assertEquals(5, cat.lineList().size());

    Transition t = cat.getGroup(4500.1234).get(0);
    assertEquals(-2.0, t.getLgint(), 0.0);
    assertEquals(Integer.valueOf(303), t.getQnfmt());
    assertEquals(Integer.valueOf(3), t.getN1());
    assertEquals(Integer.valueOf(0), t.getKa1());
    assertEquals(Integer.valueOf(3), t.getKc1());
    assertEquals(Integer.valueOf(2), t.getN0());
    assertNull("Unused quantum number columns are empty", t.getJ1());
  }

  @Test
  public void testLetterEncodedQuantumNumbers() {
    Transition t = cat.getGroup(7100.25).get(0);
    assertEquals(Integer.valueOf(102), t.getN1());
    assertEquals(Integer.valueOf(101), t.getN0());

    assertEquals(Integer.valueOf(115), CatFile.parseQuantumNumber("B5"));
    assertEquals(Integer.valueOf(-10), CatFile.parseQuantumNumber("a0"));
    assertEquals(Integer.valueOf(-5), CatFile.parseQuantumNumber("-5"));
    assertNull(CatFile.parseQuantumNumber(""));
  }

  @Test
  public void testStrongestLine() {
    Peak strongest = cat.maxIntensity();
    assertEquals(4500.1234, strongest.getFrequency(), 0.0);
    assertEquals(1e-2, strongest.getIntensity(), 1e-15);
  }

  @Test
  public void testKaFilter() {
    Map<Double, List<Transition>> kept = cat.filter(new CatFilter().kaMax(3));
    assertEquals(Arrays.asList(3000.0, 4500.1234, 7100.25), new ArrayList<>(kept.keySet()));
  }

  @Test
  public void testOneOutOfBoundsLineDropsItsWholeGroup() {
    LinkedHashMap<Double, List<Transition>> groups = new LinkedHashMap<>();
    groups.put(6000.0, Arrays.asList(
        Transition.asymmetricTop(6000.0, -3.0, 3, 2, 1, 2, 1, 1),
        Transition.asymmetricTop(6000.0, -3.5, 9, 8, 2, 8, 7, 1)));
    groups.put(6500.0, Collections.singletonList(Transition.asymmetricTop(6500.0, -4.0, 2, 1, 2, 1, 0, 1)));
    CatFile blended = new CatFile("blended", groups);

    Map<Double, List<Transition>> kept = blended.filter(new CatFilter().kaMax(5));
    assertFalse("Ka 8 removes the 6000 MHz group, including its Ka 2 line", kept.containsKey(6000.0));
    assertEquals(Collections.singletonList(6500.0), new ArrayList<>(kept.keySet()));
  }

  @Test
  public void testCatalogIsIsolatedFromCallerChanges() {
    LinkedHashMap<Double, List<Transition>> groups = new LinkedHashMap<>();
    List<Transition> group = new ArrayList<>();
    group.add(Transition.asymmetricTop(6000.0, -3.0, 3, 2, 1, 2, 1, 1));
    groups.put(6000.0, group);
    CatFile copied = new CatFile("copied", groups);

    group.add(Transition.asymmetricTop(6000.0, 0.0, 4, 2, 2, 3, 1, 2));
    groups.put(7000.0, Collections.singletonList(Transition.asymmetricTop(7000.0, 1.0, 2, 1, 2, 1, 0, 1)));
    assertEquals(1, copied.getTransitions().size());
    assertEquals(1, copied.getGroup(6000.0).size());
    assertEquals(1e-3, copied.maxIntensity().getIntensity(), 1e-15);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testTransitionsAreReadOnly() {
    cat.getTransitions().remove(3000.0);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testGroupsAreReadOnly() {
    cat.getGroup(3000.0).clear();
  }

  @Test
  public void testFrequencyFilter() {
    Map<Double, List<Transition>> kept = cat.filter(new CatFilter().freqMin(4000.0).freqMax(6000.0));
    assertEquals(Arrays.asList(4500.1234, 5200.5), new ArrayList<>(kept.keySet()));
  }

  @Test
  public void testDynamicRangeDropsWholeGroup() {
    Map<Double, List<Transition>> kept = cat.filter(new CatFilter().dynRange(100.0));
    assertFalse("One weak member drops every line at that frequency", kept.containsKey(3000.0));
    assertFalse(kept.containsKey(5200.5));
    assertEquals(Arrays.asList(4500.1234, 7100.25), new ArrayList<>(kept.keySet()));
  }

  @Test(expected = InvalidParameterException.class)
  public void testNonPositiveDynamicRangeIsRejected() {
    cat.filter(new CatFilter().dynRange(0.0));
  }

  @Test
  public void testSpectrumMatchesKeepEveryPairing() {
    List<LineMatch> matches = CatFile.spectrumMatches(Arrays.asList(3000.01, 4500.2, 6000.0),
        cat.getTransitions(), null);
    assertEquals(1, matches.size());
    assertEquals(3000.0, matches.get(0).getCatFrequency(), 0.0);
    assertEquals(3000.01, matches.get(0).getSpectrumFrequency(), 0.0);

    matches = CatFile.spectrumMatches(Arrays.asList(3000.01, 4500.2), cat.getTransitions(), 0.1);
    assertEquals(2, matches.size());
  }

  @Test
  public void testScaleToSpectrumRejectsOutlier() throws Exception {
    int rows = 22;
    double[] freqs = new double[rows];
    double[] intensities = new double[rows];
    LinkedHashMap<Double, List<Transition>> groups = new LinkedHashMap<>();
    List<Double> assigned = new ArrayList<>();
    for (int i = 0; i < rows; i++) {
      freqs[i] = i;
    }
    for (int i = 1; i <= 20; i++) {
      intensities[i] = i == 7 ? 100.0 : 2.0;
      groups.put((double) i, Arrays.asList(Transition.asymmetricTop((double) i, 0.0, 1, 0, 1, 0, 0, 0)));
      assigned.add((double) i);
    }
    Spectrum spectrum = Spectrum.fromFrequencyAndIntensity(freqs, intensities);

    Double scale = CatFile.scaleToSpectrum(spectrum, assigned, groups, null);
    assertEquals("The 100x line is trimmed before averaging", 2.0, scale, 1e-12);
  }

  @Test(expected = InvalidParameterException.class)
  public void testScaleToSpectrumNeedsAssignedLines() throws Exception {
    Spectrum spectrum = Spectrum.fromFrequencyAndIntensity(new double[] {0.0, 1.0}, new double[] {1.0, 1.0});
    CatFile.scaleToSpectrum(spectrum, Arrays.asList(500.0), cat.getTransitions(), null);
  }

  @Test
  public void testSimulateOnlyDrawsFilteredLines() {
    SimulationParameters params = new SimulationParameters(4000.0, 5000.0, 0.0125, 0.060, null);
    Spectrum sim = CatSimulator.simulate(cat, params, 3, null);
    assertEquals("Nearest grid point is 1.6 kHz from the line", 1e-2, sim.getIntensity(4500.1234), 1e-4);
    assertTrue(sim.getMaxIntensity(1) <= 1e-2);
  }
}
