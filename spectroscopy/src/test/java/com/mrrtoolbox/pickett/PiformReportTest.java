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
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class PiformReportTest {
  private PiformReport report;

  @Before
  public void setUp() throws Exception {
    report = PiformReport.parse(new File(this.getClass().getResource("sample.pi").getFile()));
  }

  @Test
  public void testFinalIterationSummary() {
    assertEquals(0.025, report.getRms(), 1e-12);
    assertEquals(Integer.valueOf(3), report.getDistinctFrequencies());
    assertEquals(Integer.valueOf(6), report.getDistinctParameters());
  }

  @Test
  public void testOnlyFinalIterationLinesAreRead() {
    List<String> lines = report.getLineList();
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).contains("3000.0000"));
  }

  @Test
  public void testConstantsAndUncertainties() {
    assertEquals("3000.12345", report.constant("A"));
    assertEquals("12", report.uncertainty("A"));
    assertEquals("Leading zeros of the uncertainty are dropped", "20", report.uncertainty("B"));
    assertEquals("0.0275(12)", report.getConstant(PickettConstant.DJ).toParenthesized());
    assertTrue(report.getConstant(PickettConstant.DK).isHeldAtZero());
    assertNull("Constants absent from the report are null", report.constant("dJ"));
  }

  @Test(expected = InvalidParameterException.class)
  public void testUnknownLabelIsRejected() {
    report.constant("E");
  }

  @Test
  public void testQdcCheckFlagsPoorlyDeterminedConstants() {
    assertEquals(Collections.singletonList(PickettConstant.DJK), report.qdcCheck());
  }

  @Test
  public void testUncertaintyCheck() {
    assertTrue(PiformReport.uncertaintyCheck("0.0275(12)"));
    assertFalse(PiformReport.uncertaintyCheck("0.0012(15)"));
    assertFalse(PiformReport.uncertaintyCheck("-0.0012(15)"));
    assertTrue(PiformReport.uncertaintyCheck("3000.12345(12)"));
  }

  @Test(expected = InvalidParameterException.class)
  public void testUncertaintyCheckNeedsParentheses() {
    PiformReport.uncertaintyCheck("0.0275");
  }

  @Test
  public void testWorstFittedSections() {
    assertEquals(Arrays.asList("1100"), report.getBadConstantIds());
    assertTrue(report.hasWorstLine());
    assertEquals(2, report.worstLineRow());
    assertEquals(6123.4567, report.worstLineFrequency(), 0.0);
    assertEquals(0.045, report.worstLineObsMinusCalc(), 0.0);
  }

  @Test
  public void testLineListSplit() throws Exception {
    List<PiformReport.AssignedLine> lines = report.lineListSplit(3);
    assertEquals(3, lines.size());
    assertArrayEquals(new String[] {"3", "0", "3", "2", "0", "2"}, lines.get(1).getQuantumNumbers());
    assertEquals(4500.1234, lines.get(1).getFrequency(), 0.0);
    assertEquals(-0.002, lines.get(1).getObsMinusCalc(), 0.0);
  }

  @Test(expected = MalformedFileException.class)
  public void testReportWithoutIterationIsMalformed() throws Exception {
    File dir = Files.createTempDirectory("piform-test").toFile();
    try {
      File empty = new File(dir, "empty.pi");
      FileUtils.writeStringToFile(empty, "nothing to see\n", StandardCharsets.UTF_8);
      PiformReport.parse(empty);
    } finally {
      FileUtils.deleteDirectory(dir);
    }
  }
}
