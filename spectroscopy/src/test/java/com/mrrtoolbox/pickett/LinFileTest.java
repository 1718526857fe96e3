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
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class LinFileTest {
  private File workingDir;
  private LinFile lin;

  @Before
  public void setUp() throws Exception {
    workingDir = Files.createTempDirectory("lin-file-test").toFile();
    lin = new LinFile(Arrays.asList(
        new LinAssignment(3000.0, 2, 1, 2, 1, 0, 1),
        new LinAssignment(4500.1234, 3, 0, 3, 2, 0, 2),
        new LinAssignment(3000.0, 3, 2, 1, 3, 1, 2)));
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(workingDir);
  }

  @Test
  public void testRowFormat() {
    assertEquals("  2  1  2  1  0  1  0  0  0  0  0  0    3000.0000     0.040000     1.00E-04",
        LinFile.formatRow(lin.getAssignments().get(0)));
  }

  @Test
  public void testRowFormatIgnoresDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.FRANCE);
    try {
      assertEquals("  3  0  3  2  0  2  0  0  0  0  0  0    4500.1234     0.040000     1.00E-04",
          LinFile.formatRow(lin.getAssignments().get(1)));
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  public void testSaveAndParse() throws Exception {
    File file = new File(workingDir, "molecule.lin");
    lin.save(file);
    LinFile parsed = LinFile.parse(file);
    assertEquals(3, parsed.size());
    LinAssignment second = parsed.getAssignments().get(1);
    assertEquals(4500.1234, second.getFreq(), 0.0);
    assertEquals(0.04, second.getErr(), 0.0);
    assertEquals(1e-4, second.getWt(), 0.0);
    assertArrayEquals(new int[] {3, 0, 3, 2, 0, 2, 0, 0, 0, 0, 0, 0}, second.getQuantumNumbers());
  }

  @Test(expected = MalformedFileException.class)
  public void testShortRowIsMalformed() throws Exception {
    File file = new File(workingDir, "bad.lin");
    FileUtils.writeStringToFile(file, "2 1 2 1 0 1 3000.0 0.04 1e-4\n", StandardCharsets.UTF_8);
    LinFile.parse(file);
  }

  @Test
  public void testDeleteRowAndFrequency() {
    LinAssignment removed = lin.deleteRow(1);
    assertEquals(4500.1234, removed.getFreq(), 0.0);
    assertEquals("Every assignment at the frequency goes", 2, lin.deleteFrequency(3000.0));
    assertEquals(0, lin.size());
  }

  @Test(expected = InvalidParameterException.class)
  public void testDeleteMissingRowIsRejected() {
    lin.deleteRow(3);
  }

  @Test
  public void testByFrequencyGroupsBlends() {
    Map<Double, List<LinAssignment>> grouped = lin.byFrequency();
    assertEquals(2, grouped.size());
    assertEquals(2, grouped.get(3000.0).size());
  }

  @Test
  public void testWithFrequencyKeepsQuantumNumbers() {
    LinAssignment moved = lin.getAssignments().get(0).withFrequency(3000.05);
    assertEquals(3000.05, moved.getFreq(), 0.0);
    assertEquals(2, moved.getJ1());
    assertEquals(1, moved.getKc0());
  }
}
