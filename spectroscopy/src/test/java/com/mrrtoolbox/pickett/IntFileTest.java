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
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class IntFileTest {
  private File workingDir;

  @Before
  public void setUp() throws Exception {
    workingDir = Files.createTempDirectory("int-file-test").toFile();
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(workingDir);
  }

  @Test
  public void testPartitionFunction() {
    assertEquals(5.3311e6, IntFile.partitionFunction(1.0, 1.0, 1.0, 1.0), 1e-6);
    assertEquals(79.47134663232752, IntFile.partitionFunction(1.0, 3000.0, 1500.0, 1000.0), 1e-9);
    assertEquals("qrot grows as T^1.5", 8 * 79.47134663232752,
        IntFile.partitionFunction(4.0, 3000.0, 1500.0, 1000.0), 1e-9);
  }

  @Test(expected = InvalidParameterException.class)
  public void testNonPositiveConstantIsRejected() {
    IntFile.partitionFunction(1.0, 3000.0, 0.0, 1000.0);
  }

  @Test
  public void testSaveAndParse() throws Exception {
    IntFile in = new IntFile();
    in.setMuA(1.2);
    in.setMuB(0.0);
    in.setTemp(2.0);
    in.updatePartitionFunction(3000.0, 1500.0, 1000.0);
    File file = new File(workingDir, "molecule.int");
    in.save(file);

    IntFile parsed = IntFile.parse(file);
    assertEquals(in.getQrot(), parsed.getQrot(), 1e-9);
    assertEquals(2.0, parsed.getTemp(), 0.0);
    assertEquals(Integer.valueOf(91), parsed.getTag());
    assertEquals(18.0, parsed.getFqlim(), 0.0);
    assertEquals(1.2, parsed.getMuA(), 0.0);
    assertEquals(0.0, parsed.getMuB(), 0.0);
    assertEquals(1.0, parsed.getMuC(), 0.0);
    assertNull(parsed.getMaxv());
  }
}
