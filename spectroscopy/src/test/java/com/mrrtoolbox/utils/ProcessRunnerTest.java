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

package com.mrrtoolbox.utils;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ProcessRunnerTest {
  private File tempDir;

  @Before
  public void setUp() throws Exception {
    tempDir = Files.createTempDirectory("process-runner").toFile();
  }

  @After
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(tempDir);
  }

  @Test
  public void testExitCodeAndWorkingDirectory() throws Exception {
    int exit = ProcessRunner.runProcess("sh", Arrays.asList("-c", "cat > piped.txt; exit 3"), tempDir, "molecule\n",
        10L);
    assertEquals(3, exit);
    assertEquals("Standard input reaches the child", "molecule\n",
        FileUtils.readFileToString(new File(tempDir, "piped.txt"), StandardCharsets.UTF_8));
  }

  @Test
  public void testHungChildIsKilledAtTimeout() throws Exception {
    long start = System.currentTimeMillis();
    try {
      ProcessRunner.runProcess("sleep", Collections.singletonList("30"), tempDir, null, 1L);
      fail("A child sleeping past its timeout should raise an IOException");
    } catch (IOException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("did not finish within 1 seconds"));
    }
    long elapsed = System.currentTimeMillis() - start;
    assertTrue("Gave up after " + elapsed + " ms", elapsed < 10000L);
  }

  @Test
  public void testChildOutputDoesNotBlockCompletion() throws Exception {
    // Enough output to fill the pipe buffer if nobody were reading it.
    int exit = ProcessRunner.runProcess("sh", Arrays.asList("-c", "seq 1 200000"), tempDir, null,
        30L);
    assertEquals(0, exit);
  }
}
