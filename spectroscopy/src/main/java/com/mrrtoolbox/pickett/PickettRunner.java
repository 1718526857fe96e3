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

import com.mrrtoolbox.utils.ProcessRunner;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Invokes Pickett's SPFIT, SPCAT and piform on a named set of files (name.par, name.lin, name.int, ...) in a working
 * directory.  The programs are interactive, so their prompts are answered on stdin.
 */
public class PickettRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PickettRunner.class);

  public static final String SPFIT = "spfit";
  public static final String SPCAT = "spcat";
  public static final String PIFORM = "piform";
  public static final List<String> EXECUTABLES = Collections.unmodifiableList(Arrays.asList(SPFIT, SPCAT, PIFORM));

  public static final Integer DEFAULT_PIFORM_DECIMALS = 2;

  private final File executableDirectory;
  private final Long timeoutInSeconds;

  /**
   * @param executableDirectory Where spfit, spcat and piform live; null to find them on the PATH.
   * @param timeoutInSeconds Per-invocation timeout; null to wait indefinitely.
   */
  public PickettRunner(File executableDirectory, Long timeoutInSeconds) {
    this.executableDirectory = executableDirectory;
    this.timeoutInSeconds = timeoutInSeconds;
  }

  public PickettRunner() {
    this(null, null);
  }

  private String resolve(String executable) throws IOException {
    if (executableDirectory == null) {
      return executable;
    }
    File f = new File(executableDirectory, executable);
    if (!f.canExecute()) {
      throw new IOException(String.format("Pickett executable %s is missing or not executable", f));
    }
    return f.getAbsolutePath();
  }

  private void run(String executable, List<String> args, File workingDirectory, String stdin)
      throws IOException, InterruptedException {
    int exitCode = ProcessRunner.runProcess(resolve(executable), args, workingDirectory, stdin, timeoutInSeconds);
    if (exitCode != 0) {
      throw new IOException(String.format("%s exited with status %d in %s", executable, exitCode, workingDirectory));
    }
  }

  /**
   * Fit name.lin against name.par, then render the output as name.pi.
   */
  public void spfit(File workingDirectory, String name) throws IOException, InterruptedException {
    run(SPFIT, Collections.singletonList(name), workingDirectory, null);
    piform(workingDirectory, name, DEFAULT_PIFORM_DECIMALS);
  }

  public void piform(File workingDirectory, String name, Integer decimals) throws IOException, InterruptedException {
    String answers = String.format("%s\n%s%s\n%d\n", name, name, PiformReport.EXTENSION, decimals);
    run(PIFORM, Collections.emptyList(), workingDirectory, answers);
  }

  /**
   * Predict name.cat from the fitted constants in name.var and the intensities in name.int.
   */
  public void spcat(File workingDirectory, String name) throws IOException, InterruptedException {
    String answers = String.format("%s%s\n%s%s\n", name, ParFile.VAR_EXTENSION, name, IntFile.EXTENSION);
    run(SPCAT, Collections.emptyList(), workingDirectory, answers);
  }

  /**
   * Copy any executable not already present in destDir from parentDir.
   * @return The files copied.
   */
  public static List<File> copyExecutables(File parentDir, File destDir) throws IOException {
    List<File> copied = new ArrayList<>();
    for (String executable : EXECUTABLES) {
      File target = new File(destDir, executable);
      if (target.exists()) {
        continue;
      }
      File source = new File(parentDir, executable);
      if (!source.isFile()) {
        throw new IOException(String.format("Pickett executable %s not found", source));
      }
      FileUtils.copyFile(source, target);
      if (!target.setExecutable(true)) {
        LOGGER.warn("Could not mark %s executable", target);
      }
      copied.add(target);
    }
    LOGGER.info("Copied %d Pickett executables into %s", copied.size(), destDir);
    return copied;
  }

  public File getExecutableDirectory() {
    return executableDirectory;
  }
}
