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

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the external fitting programs as child processes, feeding them their interactive answers on stdin and logging
 * what they print.
 */
public class ProcessRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ProcessRunner.class);
  private static final long KILL_GRACE_MILLIS = 1000L;

  public static int runProcess(String command, List<String> args, File workingDirectory)
      throws InterruptedException, IOException {
    return runProcess(command, args, workingDirectory, null, null);
  }

  /**
   * Run a child process in a working directory.
   * @param command The process to run.
   * @param args The arguments to pass to that process.
   * @param workingDirectory Directory the child runs in; null for ours.
   * @param stdin Text written to the child's standard input before it is closed; may be null.
   * @param timeoutInSeconds A timeout after which the child is killed; null waits forever.
   * @return The exit code of the child process.
   */
  public static int runProcess(String command, List<String> args, File workingDirectory, String stdin,
                               Long timeoutInSeconds)
      throws InterruptedException, IOException {
    /* Command and arguments are kept apart so callers never hand us a single shell string. */
    List<String> commandAndArgs = new ArrayList<String>(args.size() + 1) {{
      add(command);
      addAll(args);
    }};
    ProcessBuilder processBuilder = new ProcessBuilder(commandAndArgs);
    if (workingDirectory != null) {
      processBuilder.directory(workingDirectory);
    }
    LOGGER.info("Running child process: %s (in %s)", StringUtils.join(commandAndArgs, " "),
        workingDirectory == null ? "." : workingDirectory);

    Process p = processBuilder.start();
    // Both streams drain on their own threads so a silent, hung child still hits the timeout below.
    Thread stdoutLogger = startLogger(p.getInputStream(), l -> LOGGER.debug("[child STDOUT]: %s", l));
    Thread stderrLogger = startLogger(p.getErrorStream(), l -> LOGGER.warn("[child STDERR]: %s", l));
    try (OutputStream in = p.getOutputStream()) {
      if (stdin != null) {
        in.write(stdin.getBytes(StandardCharsets.US_ASCII));
      }
    }

    if (timeoutInSeconds != null) {
      if (!p.waitFor(timeoutInSeconds, TimeUnit.SECONDS)) {
        p.destroyForcibly();
        p.waitFor(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        stdoutLogger.join(KILL_GRACE_MILLIS);
        stderrLogger.join(KILL_GRACE_MILLIS);
        throw new IOException(String.format("%s did not finish within %d seconds", command, timeoutInSeconds));
      }
    } else {
      p.waitFor();
    }
    stdoutLogger.join();
    stderrLogger.join();

    // 0 is the default success exit code in *nix land.
    if (p.exitValue() != 0) {
      LOGGER.error("Child process exited with non-zero status code: %d", p.exitValue());
    }
    return p.exitValue();
  }

  private static Thread startLogger(InputStream stream, Consumer<String> consumer) {
    Thread t = new Thread(new StreamLogger(stream, consumer));
    // A grandchild that inherited the pipe must not keep the JVM alive.
    t.setDaemon(true);
    t.start();
    return t;
  }

  private static class StreamLogger implements Runnable {
    private final InputStream stream;
    private final Consumer<String> consumer;

    public StreamLogger(InputStream stream, Consumer<String> consumer) {
      this.stream = stream;
      this.consumer = consumer;
    }

    @Override
    public void run() {
      new BufferedReader(new InputStreamReader(stream, StandardCharsets.ISO_8859_1)).lines().forEach(consumer);
      try {
        stream.close();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}
