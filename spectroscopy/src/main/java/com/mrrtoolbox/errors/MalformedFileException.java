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

package com.mrrtoolbox.errors;

import java.io.File;

public class MalformedFileException extends Exception {
  private final File file;
  private final Integer lineNumber;

  public MalformedFileException(File file, Integer lineNumber, String msg) {
    super(String.format("%s:%s: %s", file == null ? "<unknown>" : file.getPath(),
        lineNumber == null ? "?" : lineNumber.toString(), msg));
    this.file = file;
    this.lineNumber = lineNumber;
  }

  public MalformedFileException(File file, Integer lineNumber, String msg, Throwable cause) {
    this(file, lineNumber, msg);
    initCause(cause);
  }

  public File getFile() {
    return file;
  }

  /**
   * @return The 1-based line at which parsing failed, or null if the problem is not tied to a single line.
   */
  public Integer getLineNumber() {
    return lineNumber;
  }
}
