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

package com.mrrtoolbox.instruments;

import java.io.IOException;

/**
 * An instrument refused the connection, dropped it, or did not answer in time.  Never retried here; the caller decides
 * whether to try again.
 */
public class InstrumentUnreachableException extends IOException {
  public InstrumentUnreachableException(String msg) {
    super(msg);
  }

  public InstrumentUnreachableException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
