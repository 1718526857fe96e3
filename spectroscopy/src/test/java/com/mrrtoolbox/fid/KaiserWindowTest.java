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

package com.mrrtoolbox.fid;

import com.mrrtoolbox.errors.InvalidParameterException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class KaiserWindowTest {

  @Test
  public void testBesselI0KnownValues() {
    assertEquals(1.0, KaiserWindow.besselI0(0.0), 1e-15);
    assertEquals(1.2660658777520082, KaiserWindow.besselI0(1.0), 1e-12);
    assertEquals(2815.716628466254, KaiserWindow.besselI0(10.0), 1e-8);
  }

  @Test
  public void testWindowIsSymmetricWithUnitPeak() {
    double[] w = KaiserWindow.window(11, 9.5);
    assertEquals(11, w.length);
    assertEquals("Middle sample of an odd window is 1", 1.0, w[5], 1e-12);
    for (int i = 0; i < w.length; i++) {
      assertEquals("Window must be symmetric", w[i], w[w.length - 1 - i], 1e-12);
    }
    assertEquals("Edges are 1 / I0(beta)", 1.0 / KaiserWindow.besselI0(9.5), w[0], 1e-15);
  }

  @Test
  public void testMatchesReferenceValues() {
    // kaiser(5, 4.0)
    double[] expected = new double[] {0.08848052607644988, 0.6334317797559347, 1.0, 0.6334317797559347,
        0.08848052607644988};
    double[] w = KaiserWindow.window(5, 4.0);
    for (int i = 0; i < expected.length; i++) {
      assertEquals(expected[i], w[i], 1e-9);
    }
  }

  @Test
  public void testDegenerateLengths() {
    assertEquals(0, KaiserWindow.window(0, 9.5).length);
    assertEquals(1.0, KaiserWindow.window(1, 9.5)[0], 0.0);
  }

  @Test(expected = InvalidParameterException.class)
  public void testNegativeLengthIsRejected() {
    KaiserWindow.window(-1, 9.5);
  }
}
