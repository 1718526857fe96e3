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
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FidProcessorTest {
  private static final Double SAMPLE_RATE = 1e9;
  private static final Double TONE_MHZ = 100.0;
  private static final int SAMPLES = 1000;

  private WaveformSample tone;

  @Before
  public void setUp() throws Exception {
    double[] samples = new double[SAMPLES];
    for (int i = 0; i < SAMPLES; i++) {
      samples[i] = Math.cos(2 * Math.PI * TONE_MHZ * 1e6 * i / SAMPLE_RATE);
    }
    tone = new WaveformSample(samples, SAMPLE_RATE);
  }

  @Test
  public void testGateKeepsLeadingFraction() {
    FidProcessor processor = new FidProcessor(tone);
    double[] gated = processor.gate(0.5);
    assertEquals(500, gated.length);
    assertEquals(tone.getSamples()[499], gated[499], 0.0);
    assertEquals(0.5, processor.getFidFraction(), 0.0);
  }

  @Test(expected = InvalidParameterException.class)
  public void testGateRejectsZeroFraction() {
    new FidProcessor(tone).gate(0.0);
  }

  @Test(expected = InvalidParameterException.class)
  public void testGateRejectsFractionAboveOne() {
    new FidProcessor(tone).gate(1.5);
  }

  @Test
  public void testWindowPreservesLengthAndNormalizes() {
    FidProcessor processor = new FidProcessor(tone);
    processor.gate(0.4);
    double[] windowed = processor.kaiserWindow(9.5);
    assertEquals("Windowing does not change the gated length", 400, windowed.length);

    double max = 0.0;
    for (double v : processor.getWindowedNormalized()) {
      assertTrue("Normalized values are absolute", v >= 0.0);
      max = Math.max(max, v);
    }
    assertEquals(1.0, max, 1e-12);
  }

  @Test
  public void testWindowGatesFullFidWhenGateWasSkipped() {
    FidProcessor processor = new FidProcessor(tone);
    assertEquals(SAMPLES, processor.kaiserWindow(9.5).length);
  }

  @Test
  public void testZeroPadLengthAndContents() {
    FidProcessor processor = new FidProcessor(tone);
    processor.kaiserWindow(9.5);
    double[] padded = processor.zeroPad(2.0);
    assertEquals("2 us at 1 GSa/s is 2000 points", 2000, padded.length);

    double[] windowed = processor.getWindowed();
    for (int i = 0; i < windowed.length; i++) {
      assertEquals(windowed[i], padded[i], 0.0);
    }
    for (int i = windowed.length; i < padded.length; i++) {
      assertEquals("Padding must be zero", 0.0, padded[i], 0.0);
    }
  }

  @Test
  public void testZeroPadTruncatesLongFid() {
    FidProcessor processor = new FidProcessor(tone);
    assertEquals(500, processor.zeroPad(0.5).length);
  }

  @Test
  public void testRewindowingClearsLaterStages() {
    FidProcessor processor = new FidProcessor(tone);
    processor.zeroPad(2.0);
    processor.kaiserWindow(5.0);
    assertNull("A new window invalidates the padded signal", processor.getZeroPadded());
  }

  @Test
  public void testToneLandsInItsBin() {
    FidProcessor processor = new FidProcessor(tone);
    processor.gate(1.0);
    processor.kaiserWindow(9.5);
    processor.zeroPad(2.0);
    double[][] ft = processor.fft(50.0, 200.0, false);

    assertEquals("Frequency and magnitude columns", 2, ft.length);
    assertEquals("0.5 MHz resolution over [50, 200)", 300, ft[0].length);
    assertEquals(50.0, ft[0][0], 1e-9);

    int best = 0;
    for (int i = 1; i < ft[1].length; i++) {
      if (ft[1][i] > ft[1][best]) {
        best = i;
      }
    }
    assertEquals("Strongest bin is the tone frequency", TONE_MHZ, ft[0][best], 1e-9);
  }

  @Test
  public void testStagedAndQuickTransformsAgree() {
    FidProcessor processor = new FidProcessor(tone);
    processor.gate(0.8);
    processor.kaiserWindow(7.0);
    processor.zeroPad(2.0);
    double[][] staged = processor.fft(50.0, 200.0, false);

    FftParameters params = new FftParameters(0.8, 7.0, 2.0, 50.0, 200.0, false);
    double[][] quick = processor.quickFft(params);

    assertEquals(staged.length, quick.length);
    for (int c = 0; c < staged.length; c++) {
      assertArrayEquals(staged[c], quick[c], 0.0);
    }
  }

  @Test
  public void testFullTransformMagnitudeMatchesRealAndImaginary() {
    FftParameters magnitude = new FftParameters(1.0, 9.5, 2.0, 50.0, 200.0, false);
    FftParameters full = new FftParameters(1.0, 9.5, 2.0, 50.0, 200.0, true);
    double[][] mag = FidProcessor.quickFft(tone, magnitude);
    double[][] complex = FidProcessor.quickFft(tone, full);

    assertEquals(3, complex.length);
    for (int i = 0; i < mag[0].length; i++) {
      assertEquals(mag[1][i], Math.hypot(complex[1][i], complex[2][i]), 1e-12);
    }
  }

  @Test(expected = InvalidParameterException.class)
  public void testInvertedFrequencyWindowIsRejected() {
    new FidProcessor(tone).fft(200.0, 50.0, false);
  }

  @Test
  public void testFrequencyAxisLayout() {
    double[] freqs = FidProcessor.frequencyAxis(4, 4e6);
    assertArrayEquals(new double[] {0.0, 1.0, -2.0, -1.0}, freqs, 1e-12);

    freqs = FidProcessor.frequencyAxis(5, 5e6);
    assertArrayEquals(new double[] {0.0, 1.0, 2.0, -2.0, -1.0}, freqs, 1e-12);
  }
}
