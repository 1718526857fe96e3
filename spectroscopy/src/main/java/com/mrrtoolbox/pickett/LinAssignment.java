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

/**
 * One assigned line for SPFIT: upper and lower state quantum numbers, observed frequency, expected error and blend
 * weight.
 */
public class LinAssignment {
  public static final Double DEFAULT_ERROR = 0.040;
  public static final Double DEFAULT_WEIGHT = 1.0e-4;

  // J1 Ka1 Kc1 J0 Ka0 Kc0 QN1_1 QN2_1 QN3_1 QN1_0 QN2_0 QN3_0, in file column order.
  private final int[] quantumNumbers;
  private final Double freq;
  private final Double err;
  private final Double wt;

  public LinAssignment(int[] quantumNumbers, Double freq, Double err, Double wt) {
    if (quantumNumbers.length != LinFile.QUANTUM_NUMBER_COLUMNS) {
      throw new InvalidParameterException(String.format("Expected %d quantum numbers, got %d",
          LinFile.QUANTUM_NUMBER_COLUMNS, quantumNumbers.length));
    }
    this.quantumNumbers = quantumNumbers.clone();
    this.freq = freq;
    this.err = err;
    this.wt = wt;
  }

  /**
   * An assignment with only J, Ka and Kc, default error and weight.
   */
  public LinAssignment(Double freq, int j1, int ka1, int kc1, int j0, int ka0, int kc0) {
    this(new int[] {j1, ka1, kc1, j0, ka0, kc0, 0, 0, 0, 0, 0, 0}, freq, DEFAULT_ERROR, DEFAULT_WEIGHT);
  }

  public LinAssignment withFrequency(Double newFreq) {
    return new LinAssignment(quantumNumbers, newFreq, err, wt);
  }

  public int[] getQuantumNumbers() {
    return quantumNumbers.clone();
  }

  public int getJ1() {
    return quantumNumbers[0];
  }

  public int getKa1() {
    return quantumNumbers[1];
  }

  public int getKc1() {
    return quantumNumbers[2];
  }

  public int getJ0() {
    return quantumNumbers[3];
  }

  public int getKa0() {
    return quantumNumbers[4];
  }

  public int getKc0() {
    return quantumNumbers[5];
  }

  public Double getFreq() {
    return freq;
  }

  public Double getErr() {
    return err;
  }

  public Double getWt() {
    return wt;
  }
}
