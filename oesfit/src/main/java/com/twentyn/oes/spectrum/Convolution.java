/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
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

package com.twentyn.oes.spectrum;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * FFT based linear convolution.
 */
public class Convolution {
  private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

  private Convolution() {
  }

  /**
   * Full linear convolution of two sequences, of length a.length + b.length - 1.
   */
  public static double[] convolveFull(double[] a, double[] b) {
    if (a.length == 0 || b.length == 0) {
      return new double[0];
    }
    int fullLength = a.length + b.length - 1;
    // The transformer only accepts power of two lengths.
    int paddedLength = Integer.highestOneBit(fullLength);
    if (paddedLength < fullLength) {
      paddedLength <<= 1;
    }

    Complex[] fa = FFT.transform(pad(a, paddedLength), TransformType.FORWARD);
    Complex[] fb = FFT.transform(pad(b, paddedLength), TransformType.FORWARD);
    Complex[] product = new Complex[paddedLength];
    for (int i = 0; i < paddedLength; i++) {
      product[i] = fa[i].multiply(fb[i]);
    }
    Complex[] inverse = FFT.transform(product, TransformType.INVERSE);

    double[] result = new double[fullLength];
    for (int i = 0; i < fullLength; i++) {
      result[i] = inverse[i].getReal();
    }
    return result;
  }

  /**
   * Linear convolution cut to the length of the first argument and centered with respect to the full result,
   * starting (kernel.length - 1) / 2 samples into it.
   */
  public static double[] convolveSame(double[] signal, double[] kernel) {
    double[] full = convolveFull(signal, kernel);
    if (full.length == 0) {
      return full;
    }
    int start = (kernel.length - 1) / 2;
    double[] result = new double[signal.length];
    System.arraycopy(full, start, result, 0, signal.length);
    return result;
  }

  private static double[] pad(double[] values, int length) {
    double[] padded = new double[length];
    System.arraycopy(values, 0, padded, 0, values.length);
    return padded;
  }
}
