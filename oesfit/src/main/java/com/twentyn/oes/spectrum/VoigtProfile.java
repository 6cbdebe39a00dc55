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
import org.apache.commons.math3.util.FastMath;

/**
 * The Voigt line shape (a Gaussian convolved with a Lorentzian) in terms of its physical parameters.
 *
 * The Voigt function is the real part of the Faddeeva function w(z) = exp(-z^2) erfc(-iz), evaluated here with
 * Humlicek's W4 rational approximation (J. Quant. Spectrosc. Radiat. Transfer 27, 437 (1982)), which is accurate to
 * about 1e-4 relative error over the whole upper half plane.
 */
public class VoigtProfile {
  // Widths are clamped to this value to avoid division by zero.
  public static final double MIN_WIDTH = 1e-10;

  private static final double SQRT_LN2 = FastMath.sqrt(FastMath.log(2.0));
  private static final double SQRT_PI = FastMath.sqrt(FastMath.PI);

  private VoigtProfile() {
  }

  /**
   * @param nu Axis (light frequency, wavenumber or wavelength).
   * @param alphaD Doppler (Gaussian) HWHM.
   * @param alphaL Lorentzian HWHM.
   * @param nu0 Center of the line.
   * @param area Integral under the line.
   * @param a Constant background.
   * @param b Slope of the linear background, bg = a + b * nu.
   * @return The profile sampled on nu.
   */
  public static double[] evaluate(double[] nu, double alphaD, double alphaL, double nu0, double area,
                                  double a, double b) {
    if (alphaD == 0.0) {
      alphaD = MIN_WIDTH;
    }
    if (alphaL == 0.0) {
      alphaL = MIN_WIDTH;
    }
    double yy = alphaL / alphaD * SQRT_LN2;
    double scale = area * SQRT_LN2 / (alphaD * SQRT_PI);

    double[] result = new double[nu.length];
    for (int i = 0; i < nu.length; i++) {
      double xx = (nu[i] - nu0) / alphaD * SQRT_LN2;
      result[i] = scale * voigt(xx, yy) + a + b * nu[i];
    }
    return result;
  }

  public static double[] evaluate(double[] nu, double alphaD, double alphaL, double nu0, double area) {
    return evaluate(nu, alphaD, alphaL, nu0, area, 0.0, 0.0);
  }

  /**
   * Re[w(x + iy)].
   */
  public static double voigt(double x, double y) {
    return faddeeva(x, y).getReal();
  }

  /**
   * The Faddeeva function w(x + iy) for y >= 0.
   */
  public static Complex faddeeva(double x, double y) {
    // Humlicek works with t = y - ix, i.e. -iz.
    Complex t = new Complex(y, -x);
    double s = FastMath.abs(x) + y;

    if (s >= 15.0) {
      // Region I
      return t.multiply(0.5641896).divide(t.multiply(t).add(0.5));
    }

    if (s >= 5.5) {
      // Region II
      Complex u = t.multiply(t);
      return t.multiply(u.multiply(0.5641896).add(1.410474))
          .divide(u.multiply(u.add(3.0)).add(0.75));
    }

    if (y >= 0.195 * FastMath.abs(x) - 0.176) {
      // Region III
      Complex numerator = t.multiply(0.5642236).add(3.778987)
          .multiply(t).add(11.96482)
          .multiply(t).add(20.20933)
          .multiply(t).add(16.4955);
      Complex denominator = t.add(6.699398)
          .multiply(t).add(21.69274)
          .multiply(t).add(39.27121)
          .multiply(t).add(38.82363)
          .multiply(t).add(16.4955);
      return numerator.divide(denominator);
    }

    // Region IV
    Complex u = t.multiply(t);
    Complex numerator = u.multiply(-0.56419).add(1.320522)
        .multiply(u).negate().add(35.76683)
        .multiply(u).negate().add(219.0313)
        .multiply(u).negate().add(1540.787)
        .multiply(u).negate().add(3321.9905)
        .multiply(u).negate().add(36183.31);
    Complex denominator = u.negate().add(1.841439)
        .multiply(u).negate().add(61.57037)
        .multiply(u).negate().add(364.2191)
        .multiply(u).negate().add(2186.181)
        .multiply(u).negate().add(9022.228)
        .multiply(u).negate().add(24322.84)
        .multiply(u).negate().add(32066.6);
    return u.exp().subtract(t.multiply(numerator).divide(denominator));
  }
}
