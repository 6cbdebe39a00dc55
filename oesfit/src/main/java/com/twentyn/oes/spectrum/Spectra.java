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

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.util.MathArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/**
 * Operations on pairs of spectra defined on different grids.
 */
public class Spectra {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Spectra.class);

  // Distance from the simulated range at which zero padding is placed.
  public static final double PADDING_OFFSET = 1e-3;

  private Spectra() {
  }

  /**
   * Resamples a simulated spectrum onto the x axis of an experimental one.  Where the experimental range extends
   * beyond the simulation, the simulation is padded with zeros (no signal outside the simulated region) rather than
   * extrapolated.  Neither input is modified.
   *
   * @param sim The simulated spectrum.
   * @param exp The experimental spectrum.
   * @return (simulation on exp's grid, exp).
   */
  public static Pair<Spectrum, Spectrum> matchSpectra(Spectrum sim, Spectrum exp) {
    double[] expX = exp.getX();
    if (sim.isEmpty()) {
      return Pair.of(new Spectrum(Arrays.copyOf(expX, expX.length), new double[expX.length]), exp);
    }
    if (exp.isEmpty()) {
      return Pair.of(new Spectrum(), exp);
    }

    double[] simX = sim.getX();
    double[] simY = sim.getY();
    double simMin = sim.minX();
    double simMax = sim.maxX();
    double expMin = exp.minX();
    double expMax = exp.maxX();
    // A single point cannot be interpolated on, so it is always surrounded by zeros.
    boolean padAlways = simX.length < 2;

    double[] head = new double[0];
    if (padAlways || expMin < simMin) {
      double pad = simMin - PADDING_OFFSET;
      head = expMin < pad ? new double[]{expMin, pad} : new double[]{pad};
    }
    double[] tail = new double[0];
    if (padAlways || expMax > simMax) {
      double pad = simMax + PADDING_OFFSET;
      tail = expMax > pad ? new double[]{pad, expMax} : new double[]{pad};
    }

    double[] paddedX = new double[head.length + simX.length + tail.length];
    double[] paddedY = new double[paddedX.length];
    System.arraycopy(head, 0, paddedX, 0, head.length);
    System.arraycopy(simX, 0, paddedX, head.length, simX.length);
    System.arraycopy(simY, 0, paddedY, head.length, simY.length);
    System.arraycopy(tail, 0, paddedX, head.length + simX.length, tail.length);

    PolynomialSplineFunction interpolation = new LinearInterpolator().interpolate(paddedX, paddedY);
    double[] knots = interpolation.getKnots();
    double lastKnot = knots[knots.length - 1];
    double[] interpolated = new double[expX.length];
    for (int i = 0; i < expX.length; i++) {
      // Guard against the last knot being off by an ulp from the experimental maximum.
      interpolated[i] = interpolation.value(Math.min(Math.max(expX[i], knots[0]), lastKnot));
    }
    return Pair.of(new Spectrum(Arrays.copyOf(expX, expX.length), interpolated), exp);
  }

  /**
   * @return The residuals simulated - measured on the measured grid.
   */
  public static double[] compare(Spectrum measured, Spectrum simulated) {
    Pair<Spectrum, Spectrum> matched = matchSpectra(simulated, measured);
    double[] difference = MathArrays.ebeSubtract(matched.getLeft().getY(), matched.getRight().getY());
    LOGGER.debug("len(dif) = %d", difference.length);
    return difference;
  }

  /**
   * Residuals weighted by the measured intensity at each position.
   */
  public static double[] compareWeighted(Spectrum measured, Spectrum simulated) {
    return MathArrays.ebeMultiply(compare(measured, simulated), measured.getY());
  }

  /**
   * Sum of squared residuals divided by the squared number of points, useful if the length of the measurement
   * varies during the minimization.
   */
  public static double reducedSumOfSquares(Spectrum measured, Spectrum simulated) {
    double[] difference = compare(measured, simulated);
    double result = 0.0;
    for (double d : difference) {
      result += d * d;
    }
    result /= (double) difference.length * difference.length;
    if (Double.isNaN(result)) {
      result = Spectrum.DEGENERATE_SIGNAL;
    }
    LOGGER.debug("sumsq = %.8e", result);
    return result;
  }

  /**
   * Linear combination of spectra sharing the x axis of the first one.
   */
  public static Spectrum add(List<Spectrum> spectra, List<Double> amplitudes) {
    if (spectra.isEmpty()) {
      return new Spectrum();
    }
    if (spectra.size() != amplitudes.size()) {
      throw new IllegalArgumentException(String.format(
          "Got %d spectra but %d amplitudes", spectra.size(), amplitudes.size()));
    }
    double[] x = spectra.get(0).getX();
    double[] y = new double[x.length];
    for (int i = 0; i < spectra.size(); i++) {
      double[] component = spectra.get(i).getY();
      if (component.length != y.length) {
        throw new AxisMismatchException(String.format(
            "Spectrum %d has %d points, expected %d", i, component.length, y.length));
      }
      double amplitude = amplitudes.get(i);
      for (int j = 0; j < y.length; j++) {
        y[j] += amplitude * component[j];
      }
    }
    return new Spectrum(Arrays.copyOf(x, x.length), y);
  }
}
