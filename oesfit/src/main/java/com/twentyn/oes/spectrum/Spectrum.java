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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * An x axis (wavelengths, or wavenumbers if you prefer) and a signal on it.  Simulated spectra start out as an
 * unsorted scatter of lines and are turned into a uniform, broadened signal by {@link #refineMesh(int)} and
 * {@link #convolveWithSlitFunction(double, double, Double)}, both of which modify the instance in place.
 */
public class Spectrum {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Spectrum.class);

  // Lines are padded by this many nm on each side of the refined mesh so they never fall onto its edges.
  public static final double MESH_PADDING = 2.0;
  // Fraction of the kernel peak below which the convolution kernel tails are dropped.
  public static final double KERNEL_CUTOFF = 1.0 / 1000.0;
  // Written over the whole signal when the convolution destroys it, steering the optimizer away.
  public static final double DEGENERATE_SIGNAL = 1e100;

  public static final double DEFAULT_GAUSS_HWHM = 0.1;
  public static final double DEFAULT_LORENTZ_HWHM = 1e-9;

  private double[] x;
  private double[] y;
  private final Double maximum;

  public Spectrum(double[] x, double[] y, boolean normalize) {
    if (x.length != y.length) {
      throw new AxisMismatchException(
          String.format("Spectrum: length of x (%d) and y (%d) mismatch", x.length, y.length));
    }
    this.x = x;
    this.y = normalize ? y.clone() : y;
    this.maximum = y.length > 0 ? StatUtils.max(y) : null;
    if (normalize && maximum != null) {
      for (int i = 0; i < this.y.length; i++) {
        this.y[i] /= maximum;
      }
    }
  }

  public Spectrum(double[] x, double[] y) {
    this(x, y, false);
  }

  public Spectrum() {
    this(new double[0], new double[0]);
  }

  public static Spectrum copyOf(Spectrum other) {
    return new Spectrum(Arrays.copyOf(other.x, other.x.length), Arrays.copyOf(other.y, other.y.length));
  }

  public double[] getX() {
    return x;
  }

  public double[] getY() {
    return y;
  }

  /**
   * @return The maximum of y at construction time, or null for an empty spectrum.
   */
  public Double getMaximum() {
    return maximum;
  }

  public int size() {
    return x.length;
  }

  public boolean isEmpty() {
    return x.length == 0;
  }

  public double minX() {
    return StatUtils.min(x);
  }

  public double maxX() {
    return StatUtils.max(x);
  }

  /**
   * Puts the discrete lines onto a uniform grid of the given density, adding artificial zeros in between.  Lines
   * that land in the same bin are summed.  Simulated spectra need this before they can be convolved, since the
   * convolution assumes a fixed sample spacing.
   *
   * @param pointsPerNm Grid density.
   * @return The new grid as rows of {x, y}.
   */
  public double[][] refineMesh(int pointsPerNm) {
    if (isEmpty()) {
      return new double[0][2];
    }

    double start = minX() - MESH_PADDING;
    double end = maxX() + MESH_PADDING;
    int numPoints = (int) (Math.abs(end - start) * pointsPerNm);

    double[][] mesh = new double[numPoints][2];
    double[] newX = new double[numPoints];
    double[] newY = new double[numPoints];
    for (int i = 0; i < numPoints; i++) {
      newX[i] = start + (double) i / pointsPerNm;
    }

    int dropped = 0;
    for (int i = 0; i < x.length; i++) {
      int index = (int) ((x[i] - start) * pointsPerNm + 0.5);
      if (index < 0 || index >= numPoints) {
        dropped++;
        continue;
      }
      newY[index] += y[i];
    }
    if (dropped > 0) {
      LOGGER.debug("refineMesh dropped %d lines falling outside of [%f, %f]", dropped, start, end);
    }

    for (int i = 0; i < numPoints; i++) {
      mesh[i][0] = newX[i];
      mesh[i][1] = newY[i];
    }
    this.x = newX;
    this.y = newY;
    return mesh;
  }

  /**
   * Broadens the lines by the instrumental slit function: a Voigt profile, optionally convolved with a rectangle
   * as wide as one instrumental pixel so lines narrower than a pixel are not lost.
   *
   * @param gauss Gaussian HWHM of the slit function.
   * @param lorentz Lorentzian HWHM of the slit function.
   * @param step Distance between the instrument's pixels, or null to skip the pixel rectangle.
   */
  public void convolveWithSlitFunction(double gauss, double lorentz, Double step) {
    LOGGER.debug("convolve_with_slit_function: gauss = %s, lorentz = %s, step = %s", gauss, lorentz, step);
    int numPoints = y.length;
    if (numPoints == 0) {
      return;
    }

    double[] slit = VoigtProfile.evaluate(x, gauss, lorentz, StatUtils.mean(x), 1.0);
    double slitSum = 0.0;
    for (double v : slit) {
      slitSum += v;
    }
    for (int i = 0; i < slit.length; i++) {
      slit[i] /= slitSum;
    }

    double[] profile;
    if (step == null || numPoints < 2) {
      profile = truncateKernel(slit);
    } else {
      double simulatedStep = x[1] - x[0];
      if (step / simulatedStep < 1) {
        LOGGER.warn("Simulated spectrum resolution (%f) is rougher than the measured data (%f)", simulatedStep, step);
        profile = truncateKernel(slit);
      } else {
        double[] pixel = new double[(int) (step / simulatedStep) + 1];
        Arrays.fill(pixel, 1.0);
        double[] uncut = slit.length >= pixel.length ?
            Convolution.convolveSame(slit, pixel) : Convolution.convolveSame(pixel, slit);
        profile = truncateKernel(uncut);
      }
    }

    double[] convolved = Convolution.convolveSame(y, profile);
    if (convolved.length == 0) {
      LOGGER.warn("Convolution destroyed the spectrum, substituting %e", DEGENERATE_SIGNAL);
      convolved = new double[numPoints];
      Arrays.fill(convolved, DEGENERATE_SIGNAL);
    } else if (containsNaN(convolved)) {
      LOGGER.warn("Convolution produced NaN, substituting %e", DEGENERATE_SIGNAL);
      Arrays.fill(convolved, DEGENERATE_SIGNAL);
    }
    this.y = convolved;
  }

  public void convolveWithSlitFunction() {
    convolveWithSlitFunction(DEFAULT_GAUSS_HWHM, DEFAULT_LORENTZ_HWHM, null);
  }

  static double[] truncateKernel(double[] kernel) {
    double peak = Double.NEGATIVE_INFINITY;
    for (double v : kernel) {
      peak = Math.max(peak, v);
    }
    double threshold = peak * KERNEL_CUTOFF;
    // Comparisons against NaN are false, so a NaN kernel comes out empty.
    return Arrays.stream(kernel).filter(v -> v > threshold).toArray();
  }

  private static boolean containsNaN(double[] values) {
    for (double v : values) {
      if (Double.isNaN(v)) {
        return true;
      }
    }
    return false;
  }
}
