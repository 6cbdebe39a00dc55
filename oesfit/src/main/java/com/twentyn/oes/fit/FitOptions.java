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

package com.twentyn.oes.fit;

import com.twentyn.oes.synth.SpectrumSynthesizer;

/**
 * Settings of one call to {@link FitSession#fit(String, FitOptions)}.  Instances are immutable; the with* methods
 * return modified copies.
 */
public class FitOptions {
  public static final int DEFAULT_MAX_ITERATIONS = 2000;
  public static final double DEFAULT_XTOL = 1e-4;

  public static final FitOptions DEFAULT = new FitOptions();

  private final FitMethod method;
  private final int maxIterations;
  private final double xtol;
  private final int pointsPerNm;
  private final boolean weighted;

  public FitOptions(FitMethod method, int maxIterations, double xtol, int pointsPerNm, boolean weighted) {
    if (maxIterations < 1) {
      throw new IllegalArgumentException(String.format("maxIterations must be positive, got %d", maxIterations));
    }
    if (pointsPerNm < 1) {
      throw new IllegalArgumentException(String.format("pointsPerNm must be positive, got %d", pointsPerNm));
    }
    this.method = method;
    this.maxIterations = maxIterations;
    this.xtol = xtol;
    this.pointsPerNm = pointsPerNm;
    this.weighted = weighted;
  }

  public FitOptions() {
    this(FitMethod.LEASTSQ, DEFAULT_MAX_ITERATIONS, DEFAULT_XTOL, SpectrumSynthesizer.DEFAULT_POINTS_PER_NM, false);
  }

  public FitMethod getMethod() {
    return method;
  }

  /**
   * @return The cap on residual evaluations for every method, the finite-difference Jacobian columns of LEASTSQ
   * included.
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  /**
   * @return Absolute parameter tolerance of the scalar methods, in the optimizer's internal coordinates.
   */
  public double getXtol() {
    return xtol;
  }

  public int getPointsPerNm() {
    return pointsPerNm;
  }

  public boolean isWeighted() {
    return weighted;
  }

  public FitOptions withMethod(FitMethod newMethod) {
    return new FitOptions(newMethod, maxIterations, xtol, pointsPerNm, weighted);
  }

  public FitOptions withMaxIterations(int newMaxIterations) {
    return new FitOptions(method, newMaxIterations, xtol, pointsPerNm, weighted);
  }

  public FitOptions withXtol(double newXtol) {
    return new FitOptions(method, maxIterations, newXtol, pointsPerNm, weighted);
  }

  public FitOptions withPointsPerNm(int newPointsPerNm) {
    return new FitOptions(method, maxIterations, xtol, newPointsPerNm, weighted);
  }

  public FitOptions withWeighted(boolean newWeighted) {
    return new FitOptions(method, maxIterations, xtol, pointsPerNm, newWeighted);
  }

  @Override
  public String toString() {
    return String.format("FitOptions{method=%s, maxIterations=%d, xtol=%s, pointsPerNm=%d, weighted=%s}",
        method, maxIterations, xtol, pointsPerNm, weighted);
  }
}
