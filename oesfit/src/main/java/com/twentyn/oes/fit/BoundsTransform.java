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

import org.apache.commons.math3.util.FastMath;

/**
 * Maps a bounded parameter onto an unbounded internal coordinate so unconstrained optimizers can be used, following
 * the transformation of MINUIT: arcsine for two-sided bounds, a square-root hyperbola for one-sided ones.
 */
public class BoundsTransform {
  private final double min;
  private final double max;

  public BoundsTransform(double min, double max) {
    if (min > max) {
      throw new IllegalArgumentException(String.format("Lower bound %f exceeds upper bound %f", min, max));
    }
    this.min = min;
    this.max = max;
  }

  private boolean hasMin() {
    return !Double.isInfinite(min);
  }

  private boolean hasMax() {
    return !Double.isInfinite(max);
  }

  public double toInternal(double external) {
    if (hasMin() && hasMax()) {
      double scaled = 2.0 * (external - min) / (max - min) - 1.0;
      return FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, scaled)));
    }
    if (hasMin()) {
      double shifted = FastMath.max(external, min) - min + 1.0;
      return FastMath.sqrt(shifted * shifted - 1.0);
    }
    if (hasMax()) {
      double shifted = max - FastMath.min(external, max) + 1.0;
      return FastMath.sqrt(shifted * shifted - 1.0);
    }
    return external;
  }

  public double toExternal(double internal) {
    if (hasMin() && hasMax()) {
      return min + (FastMath.sin(internal) + 1.0) * (max - min) / 2.0;
    }
    if (hasMin()) {
      return min - 1.0 + FastMath.sqrt(internal * internal + 1.0);
    }
    if (hasMax()) {
      return max + 1.0 - FastMath.sqrt(internal * internal + 1.0);
    }
    return internal;
  }

  /**
   * @return d(external)/d(internal), used to carry standard errors back to the external coordinate.
   */
  public double gradient(double internal) {
    if (hasMin() && hasMax()) {
      return FastMath.cos(internal) * (max - min) / 2.0;
    }
    if (hasMin()) {
      return internal / FastMath.sqrt(internal * internal + 1.0);
    }
    if (hasMax()) {
      return -internal / FastMath.sqrt(internal * internal + 1.0);
    }
    return 1.0;
  }

  public static double[] toInternal(BoundsTransform[] transforms, double[] external) {
    double[] internal = new double[external.length];
    for (int i = 0; i < external.length; i++) {
      internal[i] = transforms[i].toInternal(external[i]);
    }
    return internal;
  }

  public static double[] toExternal(BoundsTransform[] transforms, double[] internal) {
    double[] external = new double[internal.length];
    for (int i = 0; i < internal.length; i++) {
      external[i] = transforms[i].toExternal(internal[i]);
    }
    return external;
  }
}
