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

package com.twentyn.oes.params;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named value with optional bounds, a flag telling whether the optimizer may change it and, after a fit, its
 * standard error.  Values are always clamped to the bounds.
 */
public class BoundedParameter {
  @JsonProperty("name")
  private String name;

  @JsonProperty("value")
  private double value;

  // null means unbounded.
  @JsonProperty("min")
  private Double min;

  @JsonProperty("max")
  private Double max;

  @JsonProperty("vary")
  private boolean vary;

  @JsonProperty("stderr")
  private Double stderr;

  private BoundedParameter() {
  }

  public BoundedParameter(String name, double value, Double min, Double max, boolean vary) {
    if (min != null && max != null && min > max) {
      throw new IllegalArgumentException(String.format("Parameter %s: min %f > max %f", name, min, max));
    }
    this.name = name;
    this.min = min;
    this.max = max;
    this.vary = vary;
    setValue(value);
  }

  public BoundedParameter(BoundedParameter other) {
    this.name = other.name;
    this.value = other.value;
    this.min = other.min;
    this.max = other.max;
    this.vary = other.vary;
    this.stderr = other.stderr;
  }

  public String getName() {
    return name;
  }

  public double getValue() {
    return value;
  }

  public void setValue(double value) {
    if (min != null && value < min) {
      value = min;
    }
    if (max != null && value > max) {
      value = max;
    }
    this.value = value;
  }

  public double getMin() {
    return min == null ? Double.NEGATIVE_INFINITY : min;
  }

  public double getMax() {
    return max == null ? Double.POSITIVE_INFINITY : max;
  }

  /**
   * Changes the bounds and re-clamps the current value.  Infinite bounds mean unbounded.
   */
  public void setBounds(double newMin, double newMax) {
    if (newMin > newMax) {
      throw new IllegalArgumentException(String.format("Parameter %s: min %f > max %f", name, newMin, newMax));
    }
    this.min = Double.isInfinite(newMin) ? null : newMin;
    this.max = Double.isInfinite(newMax) ? null : newMax;
    setValue(value);
  }

  public boolean isVary() {
    return vary;
  }

  public void setVary(boolean vary) {
    this.vary = vary;
  }

  /**
   * @return The standard error of the last fit that supplied one, or null.
   */
  public Double getStderr() {
    return stderr;
  }

  public void setStderr(Double stderr) {
    this.stderr = stderr;
  }

  @Override
  public String toString() {
    return String.format("<Parameter '%s', value=%s, bounds=[%s:%s]%s%s>", name, value, getMin(), getMax(),
        vary ? "" : " (fixed)", stderr == null ? "" : String.format(", stderr=%s", stderr));
  }
}
