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

/**
 * Parameters of one species attached to a spectrum.
 */
public enum SpeciesParameter {
  TROT("Trot", 1e3, 300.0, 10000.0),
  TVIB("Tvib", 1e3, 300.0, 10000.0),
  INTENSITY("intensity", 1.0, 0.0, null),
  ;

  private final String suffix;
  private final double defaultValue;
  private final Double min;
  private final Double max;

  SpeciesParameter(String suffix, double defaultValue, Double min, Double max) {
    this.suffix = suffix;
    this.defaultValue = defaultValue;
    this.min = min;
    this.max = max;
  }

  public String getSuffix() {
    return suffix;
  }

  public double getDefaultValue() {
    return defaultValue;
  }

  public Double getMin() {
    return min;
  }

  public Double getMax() {
    return max;
  }

  /**
   * @return The flat, optimizer-visible name of this parameter for the given species, e.g. OH_Trot.
   */
  public String parameterName(String species) {
    return species + "_" + suffix;
  }

  BoundedParameter create(String species, double value) {
    return new BoundedParameter(parameterName(species), value, min, max, true);
  }
}
