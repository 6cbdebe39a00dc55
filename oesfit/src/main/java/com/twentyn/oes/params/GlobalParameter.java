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
 * Parameters every measured spectrum carries, independent of the species attached to it.
 */
public enum GlobalParameter {
  // Offset of the wavelength axis in nm.
  WAV_SHIFT("wav_shift", 0.0, null, null, true),
  // Mean step of the wavelength axis; the instrumental pixel width.  Set from the data, not fitted.
  WAV_STEP("wav_step", 1e-2, null, null, false),
  // Gaussian HWHM of the slit function.
  SLITF_GAUSS("slitf_gauss", 1e-9, 0.0, null, true),
  // Lorentzian HWHM of the slit function.
  SLITF_LORENTZ("slitf_lorentz", 1e-9, 0.0, null, true),
  // Constant offset of the spectrum from zero.
  BASELINE("baseline", 0.0, null, null, true),
  // Accounts for a non-constant baseline on some older spectrometers.
  BASELINE_SLOPE("baseline_slope", 0.0, null, null, true),
  ;

  private final String parameterName;
  private final double defaultValue;
  private final Double min;
  private final Double max;
  private final boolean varyByDefault;

  GlobalParameter(String parameterName, double defaultValue, Double min, Double max, boolean varyByDefault) {
    this.parameterName = parameterName;
    this.defaultValue = defaultValue;
    this.min = min;
    this.max = max;
    this.varyByDefault = varyByDefault;
  }

  public String getParameterName() {
    return parameterName;
  }

  public double getDefaultValue() {
    return defaultValue;
  }

  BoundedParameter create(double value) {
    return new BoundedParameter(parameterName, value, min, max, varyByDefault);
  }

  public static GlobalParameter fromParameterName(String name) {
    for (GlobalParameter p : values()) {
      if (p.parameterName.equals(name)) {
        return p;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return parameterName;
  }
}
