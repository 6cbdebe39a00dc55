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

package com.twentyn.oes.db;

/**
 * A transition together with the full description of its upper state, as needed for grouping lines by the state
 * they are emitted from.
 */
public class StateLine {
  private final long lineId;
  private final double wavelength;
  private final double emissionCoefficient;
  private final double wavenumber;
  private final long upperStateId;
  private final Long lowerStateId;
  private final String branch;
  private final double j;
  private final double rotationalEnergy;
  private final int v;
  private final double vibrationalEnergy;
  private final String component;

  public StateLine(long lineId, double wavelength, double emissionCoefficient, double wavenumber,
                   long upperStateId, Long lowerStateId, String branch,
                   double j, double rotationalEnergy, int v, double vibrationalEnergy, String component) {
    this.lineId = lineId;
    this.wavelength = wavelength;
    this.emissionCoefficient = emissionCoefficient;
    this.wavenumber = wavenumber;
    this.upperStateId = upperStateId;
    this.lowerStateId = lowerStateId;
    this.branch = branch;
    this.j = j;
    this.rotationalEnergy = rotationalEnergy;
    this.v = v;
    this.vibrationalEnergy = vibrationalEnergy;
    this.component = component;
  }

  public long getLineId() {
    return lineId;
  }

  public double getWavelength() {
    return wavelength;
  }

  public double getEmissionCoefficient() {
    return emissionCoefficient;
  }

  public double getWavenumber() {
    return wavenumber;
  }

  public long getUpperStateId() {
    return upperStateId;
  }

  public Long getLowerStateId() {
    return lowerStateId;
  }

  public String getBranch() {
    return branch;
  }

  public double getJ() {
    return j;
  }

  public double getRotationalEnergy() {
    return rotationalEnergy;
  }

  public int getV() {
    return v;
  }

  public double getVibrationalEnergy() {
    return vibrationalEnergy;
  }

  public String getComponent() {
    return component;
  }
}
