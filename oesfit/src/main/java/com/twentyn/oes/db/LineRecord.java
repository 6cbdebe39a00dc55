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
 * One transition joined with its upper state.
 */
public class LineRecord {
  private final double airWavelength;
  private final double vacuumWavelength;
  private final double emissionCoefficient;
  private final double wavenumber;
  private final UpperState upperState;

  public LineRecord(double airWavelength, double vacuumWavelength, double emissionCoefficient, double wavenumber,
                    UpperState upperState) {
    this.airWavelength = airWavelength;
    this.vacuumWavelength = vacuumWavelength;
    this.emissionCoefficient = emissionCoefficient;
    this.wavenumber = wavenumber;
    this.upperState = upperState;
  }

  public double getAirWavelength() {
    return airWavelength;
  }

  public double getVacuumWavelength() {
    return vacuumWavelength;
  }

  public double getWavelength(WavelengthMedium medium) {
    return medium == WavelengthMedium.VACUUM ? vacuumWavelength : airWavelength;
  }

  /**
   * @return The Einstein coefficient A of the transition.
   */
  public double getEmissionCoefficient() {
    return emissionCoefficient;
  }

  public double getWavenumber() {
    return wavenumber;
  }

  public UpperState getUpperState() {
    return upperState;
  }
}
