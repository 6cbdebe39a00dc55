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
 * A distinct upper quantum state: rotational quantum number and the rotational and vibrational energies in cm^-1.
 */
public class UpperState {
  private final double j;
  private final double rotationalEnergy;
  private final double vibrationalEnergy;

  public UpperState(double j, double rotationalEnergy, double vibrationalEnergy) {
    this.j = j;
    this.rotationalEnergy = rotationalEnergy;
    this.vibrationalEnergy = vibrationalEnergy;
  }

  public double getJ() {
    return j;
  }

  public double getRotationalEnergy() {
    return rotationalEnergy;
  }

  public double getVibrationalEnergy() {
    return vibrationalEnergy;
  }

  /**
   * Unnormalized Boltzmann weight (2J+1) exp(-E_J / kTrot - E_v / kTvib).
   */
  public double boltzmannWeight(double trot, double tvib) {
    return (2 * j + 1) * Math.exp(
        -rotationalEnergy / (PhysicalConstants.BOLTZMANN_WAVENUMBER * trot)
            - vibrationalEnergy / (PhysicalConstants.BOLTZMANN_WAVENUMBER * tvib));
  }
}
