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
 * Physical constants used for Boltzmann population of emitting states.  All values are computed once, from the
 * exact CODATA 2018 SI definitions.
 */
public final class PhysicalConstants {
  public static final double BOLTZMANN_J_PER_K = 1.380649e-23;
  public static final double PLANCK_J_S = 6.62607015e-34;
  public static final double SPEED_OF_LIGHT_M_PER_S = 299792458.0;

  /**
   * Boltzmann constant in inverse centimeters per kelvin, the unit of the tabulated state energies.
   */
  public static final double BOLTZMANN_WAVENUMBER =
      BOLTZMANN_J_PER_K / (PLANCK_J_S * SPEED_OF_LIGHT_M_PER_S) / 100.0;

  private PhysicalConstants() {
  }
}
