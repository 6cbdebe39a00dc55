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

import org.apache.commons.lang3.tuple.Pair;

import java.util.Collections;
import java.util.List;

/**
 * The lines emitted from one upper state (or one (v, J) pair, for singlet-like grouping) within a window.
 */
public class StateLines {
  private final String stateKey;
  private final double j;
  private final double rotationalEnergy;
  private final int v;
  private final double vibrationalEnergy;
  private final String component;
  // (wavelength, A) of every line from this state.
  private final List<Pair<Double, Double>> lines;

  public StateLines(String stateKey, double j, double rotationalEnergy, int v, double vibrationalEnergy,
                    String component, List<Pair<Double, Double>> lines) {
    this.stateKey = stateKey;
    this.j = j;
    this.rotationalEnergy = rotationalEnergy;
    this.v = v;
    this.vibrationalEnergy = vibrationalEnergy;
    this.component = component;
    this.lines = Collections.unmodifiableList(lines);
  }

  public String getStateKey() {
    return stateKey;
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

  /**
   * @return The fine-structure component, or null for singlet-like groups.
   */
  public String getComponent() {
    return component;
  }

  public List<Pair<Double, Double>> getLines() {
    return lines;
  }

  public int getNumLines() {
    return lines.size();
  }
}
