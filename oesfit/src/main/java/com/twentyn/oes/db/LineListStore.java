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

import java.util.List;

/**
 * Read-only access to one species' line list: a table of distinct upper states and a table of transitions that
 * reference them.
 */
public interface LineListStore extends AutoCloseable {

  /**
   * @return Every distinct upper state, used for the partition function.
   */
  List<UpperState> fetchUpperStates();

  /**
   * Get the transitions joined with their upper states, ordered by wavelength in the given medium.
   * @param wmin Lower wavelength bound, or null for no bound.
   * @param wmax Upper wavelength bound, or null for no bound.
   * @param medium Medium whose wavelength column is filtered and ordered on.
   */
  List<LineRecord> fetchLines(Double wmin, Double wmax, WavelengthMedium medium);

  /**
   * Get the transitions in [wmin, wmax] with the full description of their upper states.
   * @param maxJ Only states with J <= maxJ, or null for all.
   * @param maxV Only states with v <= maxV, or null for all.
   */
  List<StateLine> fetchStateLines(double wmin, double wmax, WavelengthMedium medium, Integer maxJ, Integer maxV);

  @Override
  void close();
}
