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
 * Options for {@link LineDatabase#getLinesByStates(double, double, LinesByStateRequest)}.
 */
public class LinesByStateRequest {
  private int minLines = 1;
  private WavelengthMedium medium = WavelengthMedium.AIR;
  private Integer maxJ = null;
  private Integer maxV = null;
  private boolean singletLike = false;

  public int getMinLines() {
    return minLines;
  }

  /**
   * Only report states emitting at least this many lines in the window.
   */
  public LinesByStateRequest setMinLines(int minLines) {
    this.minLines = minLines;
    return this;
  }

  public WavelengthMedium getMedium() {
    return medium;
  }

  public LinesByStateRequest setMedium(WavelengthMedium medium) {
    this.medium = medium;
    return this;
  }

  public Integer getMaxJ() {
    return maxJ;
  }

  public LinesByStateRequest setMaxJ(Integer maxJ) {
    this.maxJ = maxJ;
    return this;
  }

  public Integer getMaxV() {
    return maxV;
  }

  public LinesByStateRequest setMaxV(Integer maxV) {
    this.maxV = maxV;
    return this;
  }

  public boolean isSingletLike() {
    return singletLike;
  }

  /**
   * Merge the fine-structure components of each (v, J) into one state with averaged energies.
   */
  public LinesByStateRequest setSingletLike(boolean singletLike) {
    this.singletLike = singletLike;
    return this;
  }
}
