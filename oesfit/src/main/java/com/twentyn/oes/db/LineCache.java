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
 * The window, temperatures and derived tables of the last spectrum a {@link LineDatabase} computed.  Windows are
 * stored enlarged by the database's reserve.
 */
class LineCache {
  private final double wmin;
  private final double wmax;
  private final WavelengthMedium medium;
  private final List<LineRecord> lines;

  private Double trot;
  private Double tvib;
  private double[] populations;
  private Double norm;

  LineCache(double wmin, double wmax, WavelengthMedium medium, List<LineRecord> lines) {
    this.wmin = wmin;
    this.wmax = wmax;
    this.medium = medium;
    this.lines = lines;
  }

  boolean coversWindow(double requestedMin, double requestedMax, WavelengthMedium requestedMedium) {
    return medium == requestedMedium && requestedMin >= wmin && requestedMax <= wmax;
  }

  boolean hasPopulationsFor(double requestedTrot, double requestedTvib) {
    return populations != null && trot != null && tvib != null &&
        trot == requestedTrot && tvib == requestedTvib;
  }

  void setPopulations(double trot, double tvib, double norm, double[] populations) {
    this.trot = trot;
    this.tvib = tvib;
    this.norm = norm;
    this.populations = populations;
  }

  double getWmin() {
    return wmin;
  }

  double getWmax() {
    return wmax;
  }

  WavelengthMedium getMedium() {
    return medium;
  }

  List<LineRecord> getLines() {
    return lines;
  }

  double[] getPopulations() {
    return populations;
  }

  Double getNorm() {
    return norm;
  }
}
