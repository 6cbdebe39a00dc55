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

package com.twentyn.oes.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.oes.params.SpeciesParameterSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a fit session: measured data and parameters per spectrum, and the species whose line lists
 * have to be reopened.
 */
public class FitSessionModel {
  public static class MeasuredData {
    @JsonProperty("x")
    private double[] x;

    @JsonProperty("y")
    private double[] y;

    private MeasuredData() {
    }

    public MeasuredData(double[] x, double[] y) {
      this.x = x;
      this.y = y;
    }

    public double[] getX() {
      return x;
    }

    public double[] getY() {
      return y;
    }
  }

  @JsonProperty("source_file")
  private String sourceFile;

  @JsonProperty("spectra")
  private LinkedHashMap<String, MeasuredData> spectra = new LinkedHashMap<>();

  @JsonProperty("params")
  private LinkedHashMap<String, SpeciesParameterSet.Model> params = new LinkedHashMap<>();

  @JsonProperty("simulations")
  private List<String> simulations = new ArrayList<>();

  public String getSourceFile() {
    return sourceFile;
  }

  public void setSourceFile(String sourceFile) {
    this.sourceFile = sourceFile;
  }

  public Map<String, MeasuredData> getSpectra() {
    return spectra;
  }

  public Map<String, SpeciesParameterSet.Model> getParams() {
    return params;
  }

  public List<String> getSimulations() {
    return simulations;
  }
}
