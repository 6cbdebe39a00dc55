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

package com.twentyn.oes.fit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.oes.params.BoundedParameter;
import com.twentyn.oes.params.SpeciesParameterSet;
import com.twentyn.oes.synth.SpectrumSynthesizer;
import com.twentyn.oes.utils.JsonUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fit settings read from a JSON file, e.g.
 * <pre>
 * {
 *   "method": "leastsq",
 *   "max_iterations": 500,
 *   "points_per_nm": 1000,
 *   "parameters": {
 *     "slitf_gauss": {"value": 0.05, "vary": true},
 *     "OH_Trot": {"value": 3000, "min": 1000, "max": 6000}
 *   }
 * }
 * </pre>
 * Parameter overrides are applied by flat name; overrides for species a spectrum does not carry are ignored.
 */
public class FitConfiguration {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FitConfiguration.class);

  public static class ParameterOverride {
    @JsonProperty("value")
    private Double value;

    @JsonProperty("min")
    private Double min;

    @JsonProperty("max")
    private Double max;

    @JsonProperty("vary")
    private Boolean vary;

    public ParameterOverride() {
    }

    public ParameterOverride(Double value, Double min, Double max, Boolean vary) {
      this.value = value;
      this.min = min;
      this.max = max;
      this.vary = vary;
    }

    public void applyTo(BoundedParameter parameter) {
      if (min != null || max != null) {
        parameter.setBounds(min == null ? parameter.getMin() : min, max == null ? parameter.getMax() : max);
      }
      if (value != null) {
        parameter.setValue(value);
      }
      if (vary != null) {
        parameter.setVary(vary);
      }
    }
  }

  @JsonProperty("method")
  private String method = FitMethod.LEASTSQ.name();

  @JsonProperty("max_iterations")
  private int maxIterations = FitOptions.DEFAULT_MAX_ITERATIONS;

  @JsonProperty("xtol")
  private double xtol = FitOptions.DEFAULT_XTOL;

  @JsonProperty("points_per_nm")
  private int pointsPerNm = SpectrumSynthesizer.DEFAULT_POINTS_PER_NM;

  @JsonProperty("weighted")
  private boolean weighted = false;

  @JsonProperty("parameters")
  private Map<String, ParameterOverride> parameters = new LinkedHashMap<>();

  public static FitConfiguration readFromFile(File inputFile) throws IOException {
    return JsonUtils.OBJECT_MAPPER.readValue(inputFile, FitConfiguration.class);
  }

  public Map<String, ParameterOverride> getParameters() {
    return parameters;
  }

  public void setMethod(String method) {
    this.method = method;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public void setPointsPerNm(int pointsPerNm) {
    this.pointsPerNm = pointsPerNm;
  }

  public FitOptions toFitOptions() {
    return new FitOptions(FitMethod.fromName(method), maxIterations, xtol, pointsPerNm, weighted);
  }

  public void applyTo(SpeciesParameterSet params) {
    for (Map.Entry<String, ParameterOverride> entry : parameters.entrySet()) {
      if (!params.containsParameter(entry.getKey())) {
        LOGGER.debug("Skipping override of unknown parameter %s", entry.getKey());
        continue;
      }
      entry.getValue().applyTo(params.get(entry.getKey()));
    }
  }
}
