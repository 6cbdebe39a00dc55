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

import java.util.List;

/**
 * Summary of one {@link FitSession#fit(String, FitOptions)} call.  The fitted values themselves are written back
 * into the spectrum's parameter set.
 */
public class FitOutcome {
  private final String spectrumId;
  private final FitMethod method;
  private final List<String> parameterNames;
  private final MinimizerResult result;

  public FitOutcome(String spectrumId, FitMethod method, List<String> parameterNames, MinimizerResult result) {
    this.spectrumId = spectrumId;
    this.method = method;
    this.parameterNames = parameterNames;
    this.result = result;
  }

  public String getSpectrumId() {
    return spectrumId;
  }

  public FitMethod getMethod() {
    return method;
  }

  /**
   * @return The names of the varied parameters, in the order of the minimizer's vectors.
   */
  public List<String> getParameterNames() {
    return parameterNames;
  }

  public boolean isSuccess() {
    return result.isSuccess();
  }

  public String getMessage() {
    return result.getMessage();
  }

  public double getSumOfSquares() {
    return result.getSumOfSquares();
  }

  public double getResidualNorm() {
    return Math.sqrt(result.getSumOfSquares());
  }

  public int getEvaluations() {
    return result.getEvaluations();
  }

  public List<Double> getIterationSumsOfSquares() {
    return result.getIterationSumsOfSquares();
  }

  public MinimizerResult getMinimizerResult() {
    return result;
  }

  @Override
  public String toString() {
    return String.format("%s fit of spectrum %s: %s (%s), sumsq = %.6e after %d evaluations",
        method, spectrumId, isSuccess() ? "success" : "failure", getMessage(), getSumOfSquares(), getEvaluations());
  }
}
