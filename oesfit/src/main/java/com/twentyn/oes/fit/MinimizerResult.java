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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class MinimizerResult {
  private final double[] values;
  private final double[] standardErrors;
  private final boolean success;
  private final String message;
  private final double sumOfSquares;
  private final int evaluations;
  private final List<Double> iterationSumsOfSquares;

  public MinimizerResult(double[] values, double[] standardErrors, boolean success, String message,
                         double sumOfSquares, int evaluations, List<Double> iterationSumsOfSquares) {
    this.values = values;
    this.standardErrors = standardErrors;
    this.success = success;
    this.message = message;
    this.sumOfSquares = sumOfSquares;
    this.evaluations = evaluations;
    this.iterationSumsOfSquares = Collections.unmodifiableList(new ArrayList<>(iterationSumsOfSquares));
  }

  public double[] getValues() {
    return values;
  }

  /**
   * @return One standard error per parameter, or null if the method does not estimate them or the covariance
   * matrix is singular.
   */
  public double[] getStandardErrors() {
    return standardErrors;
  }

  public boolean isSuccess() {
    return success;
  }

  public String getMessage() {
    return message;
  }

  public double getSumOfSquares() {
    return sumOfSquares;
  }

  public int getEvaluations() {
    return evaluations;
  }

  public List<Double> getIterationSumsOfSquares() {
    return iterationSumsOfSquares;
  }
}
