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

/**
 * Minimizes the sum of squares of a {@link ResidualFunction} within box bounds.
 */
public interface ResidualMinimizer {
  /**
   * @param function The residuals as a function of the parameters.
   * @param start Initial parameter values, within the bounds.
   * @param lowerBounds Lower bounds, -inf for none.
   * @param upperBounds Upper bounds, +inf for none.
   * @param options Method and stopping criteria.
   * @return The best parameters found.  Failing to converge is reported in the result, not thrown.
   */
  MinimizerResult minimize(ResidualFunction function, double[] start, double[] lowerBounds, double[] upperBounds,
                           FitOptions options);
}
