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

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimplePointChecker;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.PowellOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link ResidualMinimizer} on the Apache Commons Math optimizers.  Bounds are handled by optimizing in the
 * unbounded internal coordinates of {@link BoundsTransform}.  Whatever way the optimizer stops, the best point seen
 * during the run is reported.
 */
public class CommonsMathMinimizer implements ResidualMinimizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CommonsMathMinimizer.class);

  // Relative forward-difference step: the square root of the double precision machine epsilon.
  public static final double JACOBIAN_STEP = 1.49012e-8;
  public static final double COVARIANCE_SINGULARITY_THRESHOLD = 1e-14;
  public static final double POWELL_RELATIVE_TOLERANCE = 1e-10;
  public static final double POWELL_ABSOLUTE_TOLERANCE = 1e-14;
  // Initial simplex size: 5% of each coordinate, or this value for coordinates at zero.
  public static final double SIMPLEX_RELATIVE_STEP = 0.05;
  public static final double SIMPLEX_ZERO_STEP = 0.00025;
  // Absolute tolerance on the sum of squares between iterations of the scalar methods.
  public static final double SCALAR_FTOL = 1e-4;

  @Override
  public MinimizerResult minimize(ResidualFunction function, double[] start, double[] lowerBounds,
                                  double[] upperBounds, FitOptions options) {
    if (start.length != lowerBounds.length || start.length != upperBounds.length) {
      throw new IllegalArgumentException(String.format("Got %d start values but %d/%d bounds",
          start.length, lowerBounds.length, upperBounds.length));
    }
    BoundsTransform[] transforms = new BoundsTransform[start.length];
    for (int i = 0; i < start.length; i++) {
      transforms[i] = new BoundsTransform(lowerBounds[i], upperBounds[i]);
    }
    double[] internalStart = BoundsTransform.toInternal(transforms, start);
    TrackingFunction tracked =
        new TrackingFunction(function, transforms, internalStart, options.getMaxIterations());

    LOGGER.debug("Minimizing %d parameters with %s", start.length, options);
    switch (options.getMethod()) {
      case LEASTSQ:
        return minimizeLeastSquares(tracked, internalStart, options);
      case NELDER:
      case POWELL:
        return minimizeScalar(tracked, internalStart, options);
      default:
        throw new IllegalArgumentException(String.format("Unsupported fit method %s", options.getMethod()));
    }
  }

  private MinimizerResult minimizeLeastSquares(TrackingFunction tracked, double[] internalStart,
                                               FitOptions options) {
    final List<Double> iterationSums = new ArrayList<>();
    ConvergenceChecker<LeastSquaresProblem.Evaluation> recorder =
        new ConvergenceChecker<LeastSquaresProblem.Evaluation>() {
          @Override
          public boolean converged(int iteration, LeastSquaresProblem.Evaluation previous,
                                   LeastSquaresProblem.Evaluation current) {
            if (iterationSums.isEmpty()) {
              iterationSums.add(square(previous.getCost()));
            }
            iterationSums.add(square(current.getCost()));
            // Stopping is left to the optimizer's own tolerances.
            return false;
          }
        };

    MultivariateJacobianFunction model = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(RealVector point) {
        return forwardDifference(tracked, point.toArray());
      }
    };

    LeastSquaresProblem problem = new LeastSquaresBuilder().
        start(internalStart).
        model(model).
        target(new double[tracked.residualLength(internalStart)]).
        checker(recorder).
        lazyEvaluation(false).
        maxEvaluations(options.getMaxIterations()).
        maxIterations(Integer.MAX_VALUE).
        build();

    try {
      LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
      double[] internal = optimum.getPoint().toArray();
      double sumsq = square(optimum.getCost());
      if (iterationSums.isEmpty()) {
        iterationSums.add(sumsq);
      }
      double[] stderr = standardErrors(optimum, tracked, internal, sumsq);
      return new MinimizerResult(BoundsTransform.toExternal(tracked.transforms, internal), stderr, true,
          String.format("Converged after %d iterations", optimum.getIterations()), sumsq,
          tracked.getEvaluations(), iterationSums);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      LOGGER.warn("Least squares fit stopped: %s", e.getMessage());
      return tracked.bestResult(e.getMessage(), iterationSums);
    }
  }

  private double[] standardErrors(LeastSquaresOptimizer.Optimum optimum, TrackingFunction tracked,
                                  double[] internal, double sumsq) {
    int n = optimum.getResiduals().getDimension();
    int p = internal.length;
    if (n <= p) {
      return null;
    }
    RealMatrix covariance;
    try {
      covariance = optimum.getCovariances(COVARIANCE_SINGULARITY_THRESHOLD);
    } catch (MathIllegalArgumentException e) {
      LOGGER.info("Covariance matrix is singular, no standard errors: %s", e.getMessage());
      return null;
    }
    double reducedChiSquare = sumsq / (n - p);
    double[] stderr = new double[p];
    for (int i = 0; i < p; i++) {
      stderr[i] = FastMath.sqrt(covariance.getEntry(i, i) * reducedChiSquare) *
          FastMath.abs(tracked.transforms[i].gradient(internal[i]));
    }
    return stderr;
  }

  private MinimizerResult minimizeScalar(TrackingFunction tracked, double[] internalStart, FitOptions options) {
    final List<Double> iterationSums = new ArrayList<>();
    final SimplePointChecker<PointValuePair> pointChecker =
        new SimplePointChecker<>(0.0, options.getXtol());
    final SimpleValueChecker valueChecker = new SimpleValueChecker(0.0, SCALAR_FTOL);
    ConvergenceChecker<PointValuePair> recorder = new ConvergenceChecker<PointValuePair>() {
      private int lastIteration = -1;

      @Override
      public boolean converged(int iteration, PointValuePair previous, PointValuePair current) {
        // The simplex optimizer checks every vertex, best first; record each iteration once.
        if (iteration != lastIteration) {
          if (iterationSums.isEmpty()) {
            iterationSums.add(previous.getValue());
          }
          iterationSums.add(current.getValue());
          lastIteration = iteration;
        }
        return pointChecker.converged(iteration, previous, current) &&
            valueChecker.converged(iteration, previous, current);
      }
    };

    MultivariateFunction objective = new MultivariateFunction() {
      @Override
      public double value(double[] point) {
        return tracked.sumOfSquares(point);
      }
    };

    try {
      PointValuePair optimum;
      if (options.getMethod() == FitMethod.NELDER) {
        double[] steps = new double[internalStart.length];
        for (int i = 0; i < steps.length; i++) {
          steps[i] = internalStart[i] == 0.0 ? SIMPLEX_ZERO_STEP : SIMPLEX_RELATIVE_STEP * internalStart[i];
        }
        optimum = new SimplexOptimizer(recorder).optimize(
            new MaxEval(options.getMaxIterations()),
            MaxIter.unlimited(),
            new ObjectiveFunction(objective),
            GoalType.MINIMIZE,
            new InitialGuess(internalStart),
            new NelderMeadSimplex(steps));
      } else {
        optimum = new PowellOptimizer(POWELL_RELATIVE_TOLERANCE, POWELL_ABSOLUTE_TOLERANCE, recorder).optimize(
            new MaxEval(options.getMaxIterations()),
            MaxIter.unlimited(),
            new ObjectiveFunction(objective),
            GoalType.MINIMIZE,
            new InitialGuess(internalStart));
      }
      if (iterationSums.isEmpty()) {
        iterationSums.add(optimum.getValue());
      }
      return new MinimizerResult(BoundsTransform.toExternal(tracked.transforms, optimum.getPoint()), null, true,
          String.format("%s converged", options.getMethod()), optimum.getValue(), tracked.getEvaluations(),
          iterationSums);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      LOGGER.warn("%s fit stopped: %s", options.getMethod(), e.getMessage());
      return tracked.bestResult(e.getMessage(), iterationSums);
    }
  }

  /**
   * Residuals and their forward-difference Jacobian at an internal point.
   */
  static Pair<RealVector, RealMatrix> forwardDifference(TrackingFunction tracked, double[] point) {
    double[] base = tracked.residuals(point);
    RealMatrix jacobian = new Array2DRowRealMatrix(base.length, point.length);
    for (int j = 0; j < point.length; j++) {
      double h = point[j] == 0.0 ? JACOBIAN_STEP : JACOBIAN_STEP * FastMath.abs(point[j]);
      double[] shifted = Arrays.copyOf(point, point.length);
      shifted[j] += h;
      double[] perturbed = tracked.residuals(shifted);
      for (int i = 0; i < base.length; i++) {
        jacobian.setEntry(i, j, (perturbed[i] - base[i]) / h);
      }
    }
    return new Pair<RealVector, RealMatrix>(new ArrayRealVector(base, false), jacobian);
  }

  private static double square(double value) {
    return value * value;
  }

  /**
   * Wraps the residual function in internal coordinates, counting evaluations and remembering the best point.
   * Every call counts, Jacobian columns included, and calls beyond the budget throw
   * {@link TooManyEvaluationsException}.
   */
  static class TrackingFunction {
    private final ResidualFunction function;
    private final BoundsTransform[] transforms;
    private final int maxEvaluations;
    private int evaluations = 0;
    private double[] bestInternal;
    private double bestSumOfSquares = Double.NaN;

    TrackingFunction(ResidualFunction function, BoundsTransform[] transforms, double[] start, int maxEvaluations) {
      this.function = function;
      this.transforms = transforms;
      this.bestInternal = Arrays.copyOf(start, start.length);
      this.maxEvaluations = maxEvaluations;
    }

    double[] residuals(double[] internal) {
      if (evaluations >= maxEvaluations) {
        throw new TooManyEvaluationsException(maxEvaluations);
      }
      double[] residuals = function.value(BoundsTransform.toExternal(transforms, internal));
      evaluations++;
      double sumsq = 0.0;
      for (double r : residuals) {
        sumsq += r * r;
      }
      if (Double.isNaN(bestSumOfSquares) || sumsq < bestSumOfSquares) {
        bestSumOfSquares = sumsq;
        bestInternal = Arrays.copyOf(internal, internal.length);
      }
      return residuals;
    }

    double sumOfSquares(double[] internal) {
      double sumsq = 0.0;
      for (double r : residuals(internal)) {
        sumsq += r * r;
      }
      return Double.isNaN(sumsq) ? Double.POSITIVE_INFINITY : sumsq;
    }

    int residualLength(double[] internal) {
      return residuals(internal).length;
    }

    int getEvaluations() {
      return evaluations;
    }

    MinimizerResult bestResult(String message, List<Double> iterationSums) {
      return new MinimizerResult(BoundsTransform.toExternal(transforms, bestInternal), null, false, message,
          bestSumOfSquares, evaluations, iterationSums);
    }
  }
}
