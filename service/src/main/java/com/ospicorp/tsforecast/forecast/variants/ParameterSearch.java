package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.FittingException;
import java.util.Arrays;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;

/**
 * Box-constrained minimisation of a smooth objective. BOBYQA needs at least two dimensions, so
 * single-parameter problems go through Brent's line search instead.
 */
final class ParameterSearch {
  static final double PENALTY = 1e300;

  private static final int MAX_EVALUATIONS = 10_000;
  private static final double INITIAL_TRUST_RADIUS = 0.2;
  private static final double STOPPING_TRUST_RADIUS = 1e-7;

  private ParameterSearch() {
  }

  static double[] minimize(String modelName, MultivariateFunction objective, double[] start,
      double lower, double upper) {
    int n = start.length;
    if (n == 0) {
      return start;
    }
    MultivariateFunction guarded = point -> {
      double value = objective.value(point);
      return Double.isFinite(value) ? value : PENALTY;
    };
    try {
      if (n == 1) {
        BrentOptimizer brent = new BrentOptimizer(1e-10, 1e-12);
        UnivariatePointValuePair best = brent.optimize(
            new MaxEval(MAX_EVALUATIONS),
            new UnivariateObjectiveFunction(x -> guarded.value(new double[] {x})),
            GoalType.MINIMIZE,
            new SearchInterval(lower, upper, clamp(start[0], lower, upper)));
        return new double[] {best.getPoint()};
      }
      double[] lowerBounds = new double[n];
      double[] upperBounds = new double[n];
      Arrays.fill(lowerBounds, lower);
      Arrays.fill(upperBounds, upper);
      double[] initial = new double[n];
      for (int i = 0; i < n; i++) {
        initial[i] = clamp(start[i], lower, upper);
      }
      BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * n + 1, INITIAL_TRUST_RADIUS,
          STOPPING_TRUST_RADIUS);
      PointValuePair best = optimizer.optimize(
          new MaxEval(MAX_EVALUATIONS),
          new ObjectiveFunction(guarded),
          GoalType.MINIMIZE,
          new InitialGuess(initial),
          new SimpleBounds(lowerBounds, upperBounds));
      return best.getPoint();
    } catch (MathIllegalStateException | MathIllegalArgumentException ex) {
      throw new FittingException(modelName + " parameter estimation did not converge: "
          + ex.getMessage(), ex);
    }
  }

  private static double clamp(double value, double lower, double upper) {
    double margin = (upper - lower) * 1e-3;
    return Math.max(lower + margin, Math.min(upper - margin, value));
  }
}
