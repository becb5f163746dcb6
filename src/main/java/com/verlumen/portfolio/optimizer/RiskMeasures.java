package com.verlumen.portfolio.optimizer;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.portfolio.returns.MomentEstimates;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.spec.Objective;
import java.util.Arrays;

/**
 * Closed-form evaluation of the risk measures at fixed weights.
 *
 * <p>The values agree with the programs the builder emits: expected shortfall is
 * min over t of {@code -t + (1/(T p)) sum (t - x_i)+} and expected quadratic shortfall is
 * min over t of {@code -t + (1/p) ||(t - x)+||_2}.
 */
public final class RiskMeasures {
  private RiskMeasures() {}

  /** r_i'w for every period of {@code window}. */
  public static double[] portfolioReturns(ReturnSample window, double[] weights) {
    checkArgument(weights.length == window.assets(), "Weight vector has wrong length");
    double[] returns = new double[window.periods()];
    for (int i = 0; i < returns.length; i++) {
      double total = 0;
      for (int j = 0; j < weights.length; j++) {
        total += window.value(i, j) * weights[j];
      }
      returns[i] = total;
    }
    return returns;
  }

  public static double variance(ReturnSample window, double[] weights) {
    return MomentEstimates.of(window).portfolioVariance(weights);
  }

  public static double expectedShortfall(ReturnSample window, double[] weights, double p) {
    return expectedShortfall(portfolioReturns(window, weights), p);
  }

  public static double expectedQuadraticShortfall(
      ReturnSample window, double[] weights, double p) {
    return expectedQuadraticShortfall(portfolioReturns(window, weights), p);
  }

  /** Value of {@code objective}'s risk measure, using its effective tail probability. */
  public static double evaluate(Objective objective, ReturnSample window, double[] weights) {
    switch (objective.kind()) {
      case VARIANCE:
        return variance(window, weights);
      case EXPECTED_SHORTFALL:
        return expectedShortfall(window, weights, objective.tailProbability());
      case EXPECTED_QUADRATIC_SHORTFALL:
        return expectedQuadraticShortfall(window, weights, objective.tailProbability());
      default:
        throw new IllegalArgumentException(objective.kind() + " is not a risk objective");
    }
  }

  /**
   * Expected shortfall of a return series: minus the average of the worst {@code T p} outcomes,
   * with the boundary observation counted fractionally.
   */
  public static double expectedShortfall(double[] returns, double p) {
    checkTail(returns, p);
    double[] sorted = returns.clone();
    Arrays.sort(sorted);
    double tailMass = sorted.length * p;
    int whole = (int) Math.floor(tailMass);
    double total = 0;
    for (int i = 0; i < whole; i++) {
      total += sorted[i];
    }
    if (whole < sorted.length) {
      total += (tailMass - whole) * sorted[whole];
    }
    return -total / tailMass;
  }

  /**
   * Expected quadratic shortfall of a return series. The objective is convex in t; the minimum
   * sits either at an observation or at the stationary point of the interval between two
   * consecutive sorted observations.
   */
  public static double expectedQuadraticShortfall(double[] returns, double p) {
    checkTail(returns, p);
    double[] sorted = returns.clone();
    Arrays.sort(sorted);
    double best = Double.POSITIVE_INFINITY;
    double sum = 0;
    double sumOfSquares = 0;
    for (int k = 1; k <= sorted.length; k++) {
      double x = sorted[k - 1];
      best = Math.min(best, quadraticShortfallAt(sorted, p, x));
      sum += x;
      sumOfSquares += x * x;
      double mean = sum / k;
      double spread = Math.max(0.0, sumOfSquares - k * mean * mean);
      double t = mean + p * Math.sqrt(spread / ((double) k * k - p * p * k));
      double upper = k < sorted.length ? sorted[k] : Double.POSITIVE_INFINITY;
      if (t >= x && t <= upper) {
        best = Math.min(best, quadraticShortfallAt(sorted, p, t));
      }
    }
    return best;
  }

  private static double quadraticShortfallAt(double[] sorted, double p, double t) {
    double squares = 0;
    for (double x : sorted) {
      if (x >= t) {
        break;
      }
      squares += (t - x) * (t - x);
    }
    return -t + Math.sqrt(squares) / p;
  }

  private static void checkTail(double[] returns, double p) {
    checkArgument(returns.length > 0, "Return series is empty");
    checkArgument(p > 0 && p < 1, "Tail probability must lie in (0, 1): %s", p);
  }
}
