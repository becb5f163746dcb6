package com.verlumen.portfolio.frontier;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.portfolio.spec.RiskMeasure;

/**
 * Minimum-risk portfolios for ascending return targets.
 *
 * <p>Points whose risk fell below that of the preceding point by more than the tolerance are
 * listed in {@link #monotonicityViolations()} by index; they are kept as solved. Targets whose
 * solve failed are missing from {@link #points()} and listed in {@link #failedTargets()}.
 */
@AutoValue
public abstract class EfficientFrontier {
  static EfficientFrontier create(
      RiskMeasure riskMeasure,
      ImmutableList<FrontierPoint> points,
      ImmutableList<Integer> monotonicityViolations,
      ImmutableList<Double> failedTargets) {
    return new AutoValue_EfficientFrontier(
        riskMeasure, points, monotonicityViolations, failedTargets);
  }

  public abstract RiskMeasure riskMeasure();

  public abstract ImmutableList<FrontierPoint> points();

  public abstract ImmutableList<Integer> monotonicityViolations();

  public abstract ImmutableList<Double> failedTargets();

  public boolean isMonotone() {
    return monotonicityViolations().isEmpty();
  }
}
