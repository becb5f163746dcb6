package com.verlumen.portfolio.frontier;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.portfolio.optimizer.OptimizationResult;

@AutoValue
public abstract class FrontierPoint {
  static FrontierPoint create(double target, double risk, OptimizationResult result) {
    return new AutoValue_FrontierPoint(target, result.mean(), risk, result.weights(), result);
  }

  /** Return target the point was solved for. */
  public abstract double target();

  public abstract double mean();

  public abstract double risk();

  public abstract ImmutableList<Double> weights();

  public abstract OptimizationResult result();
}
