package com.verlumen.portfolio.optimizer;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import com.verlumen.portfolio.solver.SolverStatus;
import com.verlumen.portfolio.spec.AssetUniverse;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.RiskMeasure;
import java.util.Arrays;
import java.util.OptionalDouble;

/** Weights and diagnostics of one optimization. */
@AutoValue
public abstract class OptimizationResult {
  public static Builder builder() {
    return new AutoValue_OptimizationResult.Builder()
        .setRiskMeasures(ImmutableMap.of())
        .setKappa(OptionalDouble.empty());
  }

  /**
   * Placeholder for a solve that did not produce weights. Weights, mean and composite are NaN;
   * {@code status} records why.
   */
  public static OptimizationResult failed(
      AssetUniverse universe, OptimizationMode mode, String solverName, SolverStatus status) {
    double[] undefined = new double[universe.size()];
    Arrays.fill(undefined, Double.NaN);
    return builder()
        .setUniverse(universe)
        .setWeights(undefined)
        .setMean(Double.NaN)
        .setComposite(Double.NaN)
        .setSolverName(solverName)
        .setStatus(status)
        .setMode(mode)
        .build();
  }

  public abstract AssetUniverse universe();

  /** Weights in universe order. */
  public abstract ImmutableList<Double> weights();

  /** Sample mean return μ'w of the window the weights were fitted on. */
  public abstract double mean();

  /** Value of every risk measure the spec names, evaluated at the returned weights. */
  public abstract ImmutableMap<RiskMeasure, Double> riskMeasures();

  /** Objective value reported by the solver, in minimization form. */
  public abstract double composite();

  public abstract String solverName();

  public abstract SolverStatus status();

  public abstract OptimizationMode mode();

  /** Normalization scalar of a ratio solve. */
  public abstract OptionalDouble kappa();

  public abstract Builder toBuilder();

  public double weight(String assetId) {
    return weights().get(universe().indexOf(assetId));
  }

  public double[] weightsArray() {
    return Doubles.toArray(weights());
  }

  public boolean isOptimal() {
    return status().isOptimal();
  }

  /** Builder for {@link OptimizationResult}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setUniverse(AssetUniverse universe);

    public abstract Builder setWeights(ImmutableList<Double> weights);

    public Builder setWeights(double[] weights) {
      return setWeights(ImmutableList.copyOf(Doubles.asList(weights)));
    }

    public abstract Builder setMean(double mean);

    public abstract Builder setRiskMeasures(ImmutableMap<RiskMeasure, Double> riskMeasures);

    public abstract Builder setComposite(double composite);

    public abstract Builder setSolverName(String solverName);

    public abstract Builder setStatus(SolverStatus status);

    public abstract Builder setMode(OptimizationMode mode);

    public abstract Builder setKappa(OptionalDouble kappa);

    public abstract OptimizationResult build();
  }
}
