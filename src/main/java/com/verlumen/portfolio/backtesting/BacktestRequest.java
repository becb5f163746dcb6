package com.verlumen.portfolio.backtesting;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.SolverChoice;
import java.util.Optional;

/** Inputs of one walk-forward backtest. */
@AutoValue
public abstract class BacktestRequest {
  public static Builder builder() {
    return new AutoValue_BacktestRequest.Builder()
        .setFrequency(RebalanceFrequency.EVERY_PERIOD)
        .setMode(OptimizationMode.PLAIN);
  }

  public abstract PortfolioSpec spec();

  public abstract ReturnSample sample();

  public abstract RebalanceFrequency frequency();

  /** Fewest observations a window needs before the first solve. */
  public abstract Optional<Integer> trainingLength();

  /** Width of a rolling window; empty for an expanding window. */
  public abstract Optional<Integer> rollingWindow();

  public abstract OptimizationMode mode();

  /** Overrides the spec's backend preference. */
  public abstract Optional<SolverChoice> solverChoice();

  /** Overrides the engine's default failure policy. */
  public abstract Optional<FailurePolicy> failurePolicy();

  /** Training length, falling back to the rolling width and then to a single observation. */
  public int effectiveTrainingLength() {
    return trainingLength().orElse(rollingWindow().orElse(1));
  }

  public SolverChoice effectiveSolverChoice() {
    return solverChoice().orElse(spec().solverChoice());
  }

  /** Builder for {@link BacktestRequest}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSpec(PortfolioSpec spec);

    public abstract Builder setSample(ReturnSample sample);

    public abstract Builder setFrequency(RebalanceFrequency frequency);

    public abstract Builder setTrainingLength(int trainingLength);

    public abstract Builder setRollingWindow(int rollingWindow);

    public abstract Builder setMode(OptimizationMode mode);

    public abstract Builder setSolverChoice(SolverChoice solverChoice);

    public abstract Builder setFailurePolicy(FailurePolicy failurePolicy);

    abstract BacktestRequest autoBuild();

    public BacktestRequest build() {
      BacktestRequest request = autoBuild();
      checkArgument(
          request.trainingLength().orElse(1) > 0, "Training length must be positive");
      checkArgument(request.rollingWindow().orElse(1) > 0, "Rolling window must be positive");
      checkArgument(
          request.spec().universe().equals(request.sample().universe()),
          "Sample assets %s do not match spec assets %s",
          request.sample().universe().assetIds(),
          request.spec().universe().assetIds());
      return request;
    }
  }
}
