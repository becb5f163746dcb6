package com.verlumen.portfolio.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.portfolio.backtesting.FailurePolicy;
import com.verlumen.portfolio.program.BuilderOptions;
import com.verlumen.portfolio.solver.SolverConfig;

/** Engine-wide settings bound by {@link PortfolioEngineModule}. */
@AutoValue
public abstract class EngineConfig {
  public static EngineConfig defaults() {
    return create(
        SolverConfig.defaults(), BuilderOptions.defaults(), FailurePolicy.HOLD_PREVIOUS, 1);
  }

  public static EngineConfig create(
      SolverConfig solverConfig,
      BuilderOptions builderOptions,
      FailurePolicy failurePolicy,
      int parallelism) {
    checkArgument(parallelism > 0, "Parallelism must be positive: %s", parallelism);
    return new AutoValue_EngineConfig(solverConfig, builderOptions, failurePolicy, parallelism);
  }

  public abstract SolverConfig solverConfig();

  public abstract BuilderOptions builderOptions();

  /** Failure policy of backtests that do not name one. */
  public abstract FailurePolicy failurePolicy();

  /** Threads available to backtest and frontier solves; 1 runs them on the caller's thread. */
  public abstract int parallelism();
}
