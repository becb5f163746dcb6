package com.verlumen.portfolio.solver;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.verlumen.portfolio.program.ProblemClass;
import java.time.Duration;

/** Backend selection and solve budgets. */
@AutoValue
public abstract class SolverConfig {
  public static final String OJALGO_LP = "ojalgo-lp";
  public static final String OJALGO_QP = "ojalgo-qp";
  public static final String OJALGO_SOCP = "ojalgo-socp";

  public static SolverConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_SolverConfig.Builder()
        .setDefaultBackends(
            ImmutableMap.of(
                ProblemClass.LP, OJALGO_LP,
                ProblemClass.QP, OJALGO_QP,
                ProblemClass.SOCP, OJALGO_SOCP))
        .setTimeout(Duration.ofSeconds(60))
        .setRetryWithAlternateBackend(false)
        .setConicTolerance(1e-7)
        .setConicMaxIterations(500);
  }

  /** Backend used for each problem class when the caller asks for {@code auto}. */
  public abstract ImmutableMap<ProblemClass, String> defaultBackends();

  /** Wall-clock budget of one backend call. */
  public abstract Duration timeout();

  /** Whether a timed-out or non-converged solve is retried once on another capable backend. */
  public abstract boolean retryWithAlternateBackend();

  /** Relative violation tolerated on a second-order cone before another cut is added. */
  public abstract double conicTolerance();

  /** Cutting-plane rounds before the conic backend reports a numerical failure. */
  public abstract int conicMaxIterations();

  public abstract Builder toBuilder();

  /** Builder for {@link SolverConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setDefaultBackends(ImmutableMap<ProblemClass, String> defaults);

    public abstract Builder setTimeout(Duration timeout);

    public abstract Builder setRetryWithAlternateBackend(boolean retry);

    public abstract Builder setConicTolerance(double tolerance);

    public abstract Builder setConicMaxIterations(int iterations);

    abstract SolverConfig autoBuild();

    public SolverConfig build() {
      SolverConfig config = autoBuild();
      checkArgument(
          !config.timeout().isNegative() && !config.timeout().isZero(),
          "Solver timeout must be positive");
      checkArgument(config.conicTolerance() > 0, "Conic tolerance must be positive");
      checkArgument(config.conicMaxIterations() > 0, "Conic iteration cap must be positive");
      return config;
    }
  }
}
