package com.verlumen.portfolio.program;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Tunables of the problem builder. */
@AutoValue
public abstract class BuilderOptions {
  public static final int DEFAULT_DENSE_COVARIANCE_LIMIT = 64;

  public static BuilderOptions defaults() {
    return create(DEFAULT_DENSE_COVARIANCE_LIMIT);
  }

  public static BuilderOptions create(int denseCovarianceLimit) {
    checkArgument(denseCovarianceLimit >= 0, "Dense covariance limit cannot be negative");
    return new AutoValue_BuilderOptions(denseCovarianceLimit);
  }

  /**
   * Largest universe for which variance is emitted as a dense n x n quadratic form. Larger
   * universes use the factorized form over demeaned returns.
   */
  public abstract int denseCovarianceLimit();
}
