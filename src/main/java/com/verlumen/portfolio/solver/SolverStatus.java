package com.verlumen.portfolio.solver;

/** Normalized outcome of one solve, independent of the backend that produced it. */
public enum SolverStatus {
  OPTIMAL,
  INFEASIBLE,
  /** Ratio program solved but its normalization scalar was not positive. */
  INFEASIBLE_RATIO,
  UNBOUNDED,
  TIMEOUT,
  NUMERICAL_FAILURE;

  public boolean isOptimal() {
    return this == OPTIMAL;
  }

  /** Outcomes an alternate backend might overcome. */
  public boolean isSolverFailure() {
    return this == TIMEOUT || this == NUMERICAL_FAILURE;
  }
}
