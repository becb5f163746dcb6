package com.verlumen.portfolio.program;

/** Solver class a canonical program needs, ordered by expressive power. */
public enum ProblemClass {
  /** Linear objective and constraints. */
  LP,
  /** Convex quadratic objective, linear constraints. */
  QP,
  /** At least one second-order cone constraint. */
  SOCP
}
