package com.verlumen.portfolio.program;

import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;

/** Compiles a portfolio spec and one return window into a canonical convex program. */
public interface ProblemBuilder {
  /**
   * Builds the program for {@code mode}.
   *
   * @throws com.verlumen.portfolio.errors.ValidationException if the spec and window disagree or
   *     the window is unusable
   * @throws com.verlumen.portfolio.errors.InvalidObjectiveCombinationException if a ratio mode is
   *     requested without one return objective and one matching risk objective
   */
  CanonicalProgram build(PortfolioSpec spec, ReturnSample window, OptimizationMode mode);
}
