package com.verlumen.portfolio.optimizer;

import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.SolverChoice;

/**
 * Solves one portfolio spec over one return window.
 *
 * <p>Failures surface as {@link com.verlumen.portfolio.errors.PortfolioException} subclasses:
 * infeasible or unbounded programs as {@code InfeasibleProblemException}, a collapsed ratio
 * normalization as {@code InfeasibleRatioException}, timeouts and non-convergence as
 * {@code SolverFailureException}.
 */
public interface Optimizer {
  /** Solves with the backend preference stored in {@code spec}. */
  OptimizationResult optimize(PortfolioSpec spec, ReturnSample window, OptimizationMode mode);

  /** Solves with {@code solverChoice} instead of the spec's preference. */
  OptimizationResult optimize(
      PortfolioSpec spec, ReturnSample window, OptimizationMode mode, SolverChoice solverChoice);
}
