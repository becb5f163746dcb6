package com.verlumen.portfolio.solver;

import com.verlumen.portfolio.program.CanonicalProgram;
import com.verlumen.portfolio.program.ProblemClass;
import java.time.Duration;

/** A numerical backend able to solve some classes of canonical programs. */
public interface SolverBackend {
  /** Registry name, recorded on every result. */
  String name();

  boolean supports(ProblemClass problemClass);

  /**
   * Solves {@code program}. Infeasibility and non-convergence are reported through the returned
   * status rather than thrown.
   *
   * @param timeLimit budget the backend should try to honor on its own
   */
  SolverSolution solve(CanonicalProgram program, Duration timeLimit);
}
