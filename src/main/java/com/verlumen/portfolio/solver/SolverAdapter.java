package com.verlumen.portfolio.solver;

import com.verlumen.portfolio.program.CanonicalProgram;
import com.verlumen.portfolio.program.ProblemClass;
import com.verlumen.portfolio.spec.SolverChoice;

/** Picks a backend for a program and normalizes what it returns. */
public interface SolverAdapter {
  /**
   * Solves {@code program} with the backend named by {@code choice}, or the configured default
   * for the program's class when the choice is {@code auto}.
   *
   * @throws com.verlumen.portfolio.errors.UnsupportedProblemClassException if the explicit backend
   *     cannot express the program's class
   * @throws com.verlumen.portfolio.errors.ValidationException if the backend name is unknown
   */
  SolverSolution solve(CanonicalProgram program, SolverChoice choice);

  /** Name of the backend {@link #solve} would start with. */
  String resolveBackend(ProblemClass problemClass, SolverChoice choice);
}
