package com.verlumen.portfolio.solver;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.verlumen.portfolio.program.CanonicalProgram;
import com.verlumen.portfolio.program.ProblemClass;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Backend handing programs straight to ojAlgo's {@code ExpressionsBasedModel}. It is registered
 * twice: once restricted to linear programs and once for linear and quadratic programs.
 */
final class ExpressionsModelBackend implements SolverBackend {
  private final String name;
  private final Set<ProblemClass> capabilities;

  private ExpressionsModelBackend(String name, Set<ProblemClass> capabilities) {
    this.name = name;
    this.capabilities = Sets.immutableEnumSet(capabilities);
  }

  static ExpressionsModelBackend linear(String name) {
    return new ExpressionsModelBackend(name, EnumSet.of(ProblemClass.LP));
  }

  static ExpressionsModelBackend quadratic(String name) {
    return new ExpressionsModelBackend(name, EnumSet.of(ProblemClass.LP, ProblemClass.QP));
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean supports(ProblemClass problemClass) {
    return capabilities.contains(problemClass);
  }

  @Override
  public SolverSolution solve(CanonicalProgram program, Duration timeLimit) {
    if (!supports(program.problemClass())) {
      throw new IllegalStateException(name + " cannot solve " + program.problemClass());
    }
    return OjAlgoModels.solve(name, program, ImmutableList.of(), timeLimit);
  }

  @Override
  public String toString() {
    return name + capabilities;
  }
}
