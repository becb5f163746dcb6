package com.verlumen.portfolio.optimizer;

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.portfolio.errors.InfeasibleProblemException;
import com.verlumen.portfolio.errors.InfeasibleRatioException;
import com.verlumen.portfolio.errors.SolverFailureException;
import com.verlumen.portfolio.program.CanonicalProgram;
import com.verlumen.portfolio.program.ProblemBuilder;
import com.verlumen.portfolio.returns.MomentEstimates;
import com.verlumen.portfolio.returns.ReturnSample;
import com.verlumen.portfolio.solver.SolverAdapter;
import com.verlumen.portfolio.solver.SolverSolution;
import com.verlumen.portfolio.spec.Objective;
import com.verlumen.portfolio.spec.OptimizationMode;
import com.verlumen.portfolio.spec.PortfolioSpec;
import com.verlumen.portfolio.spec.RiskMeasure;
import com.verlumen.portfolio.spec.SolverChoice;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

final class OptimizerImpl implements Optimizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** κ at or below this value means the ratio normalization collapsed. */
  static final double KAPPA_TOLERANCE = 1e-9;

  private final ProblemBuilder problemBuilder;
  private final SolverAdapter solverAdapter;

  @Inject
  OptimizerImpl(ProblemBuilder problemBuilder, SolverAdapter solverAdapter) {
    this.problemBuilder = problemBuilder;
    this.solverAdapter = solverAdapter;
  }

  @Override
  public OptimizationResult optimize(
      PortfolioSpec spec, ReturnSample window, OptimizationMode mode) {
    return optimize(spec, window, mode, spec.solverChoice());
  }

  @Override
  public OptimizationResult optimize(
      PortfolioSpec spec, ReturnSample window, OptimizationMode mode, SolverChoice solverChoice) {
    CanonicalProgram program = problemBuilder.build(spec, window, mode);
    SolverSolution solution = solverAdapter.solve(program, solverChoice);
    String backend = solution.backendName();
    switch (solution.status()) {
      case OPTIMAL:
        break;
      case INFEASIBLE:
        throw new InfeasibleProblemException(backend, "Program is infeasible: " + program);
      case INFEASIBLE_RATIO:
        throw new InfeasibleRatioException(backend, Double.NaN);
      case UNBOUNDED:
        throw new InfeasibleProblemException(backend, "Program is unbounded: " + program);
      case TIMEOUT:
        throw new SolverFailureException(
            backend, SolverFailureException.Reason.TIMEOUT, "Solve timed out: " + program);
      case NUMERICAL_FAILURE:
        throw new SolverFailureException(
            backend,
            SolverFailureException.Reason.NUMERICAL_FAILURE,
            "Solver did not converge: " + program);
      default:
        throw new IllegalStateException("Unhandled solver status " + solution.status());
    }

    double[] weights = new double[program.weightCount()];
    for (int j = 0; j < weights.length; j++) {
      weights[j] = solution.value(j);
    }
    OptionalDouble kappa = OptionalDouble.empty();
    if (program.isRatio()) {
      double kappaValue = solution.value(program.kappaIndex().getAsInt());
      if (kappaValue <= KAPPA_TOLERANCE) {
        throw new InfeasibleRatioException(backend, kappaValue);
      }
      for (int j = 0; j < weights.length; j++) {
        weights[j] /= kappaValue;
      }
      kappa = OptionalDouble.of(kappaValue);
    }

    OptimizationResult result =
        OptimizationResult.builder()
            .setUniverse(spec.universe())
            .setWeights(weights)
            .setMean(MomentEstimates.of(window).portfolioMean(weights))
            .setRiskMeasures(riskMeasures(spec, window, weights))
            .setComposite(solution.objectiveValue())
            .setSolverName(backend)
            .setStatus(solution.status())
            .setMode(mode)
            .setKappa(kappa)
            .build();
    logger.atFine().log(
        "Solved %s on %s: mean=%.6g composite=%.6g",
        mode, backend, result.mean(), result.composite());
    return result;
  }

  private static ImmutableMap<RiskMeasure, Double> riskMeasures(
      PortfolioSpec spec, ReturnSample window, double[] weights) {
    Map<RiskMeasure, Double> measures = new LinkedHashMap<>();
    for (Objective objective : spec.riskObjectives()) {
      measures.putIfAbsent(
          objective.riskMeasure(), RiskMeasures.evaluate(objective, window, weights));
    }
    return ImmutableMap.copyOf(measures);
  }
}
