package com.verlumen.portfolio.solver;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.verlumen.portfolio.program.CanonicalProgram;
import com.verlumen.portfolio.program.LinearRow;
import com.verlumen.portfolio.program.ProblemClass;
import com.verlumen.portfolio.program.SecondOrderCone;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conic-capable backend. Each cone ||s|| <= z is replaced by supporting half-spaces
 * (p/||p||)'s <= z taken at relaxed points p, which hold for every feasible point. The
 * relaxation is re-solved with ojAlgo and a cut is added at each violated cone until every cone
 * holds within tolerance.
 */
final class OuterApproximationConicBackend implements SolverBackend {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String name;
  private final double tolerance;
  private final int maxIterations;

  OuterApproximationConicBackend(String name, double tolerance, int maxIterations) {
    this.name = name;
    this.tolerance = tolerance;
    this.maxIterations = maxIterations;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean supports(ProblemClass problemClass) {
    return true;
  }

  @Override
  public SolverSolution solve(CanonicalProgram program, Duration timeLimit) {
    if (program.cones().isEmpty()) {
      return OjAlgoModels.solve(name, program, ImmutableList.of(), timeLimit);
    }
    long deadline = System.nanoTime() + timeLimit.toNanos();
    List<LinearRow> cuts = initialCuts(program);
    for (int iteration = 1; iteration <= maxIterations; iteration++) {
      Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
      if (remaining.isNegative() || remaining.isZero()) {
        logger.atWarning().log("%s ran out of time after %d cut rounds", name, iteration - 1);
        return SolverSolution.failed(name, SolverStatus.TIMEOUT);
      }
      SolverSolution relaxed = OjAlgoModels.solve(name, program, cuts, remaining);
      if (!relaxed.status().isOptimal()) {
        return relaxed;
      }
      double[] values = relaxed.valuesArray();
      int added = 0;
      for (SecondOrderCone cone : program.cones()) {
        double norm = cone.norm(values);
        double violation = norm - values[cone.bound()];
        if (violation > tolerance * Math.max(1.0, norm)) {
          cuts.add(supportingCut(cone, values, norm, cuts.size()));
          added++;
        }
      }
      if (added == 0) {
        logger.atFine().log("%s converged after %d cut rounds", name, iteration);
        return polished(program, values);
      }
    }
    logger.atWarning().log("%s did not converge within %d cut rounds", name, maxIterations);
    return SolverSolution.failed(name, SolverStatus.NUMERICAL_FAILURE);
  }

  /** Raises every cone bound to the exact norm so the returned point is feasible. */
  private SolverSolution polished(CanonicalProgram program, double[] values) {
    for (SecondOrderCone cone : program.cones()) {
      values[cone.bound()] = Math.max(values[cone.bound()], cone.norm(values));
    }
    return SolverSolution.optimal(name, program.objectiveValue(values), values);
  }

  /** z >= |s_i| for every member and z >= sum(s) / sqrt(m). */
  private static List<LinearRow> initialCuts(CanonicalProgram program) {
    List<LinearRow> cuts = new ArrayList<>();
    for (SecondOrderCone cone : program.cones()) {
      double averaging = 1.0 / Math.sqrt(cone.members().size());
      Map<Integer, Double> diagonal = new LinkedHashMap<>();
      for (int member : cone.members()) {
        diagonal.put(member, averaging);
        String memberName = cone.name() + ".member[" + member + "]";
        cuts.add(cut(memberName + ".upper", Map.of(member, 1.0), cone.bound()));
        cuts.add(cut(memberName + ".lower", Map.of(member, -1.0), cone.bound()));
      }
      cuts.add(cut(cone.name() + ".diagonal", diagonal, cone.bound()));
    }
    return cuts;
  }

  private static LinearRow supportingCut(
      SecondOrderCone cone, double[] values, double norm, int index) {
    Map<Integer, Double> gradient = new LinkedHashMap<>();
    for (int member : cone.members()) {
      double component = values[member] / norm;
      if (component != 0) {
        gradient.put(member, component);
      }
    }
    return cut(cone.name() + ".cut[" + index + "]", gradient, cone.bound());
  }

  /** a's - z <= 0. */
  private static LinearRow cut(String name, Map<Integer, Double> coefficients, int bound) {
    Map<Integer, Double> row = new LinkedHashMap<>(coefficients);
    row.merge(bound, -1.0, Double::sum);
    return LinearRow.create(name, ImmutableMap.copyOf(row), Double.NEGATIVE_INFINITY, 0.0);
  }
}
