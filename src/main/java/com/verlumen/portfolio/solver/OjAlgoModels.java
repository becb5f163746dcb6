package com.verlumen.portfolio.solver;

import com.google.common.flogger.FluentLogger;
import com.verlumen.portfolio.program.CanonicalProgram;
import com.verlumen.portfolio.program.LinearRow;
import com.verlumen.portfolio.program.QuadraticTerm;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

/** Translates canonical programs into ojAlgo models and reads the results back. */
final class OjAlgoModels {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private OjAlgoModels() {}

  /**
   * Solves the linear/quadratic part of {@code program} plus {@code extraRows}. Cones are ignored
   * here; callers that support them add outer-approximation rows.
   */
  static SolverSolution solve(
      String backendName, CanonicalProgram program, List<LinearRow> extraRows, Duration timeLimit) {
    ExpressionsBasedModel model = new ExpressionsBasedModel();
    model.options.time_abort = Math.max(1L, timeLimit.toMillis());

    int size = program.variableCount();
    Variable[] variables = new Variable[size];
    for (int v = 0; v < size; v++) {
      Variable variable = model.addVariable(program.variableName(v));
      if (program.lowerBound(v) != Double.NEGATIVE_INFINITY) {
        variable.lower(program.lowerBound(v));
      }
      if (program.upperBound(v) != Double.POSITIVE_INFINITY) {
        variable.upper(program.upperBound(v));
      }
      variables[v] = variable;
    }

    Expression objective = model.addExpression("objective").weight(1.0);
    for (int v = 0; v < size; v++) {
      double coefficient = program.linearCoefficient(v);
      if (coefficient != 0) {
        objective.set(variables[v], coefficient);
      }
    }
    for (QuadraticTerm term : program.quadraticTerms()) {
      objective.set(variables[term.first()], variables[term.second()], term.coefficient());
    }

    program.rows().forEach(row -> addRow(model, variables, row));
    extraRows.forEach(row -> addRow(model, variables, row));

    Optimisation.Result result = model.minimise();
    Optimisation.State state = result.getState();
    logger.atFine().log(
        "%s finished %s with state %s and value %s",
        backendName, program, state, result.getValue());

    if (toStatus(state).isOptimal()) {
      double[] values = new double[size];
      for (int v = 0; v < size; v++) {
        values[v] = result.doubleValue(v);
      }
      return SolverSolution.optimal(backendName, program.objectiveValue(values), values);
    }
    return SolverSolution.failed(backendName, toStatus(state));
  }

  /** APPROXIMATE counts as optimal. */
  static SolverStatus toStatus(Optimisation.State state) {
    if (state.isOptimal() || state == Optimisation.State.APPROXIMATE) {
      return SolverStatus.OPTIMAL;
    }
    if (state == Optimisation.State.INFEASIBLE) {
      return SolverStatus.INFEASIBLE;
    }
    if (state == Optimisation.State.UNBOUNDED) {
      return SolverStatus.UNBOUNDED;
    }
    return SolverStatus.NUMERICAL_FAILURE;
  }

  private static void addRow(ExpressionsBasedModel model, Variable[] variables, LinearRow row) {
    Expression expression = model.addExpression(row.name());
    for (Map.Entry<Integer, Double> entry : row.coefficients().entrySet()) {
      expression.set(variables[entry.getKey()], entry.getValue());
    }
    if (row.hasLower()) {
      expression.lower(row.lower());
    }
    if (row.hasUpper()) {
      expression.upper(row.upper());
    }
  }
}
