package com.verlumen.portfolio.solver;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/** Values of every program variable plus status, as reported by one backend. */
@AutoValue
public abstract class SolverSolution {
  public static SolverSolution optimal(String backendName, double objectiveValue, double[] values) {
    return new AutoValue_SolverSolution(
        backendName,
        SolverStatus.OPTIMAL,
        objectiveValue,
        ImmutableList.copyOf(Doubles.asList(values)));
  }

  public static SolverSolution failed(String backendName, SolverStatus status) {
    return new AutoValue_SolverSolution(backendName, status, Double.NaN, ImmutableList.of());
  }

  public abstract String backendName();

  public abstract SolverStatus status();

  public abstract double objectiveValue();

  public abstract ImmutableList<Double> values();

  public double value(int variable) {
    return values().get(variable);
  }

  public double[] valuesArray() {
    return Doubles.toArray(values());
  }
}
