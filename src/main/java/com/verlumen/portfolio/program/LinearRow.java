package com.verlumen.portfolio.program;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** lower <= sum(coefficients[v] * x[v]) <= upper; infinite sides are absent. */
@AutoValue
public abstract class LinearRow {
  public static LinearRow create(
      String name, ImmutableMap<Integer, Double> coefficients, double lower, double upper) {
    return new AutoValue_LinearRow(name, coefficients, lower, upper);
  }

  public abstract String name();

  public abstract ImmutableMap<Integer, Double> coefficients();

  public abstract double lower();

  public abstract double upper();

  public boolean hasLower() {
    return lower() != Double.NEGATIVE_INFINITY;
  }

  public boolean hasUpper() {
    return upper() != Double.POSITIVE_INFINITY;
  }

  public double evaluate(double[] values) {
    double total = 0;
    for (Map.Entry<Integer, Double> entry : coefficients().entrySet()) {
      total += entry.getValue() * values[entry.getKey()];
    }
    return total;
  }
}
