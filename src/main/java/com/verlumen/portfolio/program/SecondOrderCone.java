package com.verlumen.portfolio.program;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** ||x[members]||_2 <= x[bound]. */
@AutoValue
public abstract class SecondOrderCone {
  static SecondOrderCone create(String name, ImmutableList<Integer> members, int bound) {
    return new AutoValue_SecondOrderCone(name, members, bound);
  }

  public abstract String name();

  public abstract ImmutableList<Integer> members();

  public abstract int bound();

  /** Euclidean norm of the member values. */
  public double norm(double[] values) {
    double sumOfSquares = 0;
    for (int member : members()) {
      sumOfSquares += values[member] * values[member];
    }
    return Math.sqrt(sumOfSquares);
  }
}
