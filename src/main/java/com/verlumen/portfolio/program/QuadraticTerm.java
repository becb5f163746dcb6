package com.verlumen.portfolio.program;

import com.google.auto.value.AutoValue;

/** coefficient * x[first] * x[second] in the objective. */
@AutoValue
public abstract class QuadraticTerm {
  static QuadraticTerm create(int first, int second, double coefficient) {
    return new AutoValue_QuadraticTerm(first, second, coefficient);
  }

  public abstract int first();

  public abstract int second();

  public abstract double coefficient();
}
