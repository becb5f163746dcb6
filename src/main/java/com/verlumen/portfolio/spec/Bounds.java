package com.verlumen.portfolio.spec;

import com.google.auto.value.AutoValue;
import com.verlumen.portfolio.errors.ValidationException;

/** Closed interval [lower, upper]; either side may be infinite. */
@AutoValue
public abstract class Bounds {
  public static Bounds of(double lower, double upper) {
    if (Double.isNaN(lower) || Double.isNaN(upper)) {
      throw new ValidationException("Bounds cannot be NaN");
    }
    if (lower > upper) {
      throw ValidationException.format("Conflicting bounds: lower %s > upper %s", lower, upper);
    }
    return new AutoValue_Bounds(lower, upper);
  }

  public static Bounds exactly(double value) {
    return of(value, value);
  }

  public static Bounds atLeast(double lower) {
    return of(lower, Double.POSITIVE_INFINITY);
  }

  public static Bounds atMost(double upper) {
    return of(Double.NEGATIVE_INFINITY, upper);
  }

  public abstract double lower();

  public abstract double upper();

  public boolean hasLower() {
    return lower() != Double.NEGATIVE_INFINITY;
  }

  public boolean hasUpper() {
    return upper() != Double.POSITIVE_INFINITY;
  }

  public boolean isEquality() {
    return lower() == upper();
  }

  public boolean contains(double value, double tolerance) {
    return value >= lower() - tolerance && value <= upper() + tolerance;
  }
}
