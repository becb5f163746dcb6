package com.verlumen.portfolio.spec;

import java.util.Optional;

/**
 * How the objectives of a spec are turned into a program: the additive quadratic-utility form,
 * or one of the ratio forms solved through homogeneous substitution.
 */
public enum OptimizationMode {
  PLAIN(null),
  MAX_SHARPE_RATIO(RiskMeasure.VARIANCE),
  MAX_ES_RATIO(RiskMeasure.EXPECTED_SHORTFALL),
  MAX_EQS_RATIO(RiskMeasure.EXPECTED_QUADRATIC_SHORTFALL);

  private final RiskMeasure ratioDenominator;

  OptimizationMode(RiskMeasure ratioDenominator) {
    this.ratioDenominator = ratioDenominator;
  }

  public boolean isRatio() {
    return ratioDenominator != null;
  }

  /** Risk measure in the ratio denominator; empty for {@link #PLAIN}. */
  public Optional<RiskMeasure> ratioDenominator() {
    return Optional.ofNullable(ratioDenominator);
  }

  public static OptimizationMode fromString(String name) {
    return OptimizationMode.valueOf(name.toUpperCase());
  }
}
