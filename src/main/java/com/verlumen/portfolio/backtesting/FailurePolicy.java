package com.verlumen.portfolio.backtesting;

/** What a backtest records when a rebalance solve fails. */
public enum FailurePolicy {
  /** Keep the weights of the previous entry; NaN weights if there is none. */
  HOLD_PREVIOUS,
  /** Record NaN weights for the failed date. */
  UNDEFINED_WEIGHTS,
  /** Rethrow the failure and stop the run. */
  ABORT;

  public static FailurePolicy fromString(String name) {
    return FailurePolicy.valueOf(name.toUpperCase());
  }
}
