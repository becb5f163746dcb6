package com.verlumen.portfolio.backtesting;

/** Lifecycle of a backtest as it walks forward through the sample. */
public enum BacktestState {
  /** Not enough history yet for the training length. */
  ACCUMULATING,
  /** Re-optimizing at every scheduled date. */
  REBALANCING,
  /** Every scheduled date has been visited. */
  EXHAUSTED
}
