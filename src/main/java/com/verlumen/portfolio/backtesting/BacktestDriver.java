package com.verlumen.portfolio.backtesting;

/** Re-optimizes a spec along a return sample at scheduled rebalance dates. */
public interface BacktestDriver {
  BacktestResult run(BacktestRequest request);
}
