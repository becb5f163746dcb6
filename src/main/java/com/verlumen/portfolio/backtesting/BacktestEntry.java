package com.verlumen.portfolio.backtesting;

import com.google.auto.value.AutoValue;
import com.verlumen.portfolio.optimizer.OptimizationResult;
import java.time.LocalDate;

/** Weights chosen at one rebalance date, fitted on {@code [windowStart, windowEnd)}. */
@AutoValue
public abstract class BacktestEntry {
  static BacktestEntry create(
      LocalDate rebalanceDate, int windowStart, int windowEnd, OptimizationResult result) {
    return new AutoValue_BacktestEntry(rebalanceDate, windowStart, windowEnd, result);
  }

  public abstract LocalDate rebalanceDate();

  public abstract int windowStart();

  /** Exclusive; also the index of the rebalance observation. */
  public abstract int windowEnd();

  public abstract OptimizationResult result();

  public boolean failed() {
    return !result().isOptimal();
  }
}
