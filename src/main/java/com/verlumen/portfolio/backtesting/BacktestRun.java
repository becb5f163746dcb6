package com.verlumen.portfolio.backtesting;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.FluentLogger;

/** Tracks the {@link BacktestState} of one run. Confined to the thread driving the run. */
final class BacktestRun {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int trainingLength;
  private BacktestState state = BacktestState.ACCUMULATING;

  BacktestRun(int trainingLength) {
    this.trainingLength = trainingLength;
  }

  BacktestState state() {
    return state;
  }

  /**
   * Records a scheduled rebalance whose window holds {@code windowSize} observations and returns
   * whether a solve is due.
   */
  boolean visit(int index, int windowSize) {
    checkState(state != BacktestState.EXHAUSTED, "Backtest run already exhausted");
    if (windowSize < trainingLength) {
      logger.atFine().log(
          "Skipping index %d: %d observations, need %d", index, windowSize, trainingLength);
      return false;
    }
    if (state == BacktestState.ACCUMULATING) {
      logger.atFine().log("Training length reached at index %d", index);
      state = BacktestState.REBALANCING;
    }
    return true;
  }

  void finish() {
    state = BacktestState.EXHAUSTED;
  }
}
