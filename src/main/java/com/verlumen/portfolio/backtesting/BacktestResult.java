package com.verlumen.portfolio.backtesting;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.util.Optional;

/** Chronological rebalance entries of one backtest. */
@AutoValue
public abstract class BacktestResult {
  static BacktestResult create(ImmutableList<BacktestEntry> entries) {
    return new AutoValue_BacktestResult(entries);
  }

  public abstract ImmutableList<BacktestEntry> entries();

  /**
   * Weights in force on {@code date}: those of the latest rebalance on or before it. Weights stay
   * constant between rebalances. Empty before the first rebalance.
   */
  public Optional<ImmutableList<Double>> weightsOn(LocalDate date) {
    ImmutableList<Double> weights = null;
    for (BacktestEntry entry : entries()) {
      if (entry.rebalanceDate().isAfter(date)) {
        break;
      }
      weights = entry.result().weights();
    }
    return Optional.ofNullable(weights);
  }

  public ImmutableList<BacktestEntry> failedEntries() {
    return entries().stream()
        .filter(BacktestEntry::failed)
        .collect(ImmutableList.toImmutableList());
  }
}
