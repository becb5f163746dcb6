package com.verlumen.portfolio.backtesting;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.util.List;

/** Observation indices at which a backtest rebalances: the first observation of every bucket. */
final class RebalanceSchedule {
  private final ImmutableList<Integer> indices;

  private RebalanceSchedule(ImmutableList<Integer> indices) {
    this.indices = indices;
  }

  static RebalanceSchedule of(List<LocalDate> dates, RebalanceFrequency frequency) {
    ImmutableList.Builder<Integer> indices = ImmutableList.builder();
    long previousBucket = 0;
    for (int i = 0; i < dates.size(); i++) {
      long bucket = frequency.bucketOf(dates.get(i), i);
      if (i == 0 || bucket != previousBucket) {
        indices.add(i);
      }
      previousBucket = bucket;
    }
    return new RebalanceSchedule(indices.build());
  }

  ImmutableList<Integer> indices() {
    return indices;
  }

  @Override
  public String toString() {
    return "RebalanceSchedule" + indices;
  }
}
