package com.verlumen.portfolio.backtesting;

import java.time.LocalDate;
import java.time.temporal.IsoFields;

/** Calendar granularity at which a backtest re-optimizes. */
public enum RebalanceFrequency {
  EVERY_PERIOD,
  WEEKS,
  MONTHS,
  QUARTERS,
  YEARS;

  /**
   * Calendar bucket of {@code date}. Two dates share a bucket exactly when no rebalance falls
   * between them.
   */
  long bucketOf(LocalDate date, int index) {
    switch (this) {
      case EVERY_PERIOD:
        return index;
      case WEEKS:
        return date.get(IsoFields.WEEK_BASED_YEAR) * 100L
            + date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
      case MONTHS:
        return date.getYear() * 12L + date.getMonthValue();
      case QUARTERS:
        return date.getYear() * 4L + date.get(IsoFields.QUARTER_OF_YEAR);
      case YEARS:
        return date.getYear();
      default:
        throw new IllegalStateException("Unhandled frequency " + this);
    }
  }

  public static RebalanceFrequency fromString(String name) {
    return RebalanceFrequency.valueOf(name.toUpperCase());
  }
}
