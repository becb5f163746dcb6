package com.verlumen.portfolio.returns;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import com.google.common.collect.ImmutableList;
import com.verlumen.portfolio.errors.ValidationException;
import com.verlumen.portfolio.spec.AssetUniverse;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dated T x n matrix of per-period asset returns, columns aligned with an {@link AssetUniverse}.
 *
 * <p>Instances are immutable and safe to share across threads. A missing observation is stored as
 * {@code NaN}; any window that contains one is rejected when sliced.
 */
public final class ReturnSample {
  private final AssetUniverse universe;
  private final ImmutableList<LocalDate> dates;
  private final double[][] rows;

  private ReturnSample(AssetUniverse universe, ImmutableList<LocalDate> dates, double[][] rows) {
    this.universe = universe;
    this.dates = dates;
    this.rows = rows;
  }

  public static ReturnSample create(
      AssetUniverse universe, List<LocalDate> dates, double[][] returns) {
    if (dates.size() != returns.length) {
      throw ValidationException.format(
          "Got %d dates for %d return rows", dates.size(), returns.length);
    }
    double[][] copy = new double[returns.length][];
    for (int i = 0; i < returns.length; i++) {
      if (returns[i].length != universe.size()) {
        throw ValidationException.format(
            "Row %d has %d columns but the universe has %d assets",
            i, returns[i].length, universe.size());
      }
      if (i > 0 && !dates.get(i).isAfter(dates.get(i - 1))) {
        throw ValidationException.format(
            "Dates must be strictly increasing: %s then %s", dates.get(i - 1), dates.get(i));
      }
      copy[i] = returns[i].clone();
    }
    return new ReturnSample(universe, ImmutableList.copyOf(dates), copy);
  }

  public static Builder builder(AssetUniverse universe) {
    return new Builder(universe);
  }

  public AssetUniverse universe() {
    return universe;
  }

  public ImmutableList<LocalDate> dates() {
    return dates;
  }

  public LocalDate date(int period) {
    return dates.get(period);
  }

  /** Number of observations T. */
  public int periods() {
    return rows.length;
  }

  public int assets() {
    return universe.size();
  }

  public double value(int period, int asset) {
    return rows[period][asset];
  }

  public double[] row(int period) {
    return rows[period].clone();
  }

  public boolean isEmpty() {
    return rows.length == 0;
  }

  /**
   * Observations with index in [fromInclusive, toExclusive).
   *
   * @throws ValidationException if the window contains a missing value
   */
  public ReturnSample window(int fromInclusive, int toExclusive) {
    checkPositionIndexes(fromInclusive, toExclusive, rows.length);
    ReturnSample window =
        new ReturnSample(
            universe,
            dates.subList(fromInclusive, toExclusive),
            Arrays.copyOfRange(rows, fromInclusive, toExclusive));
    window.requireComplete();
    return window;
  }

  /** Throws if any value is missing or infinite. */
  public void requireComplete() {
    for (int i = 0; i < rows.length; i++) {
      for (int j = 0; j < rows[i].length; j++) {
        if (!Double.isFinite(rows[i][j])) {
          throw ValidationException.format(
              "Missing return for %s on %s", universe.assetId(j), dates.get(i));
        }
      }
    }
  }

  /** Copy with every return multiplied by {@code factor}. */
  public ReturnSample scaled(double factor) {
    checkArgument(Double.isFinite(factor), "Scale factor must be finite");
    double[][] scaled = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      scaled[i] = new double[rows[i].length];
      for (int j = 0; j < rows[i].length; j++) {
        scaled[i][j] = rows[i][j] * factor;
      }
    }
    return new ReturnSample(universe, dates, scaled);
  }

  /** Copy whose columns follow the order of {@code reordered}, a permutation of the universe. */
  public ReturnSample reorder(AssetUniverse reordered) {
    if (reordered.size() != universe.size()) {
      throw ValidationException.format(
          "Cannot reorder %d assets into %d", universe.size(), reordered.size());
    }
    int[] source = new int[reordered.size()];
    for (int j = 0; j < source.length; j++) {
      source[j] = universe.indexOf(reordered.assetId(j));
    }
    double[][] permuted = new double[rows.length][source.length];
    for (int i = 0; i < rows.length; i++) {
      for (int j = 0; j < source.length; j++) {
        permuted[i][j] = rows[i][source[j]];
      }
    }
    return new ReturnSample(reordered, dates, permuted);
  }

  @Override
  public String toString() {
    return String.format(
        "ReturnSample{assets=%s, periods=%d, first=%s, last=%s}",
        universe.assetIds(),
        rows.length,
        rows.length > 0 ? dates.get(0) : null,
        rows.length > 0 ? dates.get(rows.length - 1) : null);
  }

  /** Accumulates rows in date order. */
  public static final class Builder {
    private final AssetUniverse universe;
    private final List<LocalDate> dates = new ArrayList<>();
    private final List<double[]> rows = new ArrayList<>();

    private Builder(AssetUniverse universe) {
      this.universe = universe;
    }

    public Builder add(LocalDate date, double... returns) {
      dates.add(date);
      rows.add(returns.clone());
      return this;
    }

    public ReturnSample build() {
      return create(universe, dates, rows.toArray(new double[0][]));
    }
  }
}
