package com.verlumen.portfolio.returns;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

/**
 * Sample moments of one return window.
 *
 * <p>The covariance uses the T - 1 denominator and is only materialized on request; callers that
 * handle large universes work with the demeaned matrix D instead, using Σ = D'D / (T - 1).
 */
public final class MomentEstimates {
  private final double[] mean;
  private final double[][] demeaned;
  private final Supplier<double[][]> covariance;

  private MomentEstimates(double[] mean, double[][] demeaned) {
    this.mean = mean;
    this.demeaned = demeaned;
    this.covariance = Suppliers.memoize(this::computeCovariance);
  }

  public static MomentEstimates of(ReturnSample window) {
    checkArgument(!window.isEmpty(), "Cannot estimate moments of an empty window");
    int periods = window.periods();
    int assets = window.assets();
    double[] mean = new double[assets];
    for (int i = 0; i < periods; i++) {
      for (int j = 0; j < assets; j++) {
        mean[j] += window.value(i, j);
      }
    }
    for (int j = 0; j < assets; j++) {
      mean[j] /= periods;
    }
    double[][] demeaned = new double[periods][assets];
    for (int i = 0; i < periods; i++) {
      for (int j = 0; j < assets; j++) {
        demeaned[i][j] = window.value(i, j) - mean[j];
      }
    }
    return new MomentEstimates(mean, demeaned);
  }

  public int assets() {
    return mean.length;
  }

  public int periods() {
    return demeaned.length;
  }

  public double mean(int asset) {
    return mean[asset];
  }

  public double[] mean() {
    return mean.clone();
  }

  /** Demeaned return of {@code asset} in {@code period}. */
  public double demeaned(int period, int asset) {
    return demeaned[period][asset];
  }

  /** Divisor applied to D'D; zero when the window has a single observation. */
  public double covarianceScale() {
    return periods() > 1 ? 1.0 / (periods() - 1) : 0.0;
  }

  public double covariance(int i, int j) {
    return covariance.get()[i][j];
  }

  public double portfolioMean(double[] weights) {
    checkArgument(weights.length == mean.length, "Weight vector has wrong length");
    double total = 0;
    for (int j = 0; j < mean.length; j++) {
      total += mean[j] * weights[j];
    }
    return total;
  }

  /** w'Σw computed through the demeaned matrix. */
  public double portfolioVariance(double[] weights) {
    checkArgument(weights.length == mean.length, "Weight vector has wrong length");
    double sumOfSquares = 0;
    for (double[] row : demeaned) {
      double projected = 0;
      for (int j = 0; j < row.length; j++) {
        projected += row[j] * weights[j];
      }
      sumOfSquares += projected * projected;
    }
    return sumOfSquares * covarianceScale();
  }

  private double[][] computeCovariance() {
    int assets = mean.length;
    double scale = covarianceScale();
    double[][] result = new double[assets][assets];
    for (int a = 0; a < assets; a++) {
      for (int b = a; b < assets; b++) {
        double total = 0;
        for (double[] row : demeaned) {
          total += row[a] * row[b];
        }
        result[a][b] = total * scale;
        result[b][a] = result[a][b];
      }
    }
    return result;
  }
}
