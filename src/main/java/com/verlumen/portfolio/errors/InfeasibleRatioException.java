package com.verlumen.portfolio.errors;

/**
 * The homogeneous ratio program ended with a normalization scalar at or below zero, so no
 * ratio-maximizing weights can be recovered.
 */
public final class InfeasibleRatioException extends InfeasibleProblemException {
  private final double kappa;

  public InfeasibleRatioException(String backendName, double kappa) {
    super(backendName, "Ratio normalization collapsed (kappa=" + kappa + ")");
    this.kappa = kappa;
  }

  public double kappa() {
    return kappa;
  }
}
