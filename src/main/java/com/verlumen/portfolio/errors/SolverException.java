package com.verlumen.portfolio.errors;

/** An error attributable to a specific solver backend. */
public abstract class SolverException extends PortfolioException {
  private final String backendName;

  protected SolverException(String backendName, String message) {
    super(message + " [backend=" + backendName + "]");
    this.backendName = backendName;
  }

  protected SolverException(String backendName, String message, Throwable cause) {
    super(message + " [backend=" + backendName + "]", cause);
    this.backendName = backendName;
  }

  /** Name of the backend that was attempted. */
  public String backendName() {
    return backendName;
  }
}
