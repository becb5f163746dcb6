package com.verlumen.portfolio.errors;

/** The backend timed out or failed to converge. Never retried unless configured. */
public final class SolverFailureException extends SolverException {
  /** Why the backend gave up. */
  public enum Reason {
    TIMEOUT,
    NUMERICAL_FAILURE
  }

  private final Reason reason;

  public SolverFailureException(String backendName, Reason reason, String message) {
    super(backendName, message);
    this.reason = reason;
  }

  public SolverFailureException(
      String backendName, Reason reason, String message, Throwable cause) {
    super(backendName, message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
