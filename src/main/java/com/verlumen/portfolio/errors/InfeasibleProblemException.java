package com.verlumen.portfolio.errors;

/** The backend reported the program as infeasible or unbounded. */
public class InfeasibleProblemException extends SolverException {
  public InfeasibleProblemException(String backendName, String message) {
    super(backendName, message);
  }
}
