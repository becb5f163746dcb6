package com.verlumen.portfolio.errors;

/** The chosen backend cannot express the program's LP/QP/SOCP class. */
public final class UnsupportedProblemClassException extends SolverException {
  public UnsupportedProblemClassException(String backendName, String problemClass) {
    super(backendName, "Backend cannot solve " + problemClass + " programs");
  }
}
