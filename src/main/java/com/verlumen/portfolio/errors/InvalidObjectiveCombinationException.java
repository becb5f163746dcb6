package com.verlumen.portfolio.errors;

/** A ratio mode was requested without exactly one return and one matching risk objective. */
public final class InvalidObjectiveCombinationException extends PortfolioException {
  public InvalidObjectiveCombinationException(String message) {
    super(message);
  }
}
