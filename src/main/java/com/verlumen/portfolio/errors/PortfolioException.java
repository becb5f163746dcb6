package com.verlumen.portfolio.errors;

/** Base type of every error raised by the portfolio engine. */
public abstract class PortfolioException extends RuntimeException {
  protected PortfolioException(String message) {
    super(message);
  }

  protected PortfolioException(String message, Throwable cause) {
    super(message, cause);
  }
}
