package com.verlumen.portfolio.errors;

/**
 * Raised when a portfolio spec, return sample or configuration is malformed. Always
 * thrown before any program is built or solved.
 */
public final class ValidationException extends PortfolioException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  public static ValidationException format(String template, Object... args) {
    return new ValidationException(String.format(template, args));
  }
}
