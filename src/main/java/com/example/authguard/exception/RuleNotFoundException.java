package com.example.authguard.exception;

/**
 * Raised when a caller references a rate limit rule that was never configured.
 */
public class RuleNotFoundException extends RuntimeException {
  public RuleNotFoundException(String message) {
    super(message);
  }

  public RuleNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
