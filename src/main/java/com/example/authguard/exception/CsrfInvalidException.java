package com.example.authguard.exception;

/**
 * Raised when an unsafe request presents a missing, expired or mismatched CSRF token.
 */
public class CsrfInvalidException extends RuntimeException {
  public CsrfInvalidException(String message) {
    super(message);
  }

  public CsrfInvalidException(String message, Throwable cause) {
    super(message, cause);
  }
}
