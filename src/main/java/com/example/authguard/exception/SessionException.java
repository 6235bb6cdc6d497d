package com.example.authguard.exception;

/**
 * Session Exception. Missing, expired or unwritable sessions; always means "not authenticated".
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }

  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
