package com.example.authguard.exception;

/**
 * Raised when the shared counter store cannot be reached or times out.
 */
public class StoreUnavailableException extends RuntimeException {
  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
