package com.example.authguard.exception;

/**
 * Raised when the identity provider cannot be reached or answers with an unexpected status.
 */
public class IdentityProviderException extends RuntimeException {
  public IdentityProviderException(String message) {
    super(message);
  }

  public IdentityProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
