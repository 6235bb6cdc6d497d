package com.example.authguard.exception;

/**
 * The identity provider refused a sign-up, for example because the email is already registered.
 */
public class RegistrationRejectedException extends RuntimeException {
  public RegistrationRejectedException(String message) {
    super(message);
  }
}
