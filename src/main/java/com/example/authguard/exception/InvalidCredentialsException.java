package com.example.authguard.exception;

import lombok.Getter;

/**
 * Invalid Credentials Exception
 */
@Getter
public class InvalidCredentialsException extends RuntimeException {

  private final int attemptsRemaining;

  public InvalidCredentialsException(String message, int attemptsRemaining) {
    super(message);
    this.attemptsRemaining = attemptsRemaining;
  }
}
