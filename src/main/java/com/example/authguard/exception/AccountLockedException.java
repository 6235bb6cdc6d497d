package com.example.authguard.exception;

import com.example.authguard.security.LockoutStatus;
import lombok.Getter;

/**
 * Account Locked Exception
 */
@Getter
public class AccountLockedException extends RuntimeException {

  private final transient LockoutStatus status;

  public AccountLockedException(LockoutStatus status) {
    super("Account temporarily locked due to too many failed attempts. Try again in "
              + status.retryAfterSeconds() + " seconds.");
    this.status = status;
  }
}
