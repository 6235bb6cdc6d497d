package com.example.authguard.security;

import java.time.Duration;
import java.time.Instant;

/**
 * Combined lock state across a set of identifiers.
 *
 * @param lockUntil present only when locked and the store reported a TTL
 */
public record LockoutStatus(
    boolean locked,
    int attemptsRemaining,
    Duration retryAfter,
    Instant lockUntil
) {

  public static LockoutStatus unlocked(int attemptsRemaining) {
    return new LockoutStatus(false, attemptsRemaining, Duration.ZERO, null);
  }

  public long retryAfterSeconds() {
    return (retryAfter.toMillis() + 999) / 1000;
  }
}
