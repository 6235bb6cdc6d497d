package com.example.authguard.security.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one {@link FixedWindowRateLimiter#checkAndConsume} call.
 */
public record RateLimitDecision(
    String ruleName,
    boolean allowed,
    int limit,
    long remaining,
    Instant resetAt,
    Duration retryAfter,
    String message
) {

  public static RateLimitDecision allow(RateLimitRule rule, long remaining, Instant resetAt) {
    return new RateLimitDecision(rule.name(), true, rule.maxRequests(), remaining, resetAt, Duration.ZERO, null);
  }

  public static RateLimitDecision deny(RateLimitRule rule, Instant resetAt, Duration retryAfter) {
    return new RateLimitDecision(rule.name(), false, rule.maxRequests(), 0, resetAt, retryAfter, rule.message());
  }

  /**
   * Whole seconds for the {@code Retry-After} header, rounded up.
   */
  public long retryAfterSeconds() {
    long millis = retryAfter.toMillis();
    return (millis + 999) / 1000;
  }
}
