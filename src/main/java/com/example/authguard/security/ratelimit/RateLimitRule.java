package com.example.authguard.security.ratelimit;

import java.time.Duration;

/**
 * Named fixed-window limit. Bound once from configuration and never changed afterwards.
 */
public record RateLimitRule(
    String name,
    Duration window,
    int maxRequests,
    String message
) {

  public long windowMs() {
    return window.toMillis();
  }

  /**
   * Start of the window containing {@code nowMs}: {@code floor(now / window) * window}.
   */
  public long windowStart(long nowMs) {
    return Math.floorDiv(nowMs, windowMs()) * windowMs();
  }
}
