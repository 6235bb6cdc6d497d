package com.example.authguard.security.ratelimit;

import static com.example.authguard.web.rest.ApiConstants.ApiHeader.*;

import jakarta.servlet.http.HttpServletResponse;

/**
 * Writes rate limit state onto a response.
 */
public final class RateLimitHeaders {

  private RateLimitHeaders() {}

  public static void apply(HttpServletResponse response, RateLimitDecision decision) {
    response.setHeader(RATE_LIMIT_LIMIT, String.valueOf(decision.limit()));
    response.setHeader(RATE_LIMIT_REMAINING, String.valueOf(decision.remaining()));
    response.setHeader(RATE_LIMIT_RESET, String.valueOf(decision.resetAt().getEpochSecond()));
    if (!decision.allowed()) {
      response.setHeader(RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
    }
  }
}
