package com.example.authguard.exception;

import com.example.authguard.security.ratelimit.RateLimitDecision;
import lombok.Getter;

/**
 * Rate Limit Exceeded Exception. Carries the denied decision so the caller can retry correctly.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

  private final transient RateLimitDecision decision;

  public RateLimitExceededException(RateLimitDecision decision) {
    super(decision.message() != null ? decision.message() : "Rate limit exceeded");
    this.decision = decision;
  }
}
