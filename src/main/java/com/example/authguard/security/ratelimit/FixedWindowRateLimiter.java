package com.example.authguard.security.ratelimit;

import com.example.authguard.exception.StoreUnavailableException;
import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.store.CounterStore;
import com.example.authguard.store.Increment;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fixed-window request counter per rule and caller identity.
 *
 * <p>Windows are aligned to multiples of the rule's window length, so a caller can send up to twice
 * the limit across a boundary. Counting costs one key per identity and window.
 *
 * <p>When the store is unavailable the limiter fails open and logs the failure.
 */
@Slf4j
@Service
public class FixedWindowRateLimiter {

  static final String KEY_PREFIX = "rate:";

  private final CounterStore counterStore;
  private final RateLimitRules rules;
  private final Clock clock;
  private final boolean enabled;

  public FixedWindowRateLimiter(
      CounterStore counterStore,
      RateLimitRules rules,
      Clock clock,
      ApplicationProperties properties) {
    this.counterStore = counterStore;
    this.rules = rules;
    this.clock = clock;
    this.enabled = properties.security().rateLimit().enabled();
  }

  /**
   * Counts one request against {@code ruleName} for {@code identity}.
   *
   * @throws com.example.authguard.exception.RuleNotFoundException if the rule is not configured
   */
  public RateLimitDecision checkAndConsume(String ruleName, String identity) {
    RateLimitRule rule = rules.require(ruleName);

    long now = clock.millis();
    long windowStart = rule.windowStart(now);
    Instant resetAt = Instant.ofEpochMilli(windowStart + rule.windowMs());

    if (!enabled) {
      return RateLimitDecision.allow(rule, rule.maxRequests(), resetAt);
    }

    String key = key(rule, identity, windowStart);
    try {
      Increment increment = counterStore.increment(key);
      counterStore.expireIfFirst(increment, rule.window());

      if (increment.count() > rule.maxRequests()) {
        Duration retryAfter = counterStore.ttl(key)
            .orElseGet(() -> Duration.ofMillis(windowStart + rule.windowMs() - now));
        log.warn("Rate limit '{}' exceeded for {} (count: {}, retry after {}s)",
                 rule.name(), maskIdentity(identity), increment.count(), retryAfter.toSeconds());
        return RateLimitDecision.deny(rule, resetAt, retryAfter);
      }

      return RateLimitDecision.allow(rule, rule.maxRequests() - increment.count(), resetAt);

    } catch (StoreUnavailableException e) {
      log.error("Rate limiting unavailable for rule '{}', allowing request", rule.name(), e);
      return RateLimitDecision.allow(rule, rule.maxRequests(), resetAt);
    }
  }

  static String key(RateLimitRule rule, String identity, long windowStart) {
    return KEY_PREFIX + rule.name() + ":" + identity + ":" + windowStart;
  }

  private String maskIdentity(String identity) {
    if (identity == null || identity.length() < 6) {
      return "***";
    }
    return identity.substring(0, identity.length() / 2) + "***";
  }
}
