package com.example.authguard.security;

import com.example.authguard.exception.StoreUnavailableException;
import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.store.CounterBatch;
import com.example.authguard.store.CounterStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Authentication Failure Tracker for brute force protection.
 *
 * <p>Each identifier owns an independent failure counter. A set of identifiers is locked as soon as
 * any one of them reaches the threshold. Counters expire one lockout duration after the first
 * failure and are only reset early by {@link #clear(Collection)}.
 *
 * <p>Store failures fail open: the caller is reported unlocked with the full budget.
 */
@Slf4j
@Component
public class AuthenticationFailureTracker {

  public static final String KEY_PREFIX = "lockout:";
  private static final int STATS_SCAN_LIMIT = 10_000;

  private final CounterStore counterStore;
  private final Clock clock;
  private final boolean enabled;
  private final int maxFailures;
  private final Duration lockoutDuration;

  public AuthenticationFailureTracker(
      CounterStore counterStore, Clock clock, ApplicationProperties properties) {
    ApplicationProperties.SecurityProperties.LockoutProperties lockout = properties.security().lockout();
    this.counterStore = counterStore;
    this.clock = clock;
    this.enabled = lockout.enabled();
    this.maxFailures = lockout.maxFailedAttempts();
    this.lockoutDuration = Duration.ofMinutes(lockout.lockoutDurationMinutes());
  }

  /**
   * Record authentication failure against every identifier.
   *
   * @return attempts remaining before the identifiers lock
   */
  public int recordFailure(Collection<LockoutIdentifier> identifiers) {
    if (!enabled || identifiers.isEmpty()) {
      return maxFailures;
    }
    List<String> keys = keys(identifiers);

    try {
      List<Object> counts = counterStore.batch(batch -> keys.forEach(batch::increment));

      List<String> created = new ArrayList<>();
      long highest = 0;
      for (int i = 0; i < keys.size(); i++) {
        long count = toLong(counts.get(i));
        highest = Math.max(highest, count);
        if (count == 1) {
          created.add(keys.get(i));
        }
      }
      if (!created.isEmpty()) {
        counterStore.batch(batch -> created.forEach(key -> batch.expire(key, lockoutDuration)));
      }

      log.info("Authentication failure recorded for {} (count: {})", mask(identifiers), highest);
      if (highest >= maxFailures) {
        log.warn("Locked {} for up to {} minutes due to repeated failures",
                 mask(identifiers), lockoutDuration.toMinutes());
      }
      return (int) Math.max(0, maxFailures - highest);

    } catch (StoreUnavailableException e) {
      log.error("Error recording authentication failure", e);
      return maxFailures;
    }
  }

  /**
   * Check whether any of the identifiers is locked
   */
  public LockoutStatus isLocked(Collection<LockoutIdentifier> identifiers) {
    if (!enabled || identifiers.isEmpty()) {
      return LockoutStatus.unlocked(maxFailures);
    }
    List<String> keys = keys(identifiers);

    try {
      List<Object> results = counterStore.batch(batch -> keys.forEach(key -> {
        batch.get(key);
        batch.ttl(key);
      }));

      long highest = 0;
      long longestTtlMillis = 0;
      List<String> withoutExpiry = new ArrayList<>();
      for (int i = 0; i < keys.size(); i++) {
        long count = toLong(results.get(2 * i));
        long ttlMillis = toLong(results.get(2 * i + 1));
        if (count > 0 && ttlMillis == CounterBatch.TTL_NO_EXPIRY) {
          // left behind when a writer died between the increment and the expire
          withoutExpiry.add(keys.get(i));
          ttlMillis = lockoutDuration.toMillis();
        }
        highest = Math.max(highest, count);
        longestTtlMillis = Math.max(longestTtlMillis, ttlMillis);
      }
      if (!withoutExpiry.isEmpty()) {
        restoreExpiry(withoutExpiry);
      }

      if (highest < maxFailures) {
        return LockoutStatus.unlocked((int) (maxFailures - highest));
      }

      Duration retryAfter = Duration.ofMillis(longestTtlMillis);
      Instant lockUntil = longestTtlMillis > 0 ? clock.instant().plus(retryAfter) : null;
      log.debug("Lockout active for {} (retry after {}s)", mask(identifiers), retryAfter.toSeconds());
      return new LockoutStatus(true, 0, retryAfter, lockUntil);

    } catch (StoreUnavailableException e) {
      log.error("Error checking lockout status, allowing attempt", e);
      return LockoutStatus.unlocked(maxFailures);
    }
  }

  private void restoreExpiry(List<String> keys) {
    log.warn("Restoring lockout expiry on {} counter(s) that had none", keys.size());
    try {
      counterStore.batch(batch -> keys.forEach(key -> batch.expire(key, lockoutDuration)));
    } catch (StoreUnavailableException e) {
      log.error("Error restoring lockout expiry", e);
    }
  }

  /**
   * Clear failure history. Call only after the identity provider confirmed the credentials.
   */
  public void clear(Collection<LockoutIdentifier> identifiers) {
    if (!enabled || identifiers.isEmpty()) {
      return;
    }
    List<String> keys = keys(identifiers);

    try {
      counterStore.batch(batch -> keys.forEach(batch::delete));
      log.debug("Cleared failure history for {}", mask(identifiers));
    } catch (StoreUnavailableException e) {
      log.error("Error clearing failures", e);
    }
  }

  /**
   * Identifiers currently over the threshold, highest failure count first. Values are masked.
   */
  public List<BlockedIdentifier> topBlocked(int limit) {
    try {
      List<String> keys = counterStore.scan(KEY_PREFIX + "*", STATS_SCAN_LIMIT);
      if (keys.isEmpty()) {
        return List.of();
      }
      List<Object> counts = counterStore.batch(batch -> keys.forEach(batch::get));

      List<BlockedIdentifier> blocked = new ArrayList<>();
      for (int i = 0; i < keys.size(); i++) {
        long count = toLong(counts.get(i));
        if (count >= maxFailures) {
          LockoutIdentifier identifier = LockoutIdentifier.parse(keys.get(i).substring(KEY_PREFIX.length()));
          blocked.add(new BlockedIdentifier(maskIdentifier(identifier), count));
        }
      }
      return blocked.stream()
          .sorted(Comparator.comparingLong(BlockedIdentifier::failures).reversed())
          .limit(limit)
          .toList();

    } catch (StoreUnavailableException e) {
      log.error("Error listing blocked identifiers", e);
      return List.of();
    }
  }

  public int maxFailures() {
    return maxFailures;
  }

  public static String key(LockoutIdentifier identifier) {
    return KEY_PREFIX + identifier.namespace() + ":" + identifier.value();
  }

  private List<String> keys(Collection<LockoutIdentifier> identifiers) {
    return identifiers.stream().map(AuthenticationFailureTracker::key).distinct().toList();
  }

  private long toLong(Object result) {
    if (result instanceof Number number) {
      return number.longValue();
    }
    if (result instanceof String text) {
      try {
        return Long.parseLong(text);
      } catch (NumberFormatException e) {
        log.warn("Ignoring non-numeric lockout counter value");
        return 0;
      }
    }
    return 0;
  }

  private String mask(Collection<LockoutIdentifier> identifiers) {
    return identifiers.stream()
        .map(AuthenticationFailureTracker::maskIdentifier)
        .collect(Collectors.joining(",", "[", "]"));
  }

  private static String maskIdentifier(LockoutIdentifier id) {
    return id.namespace() + ":" + (LockoutIdentifier.IP.equals(id.namespace())
        ? maskIpAddress(id.value())
        : maskValue(id.value()));
  }

  static String maskIpAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }

  private static String maskValue(String value) {
    int at = value.indexOf('@');
    if (at > 0) {
      return value.charAt(0) + "***" + value.substring(at);
    }
    return value.length() > 2 ? value.charAt(0) + "***" : "***";
  }
}
