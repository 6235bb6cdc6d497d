package com.example.authguard.security.csrf;

import com.example.authguard.exception.CsrfInvalidException;
import com.example.authguard.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Process-local CSRF tokens bound one-to-one to session ids.
 *
 * <p>Issuing a token replaces the previous one for the same session. Entries are kept in a
 * size-bounded Caffeine map; expiry is checked against the injected clock on every verify and
 * swept periodically.
 */
@Slf4j
@Component
public class CsrfTokenStore {

  static final int TOKEN_BYTES = 32;
  static final int TOKEN_LENGTH = TOKEN_BYTES * 2;

  private static final HexFormat HEX = HexFormat.of();
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final Clock clock;
  private final Duration tokenTtl;
  private final Duration sweepInterval;
  private final Cache<String, CsrfTokenEntry> tokens;
  private final AtomicLong lastSweep;

  public CsrfTokenStore(Clock clock, ApplicationProperties properties) {
    ApplicationProperties.SecurityProperties.CsrfProperties csrf = properties.security().csrf();
    this.clock = clock;
    this.tokenTtl = Duration.ofMinutes(csrf.csrfTokenTtlMinutes());
    this.sweepInterval = csrf.sweepInterval();
    this.tokens = Caffeine.newBuilder()
        .maximumSize(csrf.maxTokens())
        .executor(Runnable::run)
        .build();
    this.lastSweep = new AtomicLong(clock.millis());
  }

  /**
   * Issue a fresh token for the session, replacing any previous one
   */
  public String issue(String sessionId) {
    sweepIfDue();

    byte[] bytes = new byte[TOKEN_BYTES];
    SECURE_RANDOM.nextBytes(bytes);
    String token = HEX.formatHex(bytes);

    tokens.put(sessionId, new CsrfTokenEntry(sessionId, token, clock.millis() + tokenTtl.toMillis()));
    return token;
  }

  /**
   * @return true only if the session holds an unexpired token equal to {@code presentedToken}
   */
  public boolean verify(String sessionId, String presentedToken) {
    if (sessionId == null || presentedToken == null || presentedToken.length() != TOKEN_LENGTH) {
      return false;
    }

    CsrfTokenEntry entry = tokens.getIfPresent(sessionId);
    if (entry == null) {
      return false;
    }
    if (entry.isExpired(clock.millis())) {
      // a concurrent re-issue replaces the entry, so only this snapshot may go
      tokens.asMap().remove(sessionId, entry);
      return false;
    }

    byte[] expected = entry.token().getBytes(StandardCharsets.US_ASCII);
    byte[] presented = presentedToken.getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, presented);
  }

  /**
   * @throws CsrfInvalidException unless {@link #verify} accepts the token
   */
  public void requireValid(String sessionId, String presentedToken) {
    if (!verify(sessionId, presentedToken)) {
      throw new CsrfInvalidException("Invalid or missing CSRF token");
    }
  }

  public void invalidate(String sessionId) {
    if (sessionId != null) {
      tokens.invalidate(sessionId);
    }
  }

  /**
   * Remove expired entries
   *
   * @return number of entries removed
   */
  @Scheduled(fixedDelayString = "${app.security.csrf.sweep-interval:PT5M}")
  public int sweep() {
    long now = clock.millis();
    lastSweep.set(now);

    int removed = 0;
    for (CsrfTokenEntry entry : tokens.asMap().values()) {
      if (entry.isExpired(now) && tokens.asMap().remove(entry.sessionId(), entry)) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Swept {} expired CSRF tokens", removed);
    }
    return removed;
  }

  public long activeTokens() {
    tokens.cleanUp();
    return tokens.estimatedSize();
  }

  private void sweepIfDue() {
    long last = lastSweep.get();
    if (clock.millis() - last >= sweepInterval.toMillis() && lastSweep.compareAndSet(last, clock.millis())) {
      sweep();
    }
  }
}
