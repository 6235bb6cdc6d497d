package com.example.authguard.security;

import com.example.authguard.exception.StoreUnavailableException;
import com.example.authguard.store.CounterStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores a request against three heuristics:
 * <ul>
 *   <li>request burst: more than {@value #BURST_THRESHOLD} requests from one IP in a minute (+30)</li>
 *   <li>user agent: missing, shorter than {@value #MIN_USER_AGENT_LENGTH} chars or a bot (+25)</li>
 *   <li>password spraying: more than {@value #SPRAY_THRESHOLD} distinct emails from one IP in 15 minutes (+50)</li>
 * </ul>
 * A score of {@value #SUSPICIOUS_THRESHOLD} or more marks the request suspicious.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuspiciousActivityDetector {

  static final int BURST_THRESHOLD = 60;
  static final int SPRAY_THRESHOLD = 10;
  static final int MIN_USER_AGENT_LENGTH = 10;
  static final int BURST_SCORE = 30;
  static final int USER_AGENT_SCORE = 25;
  static final int SPRAY_SCORE = 50;
  static final int SUSPICIOUS_THRESHOLD = 50;

  static final String REASON_BURST = "Rapid requests from IP";
  static final String REASON_USER_AGENT = "Suspicious user agent";
  static final String REASON_SPRAY = "Password spraying pattern detected";

  private static final Duration BURST_WINDOW = Duration.ofMinutes(1);
  private static final Duration SPRAY_WINDOW = Duration.ofMinutes(15);
  private static final String BURST_PREFIX = "activity:burst:";
  private static final String SPRAY_PREFIX = "activity:spray:";

  private final CounterStore counterStore;
  private final Clock clock;

  /**
   * @param email the attempted email for credential requests, or null
   */
  public RiskAssessment assess(String clientIp, String userAgent, String email) {
    List<String> reasons = new ArrayList<>();
    int score = 0;

    try {
      long now = clock.millis();

      String burstKey = BURST_PREFIX + clientIp + ":" + (now / BURST_WINDOW.toMillis());
      if (counterStore.incrementWithExpiry(burstKey, BURST_WINDOW).count() > BURST_THRESHOLD) {
        reasons.add(REASON_BURST);
        score += BURST_SCORE;
      }

      if (isSuspiciousUserAgent(userAgent)) {
        reasons.add(REASON_USER_AGENT);
        score += USER_AGENT_SCORE;
      }

      if (email != null && !email.isBlank()) {
        String sprayKey = SPRAY_PREFIX + clientIp + ":" + (now / SPRAY_WINDOW.toMillis());
        counterStore.setAdd(sprayKey, email.trim().toLowerCase(Locale.ROOT));
        counterStore.expire(sprayKey, SPRAY_WINDOW);
        if (counterStore.setSize(sprayKey) > SPRAY_THRESHOLD) {
          reasons.add(REASON_SPRAY);
          score += SPRAY_SCORE;
        }
      }

    } catch (StoreUnavailableException e) {
      log.error("Error detecting suspicious activity", e);
      return RiskAssessment.clean();
    }

    RiskAssessment assessment = new RiskAssessment(score >= SUSPICIOUS_THRESHOLD, List.copyOf(reasons), score);
    if (assessment.suspicious()) {
      log.warn("Suspicious activity from {} (score: {}, reasons: {})",
               AuthenticationFailureTracker.maskIpAddress(clientIp), score, reasons);
    }
    return assessment;
  }

  private boolean isSuspiciousUserAgent(String userAgent) {
    if (userAgent == null || userAgent.length() < MIN_USER_AGENT_LENGTH) {
      return true;
    }
    String lower = userAgent.toLowerCase(Locale.ROOT);
    return lower.contains("bot") || lower.contains("crawler");
  }
}
