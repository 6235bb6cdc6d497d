package com.example.authguard.web.rest.controller;

import com.example.authguard.security.AuthenticationFailureTracker;
import com.example.authguard.security.BlockedIdentifier;
import com.example.authguard.security.csrf.CsrfTokenStore;
import com.example.authguard.security.ratelimit.RateLimitRule;
import com.example.authguard.security.ratelimit.RateLimitRules;
import com.example.authguard.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class SecurityStatsController implements SecurityStatsAPI {

  private static final int TOP_BLOCKED_LIMIT = 10;

  private final RateLimitRules rateLimitRules;
  private final AuthenticationFailureTracker failureTracker;
  private final SessionService sessionService;
  private final CsrfTokenStore csrfTokenStore;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> securityStats() {
    List<Map<String, Object>> rules = rateLimitRules.names().stream()
        .map(rateLimitRules::require)
        .map(SecurityStatsController::describe)
        .toList();
    List<BlockedIdentifier> blocked = failureTracker.topBlocked(TOP_BLOCKED_LIMIT);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("rateLimitRules", rules);
    body.put("totalBlocked", blocked.size());
    body.put("topBlocked", blocked);
    body.put("sessions", sessionService.stats());
    body.put("activeCsrfTokens", csrfTokenStore.activeTokens());
    body.put("timestamp", clock.millis());
    return ResponseEntity.ok(body);
  }

  private static Map<String, Object> describe(RateLimitRule rule) {
    Map<String, Object> description = new LinkedHashMap<>();
    description.put("name", rule.name());
    description.put("windowMs", rule.windowMs());
    description.put("maxRequests", rule.maxRequests());
    return description;
  }
}
