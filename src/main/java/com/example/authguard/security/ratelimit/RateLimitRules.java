package com.example.authguard.security.ratelimit;

import com.example.authguard.exception.RuleNotFoundException;
import com.example.authguard.properties.ApplicationProperties;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Registry of the configured rate limit rules, keyed by rule name.
 */
@Component
public class RateLimitRules {

  public static final String AUTH_SIGN_IN = "auth.signIn";
  public static final String AUTH_SIGN_UP = "auth.signUp";
  public static final String AUTH_RESET_PASSWORD = "auth.resetPassword";
  public static final String API_GENERAL = "api.general";
  public static final String IP_GLOBAL = "ip.global";

  /**
   * Rules the application references directly. Startup fails if any is missing.
   */
  public static final List<String> REQUIRED = List.of(
      AUTH_SIGN_IN, AUTH_SIGN_UP, AUTH_RESET_PASSWORD, API_GENERAL, IP_GLOBAL);

  private final Map<String, RateLimitRule> rules;

  public RateLimitRules(ApplicationProperties properties) {
    Map<String, RateLimitRule> bound = new LinkedHashMap<>();
    properties.security().rateLimit().rules().forEach((name, rule) ->
        bound.put(name, new RateLimitRule(
            name, Duration.ofMillis(rule.windowMs()), rule.maxRequests(), rule.message())));
    this.rules = Collections.unmodifiableMap(bound);
  }

  public RateLimitRule require(String ruleName) {
    RateLimitRule rule = rules.get(ruleName);
    if (rule == null) {
      throw new RuleNotFoundException("Rate limit rule '" + ruleName + "' not found");
    }
    return rule;
  }

  public boolean contains(String ruleName) {
    return rules.containsKey(ruleName);
  }

  public Set<String> names() {
    return rules.keySet();
  }
}
