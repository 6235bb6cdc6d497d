package com.example.authguard.config;

import com.example.authguard.exception.RuleNotFoundException;
import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.security.ratelimit.RateLimitRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration validator that enforces rules beyond basic JSR-380 validation.
 * Fails fast at startup: a missing rate limit rule is a configuration bug, not a runtime condition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be at least 1.";
  private static final String HOST_LOCALHOST = "localhost";
  private static final String HOST_LOOPBACK = "127.0.0.1";
  private static final Duration MAX_LOCKOUT_DURATION = Duration.ofHours(24);
  private static final int MAX_FAILED_ATTEMPTS_CEILING = 100;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    boolean rulesMissing = validateRateLimitRules(errors);
    validateLockoutConfig(errors);
    validateSessionConfig(errors);
    validateCsrfConfig(errors);
    validateCorsConfig(errors);
    validateIdpConfig(errors);
    validateHttpConfig(errors);
    validateRedisConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):%n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw rulesMissing ? new RuleNotFoundException(errorMessage) : new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully ({} rate limit rules).",
             properties.security().rateLimit().rules().size());
  }

  /**
   * @return true if a required rule is missing
   */
  private boolean validateRateLimitRules(List<String> errors) {
    Map<String, ApplicationProperties.SecurityProperties.RateLimitProperties.RuleProperties> rules =
        properties.security().rateLimit().rules();

    boolean missing = false;
    for (String required : RateLimitRules.REQUIRED) {
      if (!rules.containsKey(required)) {
        errors.add("Required rate limit rule '%s' is not configured under 'app.security.rate-limit.rules'.".formatted(required));
        missing = true;
      }
    }
    rules.forEach((name, rule) -> {
      if (rule.windowMs() < 1) {
        errors.add(ERROR_MUST_BE_POSITIVE.formatted("Window of rate limit rule '" + name + "'"));
      }
      if (rule.maxRequests() < 1) {
        errors.add(ERROR_MUST_BE_POSITIVE.formatted("Max requests of rate limit rule '" + name + "'"));
      }
    });
    return missing;
  }

  private void validateLockoutConfig(List<String> errors) {
    ApplicationProperties.SecurityProperties.LockoutProperties lockout = properties.security().lockout();
    if (Duration.ofMinutes(lockout.lockoutDurationMinutes()).compareTo(MAX_LOCKOUT_DURATION) > 0) {
      errors.add("Lockout duration (%d min) must not exceed 24 hours.".formatted(lockout.lockoutDurationMinutes()));
    }
    if (lockout.maxFailedAttempts() > MAX_FAILED_ATTEMPTS_CEILING) {
      errors.add("Max failed attempts (%d) must not exceed %d.".formatted(lockout.maxFailedAttempts(), MAX_FAILED_ATTEMPTS_CEILING));
    }
  }

  private void validateSessionConfig(List<String> errors) {
    if (properties.security().session().maxSessionsPerUser() < 1) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Max sessions per user"));
    }
  }

  private void validateCsrfConfig(List<String> errors) {
    ApplicationProperties.SecurityProperties.CsrfProperties csrf = properties.security().csrf();
    long csrfTtlSeconds = csrf.csrfTokenTtlMinutes() * 60L;
    if (csrfTtlSeconds > properties.security().session().sessionDurationSeconds()) {
      errors.add("CSRF token TTL (%d min) must not outlive the session (%d s).".formatted(
          csrf.csrfTokenTtlMinutes(), properties.security().session().sessionDurationSeconds()));
    }
    if (csrf.sweepInterval() == null || csrf.sweepInterval().isZero() || csrf.sweepInterval().isNegative()) {
      errors.add("CSRF sweep interval must be positive.");
    }
    for (String path : csrf.exemptPaths()) {
      if (!path.startsWith("/")) {
        errors.add("CSRF exempt path must start with a '/': " + path);
      }
    }
  }

  private void validateCorsConfig(List<String> errors) {
    ApplicationProperties.SecurityProperties.CorsProperties cors = properties.security().cors();
    for (String origin : cors.allowedOrigins()) {
      if ("*".equals(origin)) {
        if (cors.allowCredentials()) {
          errors.add("CORS wildcard origin cannot be combined with credentials.");
        }
        continue;
      }
      try {
        URI uri = new URI(origin);
        if (uri.getScheme() == null || uri.getHost() == null) {
          errors.add(ERROR_INVALID_URL.formatted("CORS allowed origin", origin));
        }
      } catch (URISyntaxException e) {
        errors.add(ERROR_INVALID_URL.formatted("CORS allowed origin", origin));
      }
    }
  }

  private void validateIdpConfig(List<String> errors) {
    String baseUrl = properties.idp().baseUrl();
    try {
      URI uri = new URI(baseUrl);
      if (uri.getScheme() == null || uri.getHost() == null) {
        errors.add(ERROR_INVALID_URL.formatted("Identity provider base URL", baseUrl));
      } else if ("http".equals(uri.getScheme())
          && !HOST_LOCALHOST.equals(uri.getHost()) && !HOST_LOOPBACK.equals(uri.getHost())) {
        errors.add(ERROR_HTTPS_REQUIRED.formatted("Identity provider base URL", baseUrl));
      }
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URL.formatted("Identity provider base URL", baseUrl));
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void validateRedisConfig(List<String> errors) {
    ApplicationProperties.RedisProperties redis = properties.redis();
    if ("cluster".equals(redis.mode())
        && (redis.cluster() == null || redis.cluster().nodes() == null || redis.cluster().nodes().isBlank())) {
      errors.add("Redis cluster mode requires 'app.redis.cluster.nodes'.");
    }
  }
}
