package com.example.authguard.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the authentication defense service.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid SecurityProperties security,
    @NotNull @Valid IdpProperties idp,
    @NotNull @Valid OkHttpProperties http,
    @NotNull @Valid RedisProperties redis
) {

  /**
   * Defense layer configuration
   */
  public record SecurityProperties(
      @NotNull @Valid RateLimitProperties rateLimit,
      @NotNull @Valid LockoutProperties lockout,
      @NotNull @Valid SessionProperties session,
      @NotNull @Valid CsrfProperties csrf,
      @NotNull @Valid CorsProperties cors
  ) {

    public record RateLimitProperties(
        @DefaultValue("true") boolean enabled,
        @NotEmpty Map<String, @Valid RuleProperties> rules
    ) {
      public record RuleProperties(
          @Positive long windowMs,
          @Positive int maxRequests,
          @DefaultValue("Rate limit exceeded, please try again later") String message
      ) {}
    }

    public record LockoutProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("5") @Positive int maxFailedAttempts,
        @DefaultValue("15") @Positive int lockoutDurationMinutes
    ) {}

    public record SessionProperties(
        @DefaultValue("2592000") @Positive long sessionDurationSeconds,
        @DefaultValue("10") @Positive int maxSessionsPerUser,
        @DefaultValue("app_session") @NotBlank String cookieName,
        @DefaultValue("X-Session-ID") @NotBlank String headerName
    ) {}

    public record CsrfProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("60") @Positive int csrfTokenTtlMinutes,
        @DefaultValue("100000") @Positive int maxTokens,
        @DefaultValue("5m") Duration sweepInterval,
        @DefaultValue("X-CSRF-Token") @NotBlank String headerName,
        @NotNull List<String> exemptPaths
    ) {}

    /**
     * Browser origins allowed to call the API with credentials. Empty means same-origin only.
     */
    public record CorsProperties(
        @NotNull List<String> allowedOrigins,
        @DefaultValue("true") boolean allowCredentials,
        @DefaultValue("24h") Duration maxAge
    ) {}
  }

  /**
   * External identity provider that verifies credentials
   */
  public record IdpProperties(
      @NotBlank String baseUrl,
      @DefaultValue("/auth/v1/token?grant_type=password") String signInPath,
      @DefaultValue("/auth/v1/signup") String signUpPath,
      @DefaultValue("/auth/v1/recover") String recoverPath,
      String apiKey
  ) {}

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost
    ) {}
  }

  /**
   * Redis configuration with cluster support
   */
  public record RedisProperties(
      @DefaultValue("standalone") @Pattern(regexp = "standalone|cluster") String mode,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid SslProperties ssl,
      @Valid ClusterProperties cluster,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record ClusterProperties(
        String nodes,
        @DefaultValue("3") @Min(0) @Max(5) int maxRedirects
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @Positive int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }
}
