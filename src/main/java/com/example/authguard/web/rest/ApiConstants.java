package com.example.authguard.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String INTERNAL_BASE = "/internal";
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String SIGN_IN = "/sign-in";
    public static final String SIGN_UP = "/sign-up";
    public static final String RESET_PASSWORD = "/reset-password";
    public static final String SIGN_OUT = "/sign-out";
    public static final String STATUS = "/status";

    // Session paths
    public static final String SESSION = "/session";
    public static final String SESSIONS = "/sessions";
    public static final String ME = "/me";
    public static final String CSRF = "/csrf";

    // Internal paths
    public static final String SECURITY_STATS = "/security/stats";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  public static final class ApiHeader {
    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";
    public static final String AUTH_ATTEMPTS_REMAINING = "X-Auth-Attempts-Remaining";
    public static final String CSRF_TOKEN = "X-CSRF-Token";

    private ApiHeader() {}
  }

  private ApiConstants() {}
}
