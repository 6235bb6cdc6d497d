package com.example.authguard.security.ratelimit;

/**
 * Builds the identity part of a rate limit key.
 */
public final class RateLimitIdentity {

  public static final String ANONYMOUS = "anonymous";

  private RateLimitIdentity() {}

  /**
   * Default identity: caller IP plus user id, or {@code anonymous} when unauthenticated.
   */
  public static String of(String clientIp, String userId) {
    String user = (userId == null || userId.isBlank()) ? ANONYMOUS : userId;
    return clientIp + ":" + user;
  }

  /**
   * IP-only identity for abuse control that must not be reset by signing in.
   */
  public static String ipOnly(String clientIp) {
    return clientIp;
  }
}
