package com.example.authguard.domain.entity;

import java.time.Duration;

/**
 * Server-side session state, stored as JSON under {@code session:{id}}.
 * Timestamps are epoch milliseconds.
 */
public record SessionRecord(
    String sessionId,
    String userId,
    String email,
    String role,
    String refreshToken,
    long createdAt,
    long expiresAt,
    long lastAccessedAt,
    String ipAddress,
    String userAgent
) {

  public boolean isExpired(long nowMillis) {
    return nowMillis > expiresAt;
  }

  /**
   * Sliding expiration: a successful read moves both the access time and the expiry forward.
   */
  public SessionRecord touch(long nowMillis, Duration ttl) {
    return new SessionRecord(sessionId, userId, email, role, refreshToken,
        createdAt, nowMillis + ttl.toMillis(), nowMillis, ipAddress, userAgent);
  }

  public SessionRecord withRefreshToken(String newRefreshToken) {
    return new SessionRecord(sessionId, userId, email, role, newRefreshToken,
        createdAt, expiresAt, lastAccessedAt, ipAddress, userAgent);
  }
}
