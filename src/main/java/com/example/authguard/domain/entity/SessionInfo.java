package com.example.authguard.domain.entity;

/**
 * Session as shown to its owner in the session list.
 */
public record SessionInfo(
    String sessionId,
    long createdAt,
    long lastAccessedAt,
    long expiresAt,
    String ipAddress,
    String userAgent,
    boolean current
) {}
