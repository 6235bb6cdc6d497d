package com.example.authguard.domain.entity;

/**
 * Lightweight copy of a session's bookkeeping fields, stored under {@code session:meta:{id}}.
 * Listing and eviction read only these.
 */
public record SessionMetadata(
    String userId,
    long createdAt,
    long lastAccessedAt,
    long expiresAt,
    String ipAddress,
    String userAgent
) {

  public static SessionMetadata from(SessionRecord record) {
    return new SessionMetadata(record.userId(), record.createdAt(), record.lastAccessedAt(),
        record.expiresAt(), record.ipAddress(), record.userAgent());
  }
}
