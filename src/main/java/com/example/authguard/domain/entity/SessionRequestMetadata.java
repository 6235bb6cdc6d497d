package com.example.authguard.domain.entity;

/**
 * Client details captured when a session is created
 */
public record SessionRequestMetadata(String ipAddress, String userAgent) {

  public static SessionRequestMetadata empty() {
    return new SessionRequestMetadata(null, null);
  }
}
