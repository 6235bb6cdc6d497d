package com.example.authguard.security.csrf;

/**
 * One active token per session; expiresAt is epoch milliseconds.
 */
record CsrfTokenEntry(String sessionId, String token, long expiresAt) {

  boolean isExpired(long nowMillis) {
    return nowMillis >= expiresAt;
  }
}
