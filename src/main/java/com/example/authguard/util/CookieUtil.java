package com.example.authguard.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Cookie Utility for secure session management
 * Uses Spring's ResponseCookie builder for proper cookie handling
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String COOKIE_PATH = "/";
  private static final String SAME_SITE_STRICT = "Strict";

  /**
   * Extract cookie by name using Spring's WebUtils
   *
   * @param request HTTP request
   * @param name cookie name
   * @return Optional containing the cookie if found
   */
  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name));
  }

  /**
   * Get non-empty cookie value
   */
  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    return getCookie(request, name)
        .map(Cookie::getValue)
        .filter(value -> !value.isEmpty());
  }

  /**
   * Set secure session cookie. Session ids are base64url, so the value needs no encoding.
   *
   * @param response HTTP response
   * @param name cookie name
   * @param sessionId session identifier
   * @param maxAge cookie lifetime, normally the session duration
   */
  public static void setSessionCookie(HttpServletResponse response, String name,
                                      String sessionId, Duration maxAge) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Session ID cannot be null or empty");
    }

    ResponseCookie cookie = ResponseCookie
        .from(name, sessionId)
        .httpOnly(true)
        .secure(true)
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .sameSite(SAME_SITE_STRICT)
        .build();

    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    log.debug("Set session cookie: name={}, maxAge={}s", name, maxAge.toSeconds());
  }

  /**
   * Clear session cookie properly
   */
  public static void clearSessionCookie(HttpServletResponse response, String name) {
    ResponseCookie cookie = ResponseCookie
        .from(name, "")
        .httpOnly(true)
        .secure(true)
        .path(COOKIE_PATH)
        .maxAge(0) // Immediate expiration
        .sameSite(SAME_SITE_STRICT)
        .build();

    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    log.debug("Cleared session cookie: name={}", name);
  }
}
