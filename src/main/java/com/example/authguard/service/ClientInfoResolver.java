package com.example.authguard.service;

import com.example.authguard.domain.entity.SessionRequestMetadata;
import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Service;

/**
 * Extracts caller details from a request: client address, user agent and presented session id.
 */
@Service
public class ClientInfoResolver {

  private static final String UNKNOWN_IP = "unknown";

  private final String sessionCookieName;
  private final String sessionHeaderName;

  public ClientInfoResolver(ApplicationProperties properties) {
    this.sessionCookieName = properties.security().session().cookieName();
    this.sessionHeaderName = properties.security().session().headerName();
  }

  /**
   * Extract client IP address
   */
  public String clientIp(HttpServletRequest request) {
    String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
      return xForwardedFor.split(",")[0].trim();
    }

    String xRealIp = request.getHeader("X-Real-IP");
    if (xRealIp != null && !xRealIp.isEmpty()) {
      return xRealIp;
    }

    String remoteAddr = request.getRemoteAddr();
    return remoteAddr != null ? remoteAddr : UNKNOWN_IP;
  }

  public String userAgent(HttpServletRequest request) {
    return request.getHeader("User-Agent");
  }

  /**
   * Session id from the session cookie, or from the session header for non-browser clients
   *
   * @return the presented id, or null
   */
  public String sessionId(HttpServletRequest request) {
    return CookieUtil.getCookieValue(request, sessionCookieName)
        .orElseGet(() -> {
          String header = request.getHeader(sessionHeaderName);
          return header != null && !header.isBlank() ? header.trim() : null;
        });
  }

  public boolean hasSessionCookie(HttpServletRequest request) {
    return CookieUtil.getCookie(request, sessionCookieName).isPresent();
  }

  public SessionRequestMetadata requestMetadata(HttpServletRequest request) {
    return new SessionRequestMetadata(clientIp(request), userAgent(request));
  }

  public String sessionCookieName() {
    return sessionCookieName;
  }
}
