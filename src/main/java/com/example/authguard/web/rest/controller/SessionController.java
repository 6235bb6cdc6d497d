package com.example.authguard.web.rest.controller;

import com.example.authguard.domain.entity.SessionInfo;
import com.example.authguard.domain.entity.UserPrincipal;
import com.example.authguard.exception.SessionException;
import com.example.authguard.security.csrf.CsrfTokenStore;
import com.example.authguard.service.ClientInfoResolver;
import com.example.authguard.service.SessionService;
import com.example.authguard.util.CookieUtil;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session management REST controller.
 * The principal is placed in the security context by the session authentication filter.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionService sessionService;
  private final CsrfTokenStore csrfTokenStore;
  private final ClientInfoResolver clientInfoResolver;

  @Override
  public ResponseEntity<Map<String, Object>> getCurrentUser(UserPrincipal principal) {
    requirePrincipal(principal);

    Map<String, Object> user = new LinkedHashMap<>();
    user.put("userId", principal.userId());
    user.put("email", principal.email());
    user.put("role", principal.role());
    user.put("loginTime", principal.loginTime());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("user", user);
    body.put("csrfToken", csrfTokenStore.issue(principal.sessionId()));
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> issueCsrfToken(UserPrincipal principal) {
    requirePrincipal(principal);
    return ResponseEntity.ok(Map.of("csrfToken", csrfTokenStore.issue(principal.sessionId())));
  }

  @Override
  public ResponseEntity<List<SessionInfo>> listSessions(UserPrincipal principal) {
    requirePrincipal(principal);
    return ResponseEntity.ok(sessionService.listForUser(principal.userId(), principal.sessionId()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> revokeSession(UserPrincipal principal, String sessionId,
                                                           HttpServletResponse response) {
    requirePrincipal(principal);

    boolean owned = sessionService.listForUser(principal.userId(), principal.sessionId()).stream()
        .anyMatch(session -> session.sessionId().equals(sessionId));
    if (!owned) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
          "success", false,
          "message", "Session not found"
                                                                    ));
    }

    boolean revoked = sessionService.delete(sessionId);
    csrfTokenStore.invalidate(sessionId);
    if (sessionId.equals(principal.sessionId())) {
      CookieUtil.clearSessionCookie(response, clientInfoResolver.sessionCookieName());
    }

    log.info("User {} revoked session {}", principal.userId(), SessionService.maskSessionId(sessionId));
    return ResponseEntity.ok(Map.of("success", revoked));
  }

  @Override
  public ResponseEntity<Map<String, Object>> revokeAllSessions(UserPrincipal principal,
                                                               HttpServletResponse response) {
    requirePrincipal(principal);

    List<SessionInfo> sessions = sessionService.listForUser(principal.userId(), principal.sessionId());
    int revoked = sessionService.deleteAllForUser(principal.userId());
    sessions.forEach(session -> csrfTokenStore.invalidate(session.sessionId()));
    csrfTokenStore.invalidate(principal.sessionId());
    CookieUtil.clearSessionCookie(response, clientInfoResolver.sessionCookieName());

    log.info("User {} signed out everywhere ({} sessions)", principal.userId(), revoked);
    return ResponseEntity.ok(Map.of(
        "success", true,
        "revoked", revoked
                                   ));
  }

  private static void requirePrincipal(UserPrincipal principal) {
    if (principal == null) {
      throw new SessionException("Session not found or expired");
    }
  }
}
