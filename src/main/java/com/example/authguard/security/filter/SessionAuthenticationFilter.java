package com.example.authguard.security.filter;

import com.example.authguard.service.ClientInfoResolver;
import com.example.authguard.service.SessionService;
import com.example.authguard.util.CookieUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates users based on the session cookie or session header.
 * It delegates all session validation logic to the SessionService.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  private final SessionService sessionService;
  private final ClientInfoResolver clientInfoResolver;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    String sessionId = clientInfoResolver.sessionId(request);

    if (sessionId != null) {
      // Expiry, sliding renewal and store failures are all handled by the SessionService.
      Optional<Authentication> authOptional = sessionService.authenticate(sessionId);

      if (authOptional.isPresent()) {
        SecurityContextHolder.getContext().setAuthentication(authOptional.get());
        log.trace("Authenticated session {}", SessionService.maskSessionId(sessionId));
      } else if (clientInfoResolver.hasSessionCookie(request)) {
        log.debug("Invalid session presented, clearing cookie");
        CookieUtil.clearSessionCookie(response, clientInfoResolver.sessionCookieName());
      }
    }

    filterChain.doFilter(request, response);
  }
}
