package com.example.authguard.security.filter;

import com.example.authguard.exception.CsrfInvalidException;
import com.example.authguard.properties.ApplicationProperties;
import com.example.authguard.security.csrf.CsrfTokenStore;
import com.example.authguard.service.ClientInfoResolver;
import com.example.authguard.service.SessionService;
import com.example.authguard.web.rest.errors.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Requires a valid CSRF token, bound to the presented session, on every state-changing request
 * outside the exempt paths.
 */
@Slf4j
public class CsrfProtectionFilter extends OncePerRequestFilter {

  private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");
  private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();

  private final CsrfTokenStore csrfTokenStore;
  private final ClientInfoResolver clientInfoResolver;
  private final ErrorResponseWriter errorResponseWriter;
  private final boolean enabled;
  private final String headerName;
  private final List<String> exemptPaths;

  public CsrfProtectionFilter(
      CsrfTokenStore csrfTokenStore,
      ClientInfoResolver clientInfoResolver,
      ErrorResponseWriter errorResponseWriter,
      ApplicationProperties properties) {
    ApplicationProperties.SecurityProperties.CsrfProperties csrf = properties.security().csrf();
    this.csrfTokenStore = csrfTokenStore;
    this.clientInfoResolver = clientInfoResolver;
    this.errorResponseWriter = errorResponseWriter;
    this.enabled = csrf.enabled();
    this.headerName = csrf.headerName();
    this.exemptPaths = List.copyOf(csrf.exemptPaths());
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if (!enabled || SAFE_METHODS.contains(request.getMethod())) {
      return true;
    }
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return exemptPaths.stream().anyMatch(pattern -> PATH_MATCHER.match(pattern, path));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    String sessionId = clientInfoResolver.sessionId(request);
    String token = request.getHeader(headerName);

    try {
      csrfTokenStore.requireValid(sessionId, token);
    } catch (CsrfInvalidException e) {
      log.warn("CSRF validation failed for {} {} (session: {}, token present: {})",
               request.getMethod(), request.getRequestURI(),
               SessionService.maskSessionId(sessionId), token != null);
      errorResponseWriter.write(response, HttpStatus.FORBIDDEN, "invalid_csrf_token",
                                e.getMessage(), request.getRequestURI());
      return;
    }

    filterChain.doFilter(request, response);
  }
}
