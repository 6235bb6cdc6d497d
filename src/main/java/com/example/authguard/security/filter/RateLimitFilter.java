package com.example.authguard.security.filter;

import com.example.authguard.domain.entity.UserPrincipal;
import com.example.authguard.security.ratelimit.FixedWindowRateLimiter;
import com.example.authguard.security.ratelimit.RateLimitDecision;
import com.example.authguard.security.ratelimit.RateLimitHeaders;
import com.example.authguard.security.ratelimit.RateLimitIdentity;
import com.example.authguard.service.ClientInfoResolver;
import com.example.authguard.web.rest.errors.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Counts every request through the chain against one rate limit rule and rejects it with 429
 * once the window is exhausted.
 *
 * <p>Not a Spring bean: {@code SecurityConfig} places instances into the chains that need them,
 * so the servlet container does not register them a second time.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

  private final FixedWindowRateLimiter rateLimiter;
  private final ClientInfoResolver clientInfoResolver;
  private final ErrorResponseWriter errorResponseWriter;
  private final String ruleName;
  private final boolean ipOnly;

  /**
   * @param ipOnly key by client IP alone instead of IP plus authenticated user
   */
  public RateLimitFilter(
      FixedWindowRateLimiter rateLimiter,
      ClientInfoResolver clientInfoResolver,
      ErrorResponseWriter errorResponseWriter,
      String ruleName,
      boolean ipOnly) {
    this.rateLimiter = rateLimiter;
    this.clientInfoResolver = clientInfoResolver;
    this.errorResponseWriter = errorResponseWriter;
    this.ruleName = ruleName;
    this.ipOnly = ipOnly;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    String clientIp = clientInfoResolver.clientIp(request);
    String identity = ipOnly
        ? RateLimitIdentity.ipOnly(clientIp)
        : RateLimitIdentity.of(clientIp, currentUserId());

    RateLimitDecision decision = rateLimiter.checkAndConsume(ruleName, identity);
    RateLimitHeaders.apply(response, decision);

    if (!decision.allowed()) {
      errorResponseWriter.write(response, HttpStatus.TOO_MANY_REQUESTS, "rate_limit_exceeded",
                                decision.message(), request.getRequestURI());
      return;
    }

    filterChain.doFilter(request, response);
  }

  /**
   * Instances for different rules share this class, so each needs its own marker.
   */
  @Override
  protected String getAlreadyFilteredAttributeName() {
    return RateLimitFilter.class.getName() + "." + ruleName + ALREADY_FILTERED_SUFFIX;
  }

  public String getRuleName() {
    return ruleName;
  }

  private String currentUserId() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null && authentication.getPrincipal() instanceof UserPrincipal principal) {
      return principal.userId();
    }
    return null;
  }
}
