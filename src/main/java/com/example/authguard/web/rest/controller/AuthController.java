package com.example.authguard.web.rest.controller;

import static com.example.authguard.security.ratelimit.RateLimitRules.AUTH_RESET_PASSWORD;
import static com.example.authguard.security.ratelimit.RateLimitRules.AUTH_SIGN_IN;
import static com.example.authguard.security.ratelimit.RateLimitRules.AUTH_SIGN_UP;

import com.example.authguard.adapter.idp.IdpClient;
import com.example.authguard.adapter.idp.dto.IdpSignInResult;
import com.example.authguard.adapter.idp.dto.IdpSignUpResult;
import com.example.authguard.domain.entity.SessionRecord;
import com.example.authguard.exception.AccountLockedException;
import com.example.authguard.exception.InvalidCredentialsException;
import com.example.authguard.exception.RateLimitExceededException;
import com.example.authguard.exception.RegistrationRejectedException;
import com.example.authguard.security.AuthenticationFailureTracker;
import com.example.authguard.security.LockoutIdentifier;
import com.example.authguard.security.LockoutStatus;
import com.example.authguard.security.RiskAssessment;
import com.example.authguard.security.SuspiciousActivityDetector;
import com.example.authguard.security.csrf.CsrfTokenStore;
import com.example.authguard.security.ratelimit.FixedWindowRateLimiter;
import com.example.authguard.security.ratelimit.RateLimitDecision;
import com.example.authguard.security.ratelimit.RateLimitHeaders;
import com.example.authguard.security.ratelimit.RateLimitIdentity;
import com.example.authguard.service.ClientInfoResolver;
import com.example.authguard.service.SessionService;
import com.example.authguard.util.CookieUtil;
import com.example.authguard.web.rest.dto.PasswordResetRequest;
import com.example.authguard.web.rest.dto.SignInRequest;
import com.example.authguard.web.rest.dto.SignUpRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for credential endpoints.
 *
 * <p>Sign-in order: rate limit, risk assessment, lockout check, credential check with the
 * identity provider, then failure bookkeeping and session creation. Lockout is checked before
 * the provider is ever called.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final FixedWindowRateLimiter rateLimiter;
  private final AuthenticationFailureTracker failureTracker;
  private final SuspiciousActivityDetector activityDetector;
  private final IdpClient idpClient;
  private final SessionService sessionService;
  private final CsrfTokenStore csrfTokenStore;
  private final ClientInfoResolver clientInfoResolver;

  @Override
  public ResponseEntity<Map<String, Object>> signIn(SignInRequest body,
                                                    HttpServletRequest request,
                                                    HttpServletResponse response) {
    String clientIp = clientInfoResolver.clientIp(request);
    String email = normalizeEmail(body.email());

    enforceRateLimit(AUTH_SIGN_IN, clientIp, response);

    RiskAssessment risk = activityDetector.assess(clientIp, clientInfoResolver.userAgent(request), email);
    if (risk.suspicious()) {
      log.warn("Sign-in attempt flagged as suspicious (score: {}, reasons: {})", risk.riskScore(), risk.reasons());
    }

    List<LockoutIdentifier> identifiers = lockoutIdentifiers(email, clientIp);
    enforceNotLocked(identifiers);

    IdpSignInResult result = idpClient.signIn(email, body.password());
    if (!result.authenticated()) {
      int remaining = failureTracker.recordFailure(identifiers);
      throw new InvalidCredentialsException("Invalid email or password", remaining);
    }

    failureTracker.clear(identifiers);

    String sessionId = sessionService.create(result.userId(), result.email(), result.role(),
                                             result.refreshToken(), clientInfoResolver.requestMetadata(request));
    CookieUtil.setSessionCookie(response, clientInfoResolver.sessionCookieName(), sessionId,
                                sessionService.sessionTtl());
    String csrfToken = csrfTokenStore.issue(sessionId);

    log.info("User {} signed in", result.userId());

    Map<String, Object> user = new LinkedHashMap<>();
    user.put("userId", result.userId());
    user.put("email", result.email());
    user.put("role", result.role());

    Map<String, Object> responseBody = new LinkedHashMap<>();
    responseBody.put("success", true);
    responseBody.put("user", user);
    responseBody.put("sessionId", sessionId);
    responseBody.put("csrfToken", csrfToken);
    return ResponseEntity.ok(responseBody);
  }

  @Override
  public ResponseEntity<Map<String, Object>> signUp(SignUpRequest body,
                                                    HttpServletRequest request,
                                                    HttpServletResponse response) {
    String clientIp = clientInfoResolver.clientIp(request);
    String email = normalizeEmail(body.email());

    enforceRateLimit(AUTH_SIGN_UP, clientIp, response);

    List<LockoutIdentifier> identifiers = lockoutIdentifiers(email, clientIp);
    enforceNotLocked(identifiers);

    IdpSignUpResult result = idpClient.signUp(email, body.password(), body.displayName());
    if (!result.created()) {
      failureTracker.recordFailure(identifiers);
      throw new RegistrationRejectedException(result.error() != null ? result.error() : "Registration failed");
    }

    failureTracker.clear(identifiers);
    log.info("User {} registered", result.userId());

    Map<String, Object> responseBody = new LinkedHashMap<>();
    responseBody.put("success", true);
    responseBody.put("userId", result.userId());
    responseBody.put("message", "Please check your email to confirm your account");
    return ResponseEntity.status(HttpStatus.CREATED).body(responseBody);
  }

  @Override
  public ResponseEntity<Map<String, Object>> resetPassword(PasswordResetRequest body,
                                                           HttpServletRequest request,
                                                           HttpServletResponse response) {
    enforceRateLimit(AUTH_RESET_PASSWORD, clientInfoResolver.clientIp(request), response);

    idpClient.requestPasswordReset(normalizeEmail(body.email()));

    return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
        "success", true,
        "message", "If an account exists for this email, a reset link has been sent"
                                                                 ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> signOut(HttpServletRequest request,
                                                     HttpServletResponse response) {
    String sessionId = clientInfoResolver.sessionId(request);
    if (sessionId != null) {
      sessionService.delete(sessionId);
      csrfTokenStore.invalidate(sessionId);
    }
    CookieUtil.clearSessionCookie(response, clientInfoResolver.sessionCookieName());

    return ResponseEntity.ok(Map.of(
        "success", true,
        "message", "Signed out"
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> status(HttpServletRequest request) {
    Optional<SessionRecord> session = Optional.ofNullable(clientInfoResolver.sessionId(request))
        .flatMap(sessionService::get);

    Map<String, Object> responseBody = new LinkedHashMap<>();
    responseBody.put("authenticated", session.isPresent());
    session.ifPresent(record -> {
      responseBody.put("userId", record.userId());
      responseBody.put("expiresAt", record.expiresAt());
    });
    return ResponseEntity.ok(responseBody);
  }

  private void enforceRateLimit(String ruleName, String clientIp, HttpServletResponse response) {
    RateLimitDecision decision = rateLimiter.checkAndConsume(ruleName, RateLimitIdentity.of(clientIp, null));
    if (!decision.allowed()) {
      throw new RateLimitExceededException(decision);
    }
    RateLimitHeaders.apply(response, decision);
  }

  private void enforceNotLocked(List<LockoutIdentifier> identifiers) {
    LockoutStatus status = failureTracker.isLocked(identifiers);
    if (status.locked()) {
      throw new AccountLockedException(status);
    }
  }

  private static List<LockoutIdentifier> lockoutIdentifiers(String email, String clientIp) {
    return List.of(LockoutIdentifier.email(email), LockoutIdentifier.ip(clientIp));
  }

  private static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
