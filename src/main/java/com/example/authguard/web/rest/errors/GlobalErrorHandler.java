package com.example.authguard.web.rest.errors;

import static com.example.authguard.web.rest.ApiConstants.ApiHeader.*;

import com.example.authguard.exception.AccountLockedException;
import com.example.authguard.exception.CsrfInvalidException;
import com.example.authguard.exception.IdentityProviderException;
import com.example.authguard.exception.InvalidCredentialsException;
import com.example.authguard.exception.RateLimitExceededException;
import com.example.authguard.exception.RegistrationRejectedException;
import com.example.authguard.exception.SessionException;
import com.example.authguard.exception.StoreUnavailableException;
import com.example.authguard.security.ratelimit.RateLimitDecision;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information.
 * Denials carry what the caller needs to retry (Retry-After, attempts remaining) and nothing more.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalErrorHandler {

  private final ErrorResponseWriter errorResponseWriter;

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(
      RateLimitExceededException ex, HttpServletRequest request) {
    RateLimitDecision decision = ex.getDecision();

    HttpHeaders headers = new HttpHeaders();
    headers.set(RATE_LIMIT_LIMIT, String.valueOf(decision.limit()));
    headers.set(RATE_LIMIT_REMAINING, "0");
    headers.set(RATE_LIMIT_RESET, String.valueOf(decision.resetAt().getEpochSecond()));
    headers.set(RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));

    return respond(HttpStatus.TOO_MANY_REQUESTS, "rate_limit_exceeded", ex.getMessage(), request, headers);
  }

  @ExceptionHandler(AccountLockedException.class)
  public ResponseEntity<Map<String, Object>> handleAccountLocked(
      AccountLockedException ex, HttpServletRequest request) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(RETRY_AFTER, String.valueOf(ex.getStatus().retryAfterSeconds()));
    headers.set(AUTH_ATTEMPTS_REMAINING, "0");

    return respond(HttpStatus.TOO_MANY_REQUESTS, "account_locked", ex.getMessage(), request, headers);
  }

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidCredentials(
      InvalidCredentialsException ex, HttpServletRequest request) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(AUTH_ATTEMPTS_REMAINING, String.valueOf(ex.getAttemptsRemaining()));

    return respond(HttpStatus.UNAUTHORIZED, "invalid_credentials", ex.getMessage(), request, headers);
  }

  @ExceptionHandler(CsrfInvalidException.class)
  public ResponseEntity<Map<String, Object>> handleCsrfInvalid(
      CsrfInvalidException ex, HttpServletRequest request) {
    log.warn("CSRF validation failed for {}", request.getRequestURI());
    return respond(HttpStatus.FORBIDDEN, "invalid_csrf_token", "Invalid or missing CSRF token", request, null);
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, HttpServletRequest request) {
    if (ex.getCause() != null) {
      log.error("Session error", ex);
      return respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
                     "Session service temporarily unavailable", request, null);
    }
    log.debug("Session rejected: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "invalid_session", "Session is invalid or expired", request, null);
  }

  @ExceptionHandler(RegistrationRejectedException.class)
  public ResponseEntity<Map<String, Object>> handleRegistrationRejected(
      RegistrationRejectedException ex, HttpServletRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "registration_rejected", ex.getMessage(), request, null);
  }

  @ExceptionHandler(IdentityProviderException.class)
  public ResponseEntity<Map<String, Object>> handleIdentityProviderException(
      IdentityProviderException ex, HttpServletRequest request) {
    log.error("Identity provider error", ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
                   "Authentication service temporarily unavailable", request, null);
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleStoreUnavailable(
      StoreUnavailableException ex, HttpServletRequest request) {
    log.error("Counter store unavailable", ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
                   "Service temporarily unavailable", request, null);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn("Access denied to {}", request.getRequestURI());
    return respond(HttpStatus.FORBIDDEN, "access_denied", "Access denied", request, null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .collect(Collectors.joining(", "));

    return respond(HttpStatus.BAD_REQUEST, "validation_error", errors, request, null);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "malformed_request", "Request body is missing or malformed", request, null);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                   String.format("Method %s not supported", ex.getMethod()), request, null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, HttpServletRequest request) {
    log.error("Unexpected error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                   "An error occurred processing your request", request, null);
  }

  private ResponseEntity<Map<String, Object>> respond(
      HttpStatus status, String error, String message, HttpServletRequest request, HttpHeaders headers) {
    Map<String, Object> body = errorResponseWriter.body(status, error, message, request.getRequestURI());
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON);
    if (headers != null) {
      builder.headers(headers);
    }
    return builder.body(body);
  }
}
