package com.example.authguard.web.rest.errors;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Handles what happens when someone tries to access a protected endpoint without being logged in.
 *
 * API clients always get a 401 JSON error instead of a redirect to a login page.
 *
 * This is triggered when:
 * - No session cookie or session header is provided
 * - The session is unknown or expired
 * - The session store is unavailable
 */
@Component
@RequiredArgsConstructor
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ErrorResponseWriter errorResponseWriter;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    errorResponseWriter.write(response, HttpStatus.UNAUTHORIZED, "not_authenticated",
                              "Authentication required", request.getRequestURI());
  }
}
