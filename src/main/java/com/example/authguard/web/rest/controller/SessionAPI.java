package com.example.authguard.web.rest.controller;

import static com.example.authguard.web.rest.ApiConstants.ApiPath.*;

import com.example.authguard.domain.entity.SessionInfo;
import com.example.authguard.domain.entity.UserPrincipal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Session management API for the signed-in user.
 */
@Tag(
    name = "Session Management",
    description = "Current user, CSRF issuance and session listing and revocation"
)
@RequestMapping(
    value = API_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Get current user",
      description = "Returns the signed-in user and a fresh CSRF token bound to the session"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "User returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = SESSION + ME)
  ResponseEntity<Map<String, Object>> getCurrentUser(@AuthenticationPrincipal UserPrincipal principal);

  @Operation(
      summary = "Issue CSRF token",
      description = "Replaces any previous token for the current session"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Token issued"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = SESSION + CSRF)
  ResponseEntity<Map<String, Object>> issueCsrfToken(@AuthenticationPrincipal UserPrincipal principal);

  @Operation(
      summary = "List sessions",
      description = "Active sessions of the signed-in user, most recently active first"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = SESSIONS)
  ResponseEntity<List<SessionInfo>> listSessions(@AuthenticationPrincipal UserPrincipal principal);

  @Operation(
      summary = "Revoke a session"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session revoked"),
      @ApiResponse(responseCode = "403", description = "Missing or invalid CSRF token"),
      @ApiResponse(responseCode = "404", description = "No such session for this user")
  })
  @DeleteMapping(value = SESSIONS + "/{sessionId}")
  ResponseEntity<Map<String, Object>> revokeSession(
      @AuthenticationPrincipal UserPrincipal principal,
      @Parameter(description = "Session to revoke", required = true)
      @PathVariable String sessionId,
      HttpServletResponse response
                                                   );

  @Operation(
      summary = "Sign out everywhere",
      description = "Revokes every session of the signed-in user, including the current one"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions revoked"),
      @ApiResponse(responseCode = "403", description = "Missing or invalid CSRF token")
  })
  @DeleteMapping(value = SESSIONS)
  ResponseEntity<Map<String, Object>> revokeAllSessions(
      @AuthenticationPrincipal UserPrincipal principal,
      HttpServletResponse response
                                                       );
}
