package com.example.authguard.web.rest.controller;

import static com.example.authguard.web.rest.ApiConstants.ApiPath.*;

import com.example.authguard.web.rest.dto.PasswordResetRequest;
import com.example.authguard.web.rest.dto.SignInRequest;
import com.example.authguard.web.rest.dto.SignUpRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Authentication",
    description = "Credential endpoints guarded by rate limiting and brute-force lockout"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Sign in with email and password",
      description = "Verifies credentials with the identity provider, creates a session and issues a CSRF token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Signed in, session cookie set"),
      @ApiResponse(responseCode = "400", description = "Invalid request body"),
      @ApiResponse(responseCode = "401", description = "Invalid credentials"),
      @ApiResponse(responseCode = "429", description = "Rate limited or account temporarily locked"),
      @ApiResponse(responseCode = "503", description = "Identity provider or session store unavailable")
  })
  @PostMapping(value = SIGN_IN, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> signIn(
      @Valid @RequestBody SignInRequest body,
      HttpServletRequest request,
      HttpServletResponse response
                                            );

  @Operation(
      summary = "Register a new account"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Account created"),
      @ApiResponse(responseCode = "400", description = "Invalid request or registration refused"),
      @ApiResponse(responseCode = "429", description = "Rate limited or temporarily locked"),
      @ApiResponse(responseCode = "503", description = "Identity provider unavailable")
  })
  @PostMapping(value = SIGN_UP, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> signUp(
      @Valid @RequestBody SignUpRequest body,
      HttpServletRequest request,
      HttpServletResponse response
                                            );

  @Operation(
      summary = "Request a password reset email",
      description = "Always answers the same way so that registered addresses cannot be enumerated"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "202", description = "Request accepted"),
      @ApiResponse(responseCode = "429", description = "Rate limited"),
      @ApiResponse(responseCode = "503", description = "Identity provider unavailable")
  })
  @PostMapping(value = RESET_PASSWORD, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> resetPassword(
      @Valid @RequestBody PasswordResetRequest body,
      HttpServletRequest request,
      HttpServletResponse response
                                                   );

  @Operation(
      summary = "Sign out",
      description = "Deletes the session, invalidates its CSRF token and clears the session cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Signed out"),
      @ApiResponse(responseCode = "403", description = "Missing or invalid CSRF token")
  })
  @PostMapping(value = SIGN_OUT)
  ResponseEntity<Map<String, Object>> signOut(
      HttpServletRequest request,
      HttpServletResponse response
                                             );

  @Operation(
      summary = "Check authentication status",
      description = "Returns whether the presented session is valid"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Authentication status returned")
  })
  @GetMapping(value = STATUS)
  ResponseEntity<Map<String, Object>> status(HttpServletRequest request);
}
