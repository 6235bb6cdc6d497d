package com.example.authguard.web.rest.controller;

import static com.example.authguard.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Security Monitoring",
    description = "Defense layer statistics for operators"
)
@RequestMapping(
    value = INTERNAL_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SecurityStatsAPI {

  @Operation(
      summary = "Security statistics",
      description = "Configured rate limit rules, top locked identifiers, session counts and active CSRF tokens"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Statistics returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated"),
      @ApiResponse(responseCode = "403", description = "Admin role required")
  })
  @GetMapping(value = SECURITY_STATS)
  ResponseEntity<Map<String, Object>> securityStats();
}
