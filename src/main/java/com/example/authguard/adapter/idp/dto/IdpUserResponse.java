package com.example.authguard.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IdpUserResponse(
    @JsonProperty("id")
    String id,
    @JsonProperty("email")
    String email,
    @JsonProperty("role")
    String role,
    @JsonProperty("user_metadata")
    Map<String, Object> userMetadata
) {

  /**
   * Application role from user metadata, falling back to {@code user}.
   * The top-level role is the provider's database role, not an application role.
   */
  public String applicationRole() {
    if (userMetadata != null && userMetadata.get("role") instanceof String appRole && !appRole.isBlank()) {
      return appRole;
    }
    return "user";
  }
}
