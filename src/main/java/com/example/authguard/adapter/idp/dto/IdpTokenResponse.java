package com.example.authguard.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Password grant response from the identity provider. Error responses reuse the same shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdpTokenResponse(
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("token_type")
    String tokenType,
    @JsonProperty("expires_in")
    Long expiresIn,
    @JsonProperty("refresh_token")
    String refreshToken,
    @JsonProperty("user")
    IdpUserResponse user,
    @JsonProperty("error")
    String error,
    @JsonProperty("error_description")
    String errorDescription,
    @JsonProperty("msg")
    String msg
) {

  public boolean isError() {
    return error != null || (user == null && msg != null);
  }

  /**
   * Human-readable error, whichever field the provider filled in
   */
  public String errorMessage() {
    if (errorDescription != null) {
      return errorDescription;
    }
    return msg != null ? msg : error;
  }
}
