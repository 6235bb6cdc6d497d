package com.example.authguard.web.rest.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignUpRequest(
    @NotBlank(message = "Email is required") @Email(message = "Email must be valid") String email,
    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters") String password,
    @Size(min = 1, max = 100, message = "Display name must be between 1 and 100 characters") String displayName
) {

  @Override
  public String toString() {
    return "SignUpRequest[email=" + email + ", displayName=" + displayName + "]";
  }
}
