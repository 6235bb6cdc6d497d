package com.example.authguard.web.rest.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignInRequest(
    @NotBlank(message = "Email is required") @Email(message = "Email must be valid") String email,
    @NotBlank(message = "Password is required") @Size(max = 128) String password
) {

  @Override
  public String toString() {
    return "SignInRequest[email=" + email + "]";
  }
}
