package com.example.authguard.adapter.idp.dto;

/**
 * Outcome of a credential check. A rejection is a normal result, not an error.
 */
public record IdpSignInResult(
    boolean authenticated,
    String userId,
    String email,
    String role,
    String refreshToken,
    String error
) {

  public static IdpSignInResult success(String userId, String email, String role, String refreshToken) {
    return new IdpSignInResult(true, userId, email, role, refreshToken, null);
  }

  public static IdpSignInResult rejected(String error) {
    return new IdpSignInResult(false, null, null, null, null, error);
  }
}
