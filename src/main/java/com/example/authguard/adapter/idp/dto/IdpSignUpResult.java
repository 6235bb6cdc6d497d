package com.example.authguard.adapter.idp.dto;

public record IdpSignUpResult(boolean created, String userId, String email, String error) {

  public static IdpSignUpResult created(String userId, String email) {
    return new IdpSignUpResult(true, userId, email, null);
  }

  public static IdpSignUpResult rejected(String error) {
    return new IdpSignUpResult(false, null, null, error);
  }
}
