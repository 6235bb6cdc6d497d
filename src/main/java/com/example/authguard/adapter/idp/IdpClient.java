package com.example.authguard.adapter.idp;

import com.example.authguard.adapter.idp.dto.IdpSignInResult;
import com.example.authguard.adapter.idp.dto.IdpSignUpResult;

/**
 * Interface for the external identity provider that owns user credentials.
 * Rejected credentials are reported in the result; an unreachable provider raises
 * {@link com.example.authguard.exception.IdentityProviderException}.
 */
public interface IdpClient {

  /**
   * Verifies email and password.
   */
  IdpSignInResult signIn(String email, String password);

  /**
   * Registers a new user.
   */
  IdpSignUpResult signUp(String email, String password, String displayName);

  /**
   * Asks the provider to send a password reset email. Unknown addresses are not reported.
   */
  void requestPasswordReset(String email);
}
