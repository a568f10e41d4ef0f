package com.infound.creatorportal.server.auth;

/**
 * Outcome of authenticating a credential: exactly one of principal or failure is set.
 *
 * @param principal the authenticated creator, null on failure
 * @param failure   the reason for refusal, null on success
 */
public record AuthResult(CreatorPrincipal principal, AuthFailure failure) {

  public static AuthResult success(CreatorPrincipal principal) {
    return new AuthResult(principal, null);
  }

  public static AuthResult failure(AuthFailure failure) {
    return new AuthResult(null, failure);
  }

  public boolean isAuthenticated() {
    return principal != null;
  }
}
