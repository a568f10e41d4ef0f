package com.infound.creatorportal.dropwizard.auth;

import com.infound.creatorportal.server.auth.CreatorPrincipal;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;

/**
 * JAX-RS security context carrying an authenticated {@link CreatorPrincipal}.
 * Creators have no roles, so {@link #isUserInRole(String)} is always false.
 */
public class CreatorSecurityContext implements SecurityContext {

  /**
   * Authentication scheme reported for access-token requests.
   */
  public static final String AUTHENTICATION_SCHEME = "AccessToken";

  private final CreatorPrincipal principal;
  private final boolean secure;

  /**
   * Instantiates a new Creator security context.
   *
   * @param principal the authenticated creator
   * @param secure    whether the request arrived over a secure channel
   */
  public CreatorSecurityContext(CreatorPrincipal principal, boolean secure) {
    this.principal = principal;
    this.secure = secure;
  }

  @Override
  public Principal getUserPrincipal() {
    return principal;
  }

  @Override
  public boolean isUserInRole(String role) {
    return false;
  }

  @Override
  public boolean isSecure() {
    return secure;
  }

  @Override
  public String getAuthenticationScheme() {
    return AUTHENTICATION_SCHEME;
  }
}
