package com.infound.creatorportal.server.auth;

import com.infound.creatorportal.model.CurrentUserInfo;
import java.security.Principal;

/**
 * Authenticated creator attached to a request once its access token has been accepted.
 *
 * @param username  the token subject
 * @param sessionId the session id ({@code jti}) the request was authenticated with
 * @param userInfo  the snapshot stored with the session
 */
public record CreatorPrincipal(String username, String sessionId, CurrentUserInfo userInfo)
    implements Principal {

  @Override
  public String getName() {
    return username;
  }
}
