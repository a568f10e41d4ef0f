package com.infound.creatorportal.server.auth;

import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.server.store.SessionStoreException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an access-token header value into a {@link CreatorPrincipal}.
 * <p>
 * A token is accepted only when it decodes and its session is still present in the
 * {@link SessionStore}; a cryptographically valid token whose session was evicted or logged out
 * is refused. Each call makes a single attempt against the store.
 */
public class AccessTokenAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenAuthenticator.class);

  private final AccessTokenCodec codec;
  private final SessionStore sessionStore;

  /**
   * Instantiates a new Access token authenticator.
   *
   * @param codec        the token codec
   * @param sessionStore the session store
   */
  public AccessTokenAuthenticator(AccessTokenCodec codec, SessionStore sessionStore) {
    this.codec = codec;
    this.sessionStore = sessionStore;
  }

  /**
   * Authenticates a raw header value.
   *
   * @param token the header value, may be null
   * @return the principal, or the reason it was refused
   */
  public AuthResult authenticate(String token) {
    if (token == null || token.isBlank()) {
      return AuthResult.failure(AuthFailure.MISSING);
    }
    DecodeResult decoded = codec.verify(token.trim());
    if (!decoded.isValid()) {
      log.debug("Rejected token: {} ({})", decoded.failure(), decoded.message());
      return AuthResult.failure(decoded.failure() == DecodeResult.Failure.EXPIRED
          ? AuthFailure.EXPIRED
          : AuthFailure.INVALID);
    }
    TokenClaims claims = decoded.claims();
    try {
      if (!sessionStore.exists(claims.subject(), claims.sessionId())) {
        log.debug("Session {} of {} is not live", claims.sessionId(), claims.subject());
        return AuthResult.failure(AuthFailure.NOT_LIVE);
      }
      Optional<CurrentUserInfo> snapshot = sessionStore.get(claims.subject(), claims.sessionId());
      if (snapshot.isEmpty()) {
        log.debug("Session {} of {} vanished before it was read", claims.sessionId(), claims.subject());
        return AuthResult.failure(AuthFailure.NOT_LIVE);
      }
      return AuthResult.success(
          new CreatorPrincipal(claims.subject(), claims.sessionId(), snapshot.get()));
    } catch (SessionStoreException e) {
      log.error("Session store unavailable while checking session {} of {}",
          claims.sessionId(), claims.subject(), e);
      return AuthResult.failure(AuthFailure.STORE_UNAVAILABLE);
    }
  }
}
