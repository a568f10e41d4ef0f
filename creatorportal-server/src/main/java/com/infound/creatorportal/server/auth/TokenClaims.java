package com.infound.creatorportal.server.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed claim set carried by an access token.
 *
 * @param subject    the creator username ({@code sub})
 * @param sessionId  the session id ({@code jti}); the key of the session in the session store
 * @param expiresAt  absolute expiry ({@code exp}), second precision
 * @param extensions application claims passed through untouched, never null
 */
public record TokenClaims(String subject, String sessionId, Instant expiresAt,
                          Map<String, Object> extensions) {

  public TokenClaims {
    extensions = extensions == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
  }
}
