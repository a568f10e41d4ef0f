package com.infound.creatorportal.server.gate;

import com.infound.creatorportal.server.auth.AccessTokenAuthenticator;
import com.infound.creatorportal.server.auth.AuthResult;
import java.util.Collection;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-neutral request gate.
 * <p>
 * Paths on the allow-list pass untouched. Every other request must carry a token in the
 * configured header; the token is handed to the {@link AccessTokenAuthenticator}. Paths are
 * matched exactly, so {@code /docs/extra} is not covered by {@code /docs}.
 */
public class AccessGate {

  /**
   * Header the access token travels in unless configured otherwise.
   */
  public static final String DEFAULT_TOKEN_HEADER = "AccessToken";

  /**
   * Paths reachable without a token unless configured otherwise.
   */
  public static final Set<String> DEFAULT_ALLOWED_PATHS =
      Set.of("/", "/account/login", "/docs", "/redoc", "/openapi.json");

  private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

  private final AccessTokenAuthenticator authenticator;
  private final String tokenHeader;
  private final Set<String> allowedPaths;

  public AccessGate(AccessTokenAuthenticator authenticator) {
    this(authenticator, DEFAULT_TOKEN_HEADER, DEFAULT_ALLOWED_PATHS);
  }

  /**
   * Instantiates a new Access gate.
   *
   * @param authenticator the authenticator
   * @param tokenHeader   name of the header carrying the token
   * @param allowedPaths  exact paths reachable without a token
   */
  public AccessGate(AccessTokenAuthenticator authenticator, String tokenHeader,
                    Collection<String> allowedPaths) {
    if (tokenHeader == null || tokenHeader.isBlank()) {
      throw new IllegalArgumentException("Token header name must not be blank");
    }
    this.authenticator = authenticator;
    this.tokenHeader = tokenHeader;
    this.allowedPaths = Set.copyOf(allowedPaths);
    log.info("AccessGate(header={}, allowedPaths={})", this.tokenHeader, this.allowedPaths);
  }

  /**
   * Decides a request.
   *
   * @param path        the request path, without query string
   * @param headerValue the value of the token header, null when absent
   * @return the decision
   */
  public GateDecision evaluate(String path, String headerValue) {
    if (isAllowListed(path)) {
      return GateDecision.bypassed();
    }
    AuthResult result = authenticator.authenticate(headerValue);
    if (result.isAuthenticated()) {
      return GateDecision.authenticated(result.principal());
    }
    log.debug("Rejected {}: {}", path, result.failure());
    return GateDecision.rejected(result.failure());
  }

  /**
   * Whether the path is reachable without a token.
   *
   * @param path the request path
   * @return true when allow-listed
   */
  public boolean isAllowListed(String path) {
    String normalized = path == null || path.isEmpty() ? "/" : path;
    return allowedPaths.contains(normalized);
  }

  public String tokenHeader() {
    return tokenHeader;
  }

  public Set<String> allowedPaths() {
    return allowedPaths;
  }
}
