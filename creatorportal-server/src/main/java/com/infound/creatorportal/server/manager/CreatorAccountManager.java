package com.infound.creatorportal.server.manager;

import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.model.LoginRequest;
import com.infound.creatorportal.model.LoginResponse;
import com.infound.creatorportal.server.auth.AccessTokenCodec;
import com.infound.creatorportal.server.auth.CreatorPrincipal;
import com.infound.creatorportal.server.directory.CreatorDirectory;
import com.infound.creatorportal.server.directory.SampleRecord;
import com.infound.creatorportal.server.store.SessionStore;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic account operations: login, current user and logout.
 * <p>
 * Framework adapters ({@code AccountResource} for JAX-RS / Dropwizard, {@code AccountController}
 * for Spring Boot) stay thin wrappers that translate exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException} for missing request data, HTTP 400</li>
 *   <li>{@link SecurityException} for failed logins or a missing principal, HTTP 401</li>
 *   <li>{@link com.infound.creatorportal.server.store.SessionStoreException} from logout when
 *       the store is down, HTTP 503</li>
 * </ul>
 * A failed login never reveals why it failed.
 */
public class CreatorAccountManager {

  /**
   * Message of every failed login.
   */
  public static final String LOGIN_FAILED = "Invalid username or password";

  /**
   * Token claim carrying the id of the sample used to log in.
   */
  public static final String CREATOR_ID_CLAIM = "creator_id";

  private static final Logger log = LoggerFactory.getLogger(CreatorAccountManager.class);

  private final CreatorDirectory directory;
  private final AccessTokenCodec codec;
  private final SessionStore sessionStore;
  private final Supplier<String> sessionIds;
  private final String tokenHeader;

  /**
   * Instantiates a new Creator account manager.
   *
   * @param directory    sample and creator lookup
   * @param codec        the token codec
   * @param sessionStore the session store
   * @param sessionIds   source of new session ids
   * @param tokenHeader  header name reported to clients at login
   */
  public CreatorAccountManager(CreatorDirectory directory, AccessTokenCodec codec,
                               SessionStore sessionStore, Supplier<String> sessionIds,
                               String tokenHeader) {
    this.directory = directory;
    this.codec = codec;
    this.sessionStore = sessionStore;
    this.sessionIds = sessionIds;
    this.tokenHeader = tokenHeader;
  }

  /**
   * Logs a creator in with a sample id and username, opening a new session.
   * <p>
   * When the user already holds the maximum number of sessions the oldest one is evicted and its
   * token stops working.
   *
   * @param request the login request
   * @return the session id, header name and token
   * @throws IllegalArgumentException if a field is missing
   * @throws SecurityException        if the sample does not match the username, or the session
   *                                  could not be opened
   */
  public LoginResponse login(LoginRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Missing request body");
    }
    String sampleId = requireField(request.sampleId(), "sampleId");
    String username = requireField(request.userName(), "userName");
    log.debug("login(username={})", username);

    SampleRecord sample = directory.findSample(sampleId, username)
        .orElseThrow(() -> {
          log.info("Login refused for {}: sample {} not found", username, sampleId);
          return new SecurityException(LOGIN_FAILED);
        });

    try {
      String jti = sessionIds.get();
      String token = codec.issue(username, jti, Map.of(CREATOR_ID_CLAIM, sample.id()));
      CurrentUserInfo userInfo = directory.findCreator(username)
          .map(creator -> creator.toUserInfo(jti))
          .orElseGet(() -> {
            log.warn("No creator profile for {}; storing a username-only snapshot", username);
            return CurrentUserInfo.forUsernameOnly(jti, username);
          });
      List<String> evicted = sessionStore.put(username, jti, userInfo);
      if (evicted.contains(jti)) {
        // The new id orders before every live one, as from a node whose clock lags.
        log.warn("New session jti={} of {} was evicted on arrival", jti, username);
        throw new IllegalStateException("Session " + jti + " evicted on arrival");
      }
      if (!evicted.isEmpty()) {
        log.info("Evicted {} oldest session(s) of {}: {}", evicted.size(), username, evicted);
      }
      log.info("Token stored for user {} (jti={})", username, jti);
      return new LoginResponse(jti, tokenHeader, token);
    } catch (RuntimeException e) {
      log.error("Login failed for {}", username, e);
      throw new SecurityException(LOGIN_FAILED, e);
    }
  }

  /**
   * Snapshot of the authenticated creator.
   *
   * @param principal the request principal
   * @return the snapshot stored at login
   * @throws SecurityException if there is no principal
   */
  public CurrentUserInfo currentUser(CreatorPrincipal principal) {
    return requirePrincipal(principal).userInfo();
  }

  /**
   * Ends the caller's session; its token is refused from now on.
   *
   * @param principal the request principal
   * @return true if the session was still live
   * @throws SecurityException if there is no principal
   */
  public boolean logout(CreatorPrincipal principal) {
    CreatorPrincipal p = requirePrincipal(principal);
    boolean removed = sessionStore.remove(p.username(), p.sessionId());
    log.info("Logout of {} (jti={}): {}", p.username(), p.sessionId(), removed);
    return removed;
  }

  /**
   * Ends every session of the caller, including the current one.
   *
   * @param principal the request principal
   * @return the number of sessions ended
   * @throws SecurityException if there is no principal
   */
  public int logoutEverywhere(CreatorPrincipal principal) {
    CreatorPrincipal p = requirePrincipal(principal);
    int removed = sessionStore.removeAll(p.username());
    log.info("Logged {} out of {} session(s)", p.username(), removed);
    return removed;
  }

  public String tokenHeader() {
    return tokenHeader;
  }

  private static CreatorPrincipal requirePrincipal(CreatorPrincipal principal) {
    if (principal == null) {
      throw new SecurityException("Unverified");
    }
    return principal;
  }

  private static String requireField(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
    return value.trim();
  }
}
