package com.infound.creatorportal.server.store;

import com.infound.creatorportal.model.CurrentUserInfo;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for live creator sessions, grouped per username.
 * <p>
 * Implementations must be thread-safe. After every {@link #put} a user holds at most the
 * configured maximum number of sessions; the oldest sessions by {@link SessionIdOrder} are
 * evicted to make room. The whole set of a user's sessions shares one time-to-live which each
 * {@link #put} refreshes.
 * <p>
 * A session that is absent from the store is not live, whatever its token says. Failures to
 * reach the backing store surface as {@link SessionStoreException}.
 */
public interface SessionStore {

  /**
   * Adds a session and trims the user's set to the maximum, atomically per user.
   *
   * @param username  the creator username
   * @param sessionId the session id
   * @param userInfo  the snapshot to keep with the session
   * @return the ids evicted to honour the limit, oldest first; empty if none
   */
  List<String> put(String username, String sessionId, CurrentUserInfo userInfo);

  /**
   * Whether the session is live.
   *
   * @param username  the creator username
   * @param sessionId the session id
   * @return true if present and not expired
   */
  boolean exists(String username, String sessionId);

  /**
   * Loads the snapshot stored with a session.
   *
   * @param username  the creator username
   * @param sessionId the session id
   * @return the snapshot, or empty if the session is not live
   */
  Optional<CurrentUserInfo> get(String username, String sessionId);

  /**
   * Invalidates a single session.
   *
   * @param username  the creator username
   * @param sessionId the session id
   * @return true if a session was removed
   */
  boolean remove(String username, String sessionId);

  /**
   * Invalidates every session of a user.
   *
   * @param username the creator username
   * @return the number of sessions removed
   */
  int removeAll(String username);

  /**
   * Number of live sessions of a user.
   *
   * @param username the creator username
   * @return the count
   */
  int count(String username);

  /**
   * Checks that the backing store answers. Stores without a remote backend are always available.
   *
   * @throws SessionStoreException if the store cannot be reached
   */
  default void checkAvailable() {
  }
}
