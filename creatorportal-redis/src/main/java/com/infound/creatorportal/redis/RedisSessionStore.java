package com.infound.creatorportal.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.server.store.SessionLimits;
import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.server.store.SessionStoreException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * {@link SessionStore} keeping each user's sessions in one Redis hash.
 * <p>
 * Key {@code {prefix}:creator_user_tokens:{username}}; field = session id; value = the JSON
 * snapshot. The TTL is set on the whole hash. Inserting a session, trimming the hash to the
 * limit and refreshing the TTL happen in a single server-side script, so concurrent logins on
 * different nodes cannot leave a user above the limit.
 */
public class RedisSessionStore implements SessionStore {

  /**
   * Key prefix unless configured otherwise.
   */
  public static final String DEFAULT_PREFIX = "infound";

  static final String KEY_SEGMENT = "creator_user_tokens";

  static final String EVICTED_SEPARATOR = "\n";

  // KEYS[1] = user hash; ARGV = session id, snapshot, max sessions, ttl seconds.
  // Returns the evicted ids oldest first, joined by EVICTED_SEPARATOR. Ordering matches
  // SessionIdOrder: all-digit ids first, numerically, then the rest lexically.
  static final RedisScript<String> PUT_SCRIPT = RedisScript.of("""
      redis.call('HSET', KEYS[1], ARGV[1], ARGV[2])
      local ids = redis.call('HKEYS', KEYS[1])
      local max = tonumber(ARGV[3])
      local evicted = {}
      if #ids > max then
        table.sort(ids, function(a, b)
          local da = string.match(a, '^%d+$') ~= nil
          local db = string.match(b, '^%d+$') ~= nil
          if da ~= db then
            return da
          end
          if da and #a ~= #b then
            return #a < #b
          end
          return a < b
        end)
        for i = 1, #ids - max do
          redis.call('HDEL', KEYS[1], ids[i])
          evicted[#evicted + 1] = ids[i]
        end
      end
      redis.call('EXPIRE', KEYS[1], tonumber(ARGV[4]))
      return table.concat(evicted, '\\n')
      """, String.class);

  static final RedisScript<Long> REMOVE_ALL_SCRIPT = RedisScript.of("""
      local n = redis.call('HLEN', KEYS[1])
      redis.call('DEL', KEYS[1])
      return n
      """, Long.class);

  private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

  private final StringRedisTemplate template;
  private final ObjectMapper objectMapper;
  private final String prefix;
  private final SessionLimits limits;

  /**
   * Instantiates a new Redis session store.
   *
   * @param template     template bound to the Redis connection
   * @param objectMapper mapper for the stored snapshots
   * @param prefix       key prefix
   * @param limits       per-user bounds
   */
  public RedisSessionStore(StringRedisTemplate template, ObjectMapper objectMapper,
                           String prefix, SessionLimits limits) {
    this.template = template;
    this.objectMapper = objectMapper;
    this.prefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix;
    this.limits = limits;
    log.info("RedisSessionStore(prefix={}, maxSessionsPerUser={}, ttl={})",
        this.prefix, limits.maxSessionsPerUser(), limits.ttl());
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the session id is blank or contains a line break
   */
  @Override
  public List<String> put(String username, String sessionId, CurrentUserInfo userInfo) {
    if (sessionId == null || sessionId.isBlank() || sessionId.contains(EVICTED_SEPARATOR)) {
      throw new IllegalArgumentException("Session id must be non-blank and on one line");
    }
    String key = keyFor(username);
    String json = toJson(userInfo);
    try {
      String evicted = template.execute(PUT_SCRIPT, List.of(key), sessionId, json,
          String.valueOf(limits.maxSessionsPerUser()), String.valueOf(limits.ttl().toSeconds()));
      List<String> result = evicted == null || evicted.isEmpty()
          ? List.of()
          : List.of(evicted.split(EVICTED_SEPARATOR));
      log.debug("Stored session jti={} under {}, evicted {}", sessionId, key, result);
      return result;
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to store session " + sessionId + " of " + username, e);
    }
  }

  @Override
  public boolean exists(String username, String sessionId) {
    try {
      return Boolean.TRUE.equals(hash().hasKey(keyFor(username), sessionId));
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to look up session " + sessionId + " of " + username, e);
    }
  }

  @Override
  public Optional<CurrentUserInfo> get(String username, String sessionId) {
    String json;
    try {
      json = hash().get(keyFor(username), sessionId);
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to load session " + sessionId + " of " + username, e);
    }
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json, CurrentUserInfo.class));
    } catch (JsonProcessingException e) {
      throw new SessionStoreException("Unreadable snapshot for session " + sessionId + " of " + username, e);
    }
  }

  @Override
  public boolean remove(String username, String sessionId) {
    try {
      Long removed = hash().delete(keyFor(username), sessionId);
      log.debug("Revoked session jti={} of {}: {}", sessionId, username, removed);
      return removed != null && removed > 0;
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to remove session " + sessionId + " of " + username, e);
    }
  }

  @Override
  public int removeAll(String username) {
    try {
      Long removed = template.execute(REMOVE_ALL_SCRIPT, List.of(keyFor(username)));
      log.debug("Revoked {} session(s) of {}", removed, username);
      return removed == null ? 0 : removed.intValue();
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to remove sessions of " + username, e);
    }
  }

  @Override
  public int count(String username) {
    try {
      Long size = hash().size(keyFor(username));
      return size == null ? 0 : size.intValue();
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to count sessions of " + username, e);
    }
  }

  @Override
  public void checkAvailable() {
    try {
      String pong = template.execute((RedisCallback<String>) RedisConnection::ping);
      if (!"PONG".equalsIgnoreCase(pong)) {
        throw new SessionStoreException("Unexpected ping reply: " + pong);
      }
    } catch (DataAccessException e) {
      throw new SessionStoreException("Redis is unreachable", e);
    }
  }

  /**
   * Redis key of a user's session hash.
   *
   * @param username the creator username
   * @return the key
   */
  public String keyFor(String username) {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("Username must not be blank");
    }
    return prefix + ":" + KEY_SEGMENT + ":" + username;
  }

  private HashOperations<String, String, String> hash() {
    return template.opsForHash();
  }

  private String toJson(CurrentUserInfo userInfo) {
    try {
      return objectMapper.writeValueAsString(userInfo);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Snapshot is not serializable", e);
    }
  }
}
