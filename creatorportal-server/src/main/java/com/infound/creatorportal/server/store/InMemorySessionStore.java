package com.infound.creatorportal.server.store;

import com.infound.creatorportal.model.CurrentUserInfo;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Mutations of one user's set run inside {@link ConcurrentHashMap#compute} and replace the set
 * with a new immutable copy, so readers never see a half-trimmed set. Expired sets are dropped
 * when read, and {@link #put} sweeps the sets of users who never return at most once per
 * {@link #SWEEP_INTERVAL}. All sessions are lost on restart and are not shared between nodes. Suitable
 * for development and testing only.
 */
public class InMemorySessionStore implements SessionStore {

  /**
   * Minimum clock time between two sweeps of expired sets.
   */
  public static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, UserSessions> store = new ConcurrentHashMap<>();
  private final SessionLimits limits;
  private final Clock clock;
  private final AtomicReference<Instant> nextSweep;

  public InMemorySessionStore() {
    this(SessionLimits.DEFAULT, Clock.systemUTC());
  }

  public InMemorySessionStore(SessionLimits limits) {
    this(limits, Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory session store.
   *
   * @param limits per-user bounds
   * @param clock  clock used for the set time-to-live
   */
  public InMemorySessionStore(SessionLimits limits, Clock clock) {
    this.limits = limits;
    this.clock = clock;
    this.nextSweep = new AtomicReference<>(clock.instant().plus(SWEEP_INTERVAL));
  }

  @Override
  public List<String> put(String username, String sessionId, CurrentUserInfo userInfo) {
    Instant now = clock.instant();
    List<String> evicted = new ArrayList<>();
    store.compute(username, (key, current) -> {
      TreeMap<String, CurrentUserInfo> next = new TreeMap<>(SessionIdOrder.INSTANCE);
      if (current != null && !current.isExpired(now)) {
        next.putAll(current.sessions());
      }
      next.put(sessionId, userInfo);
      while (next.size() > limits.maxSessionsPerUser()) {
        evicted.add(next.pollFirstEntry().getKey());
      }
      return new UserSessions(Collections.unmodifiableNavigableMap(next), now.plus(limits.ttl()));
    });
    log.debug("Stored session jti={} for {}, evicted {}", sessionId, username, evicted);
    sweepIfDue(now);
    return evicted;
  }

  @Override
  public boolean exists(String username, String sessionId) {
    return live(username).map(s -> s.sessions().containsKey(sessionId)).orElse(false);
  }

  @Override
  public Optional<CurrentUserInfo> get(String username, String sessionId) {
    return live(username).map(s -> s.sessions().get(sessionId));
  }

  @Override
  public boolean remove(String username, String sessionId) {
    Instant now = clock.instant();
    AtomicBoolean removed = new AtomicBoolean();
    store.computeIfPresent(username, (key, current) -> {
      if (current.isExpired(now)) {
        return null;
      }
      if (!current.sessions().containsKey(sessionId)) {
        return current;
      }
      removed.set(true);
      TreeMap<String, CurrentUserInfo> next = new TreeMap<>(current.sessions());
      next.remove(sessionId);
      return next.isEmpty()
          ? null
          : new UserSessions(Collections.unmodifiableNavigableMap(next), current.expiresAt());
    });
    log.debug("Revoked session jti={} for {}: {}", sessionId, username, removed.get());
    return removed.get();
  }

  @Override
  public int removeAll(String username) {
    Instant now = clock.instant();
    AtomicInteger removed = new AtomicInteger();
    store.computeIfPresent(username, (key, current) -> {
      if (!current.isExpired(now)) {
        removed.set(current.sessions().size());
      }
      return null;
    });
    log.debug("Revoked {} session(s) for {}", removed.get(), username);
    return removed.get();
  }

  @Override
  public int count(String username) {
    return live(username).map(s -> s.sessions().size()).orElse(0);
  }

  /**
   * Drops every expired user set.
   *
   * @return the number of users whose set was dropped
   */
  public int purgeExpired() {
    Instant now = clock.instant();
    int before = store.size();
    store.values().removeIf(sessions -> sessions.isExpired(now));
    int purged = Math.max(0, before - store.size());
    log.debug("Purged {} expired session set(s)", purged);
    return purged;
  }

  int trackedUsers() {
    return store.size();
  }

  private void sweepIfDue(Instant now) {
    Instant due = nextSweep.get();
    if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(SWEEP_INTERVAL))) {
      return;
    }
    purgeExpired();
  }

  private Optional<UserSessions> live(String username) {
    UserSessions sessions = store.get(username);
    if (sessions == null) {
      return Optional.empty();
    }
    if (sessions.isExpired(clock.instant())) {
      store.remove(username, sessions);
      return Optional.empty();
    }
    return Optional.of(sessions);
  }

  private record UserSessions(NavigableMap<String, CurrentUserInfo> sessions, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return !expiresAt.isAfter(now);
    }
  }
}
