package com.infound.creatorportal.server.store;

import java.time.Duration;

/**
 * Bounds applied to each user's set of sessions.
 *
 * @param maxSessionsPerUser how many live sessions a user may hold
 * @param ttl                lifetime of the whole set, refreshed on every login
 */
public record SessionLimits(int maxSessionsPerUser, Duration ttl) {

  /**
   * Five sessions, fourteen days.
   */
  public static final SessionLimits DEFAULT = new SessionLimits(5, Duration.ofDays(14));

  public SessionLimits {
    if (maxSessionsPerUser < 1) {
      throw new IllegalArgumentException("maxSessionsPerUser must be at least 1");
    }
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("Session ttl must be positive");
    }
  }
}
