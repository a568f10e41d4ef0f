package com.infound.creatorportal.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.server.store.SessionStoreException;

/**
 * Health check that verifies the session store answers.
 */
public class SessionStoreHealthCheck extends HealthCheck {

  private final SessionStore sessionStore;

  /**
   * Instantiates a new Session store health check.
   *
   * @param sessionStore the session store
   */
  public SessionStoreHealthCheck(SessionStore sessionStore) {
    this.sessionStore = sessionStore;
  }

  @Override
  protected Result check() {
    try {
      sessionStore.checkAvailable();
    } catch (SessionStoreException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("%s reachable", sessionStore.getClass().getSimpleName());
  }
}
