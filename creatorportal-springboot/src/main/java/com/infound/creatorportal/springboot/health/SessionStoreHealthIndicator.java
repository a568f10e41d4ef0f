package com.infound.creatorportal.springboot.health;

import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.server.store.SessionStoreException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

public class SessionStoreHealthIndicator implements HealthIndicator {

  private final SessionStore sessionStore;

  public SessionStoreHealthIndicator(SessionStore sessionStore) {
    this.sessionStore = sessionStore;
  }

  @Override
  public Health health() {
    try {
      sessionStore.checkAvailable();
      return Health.up().withDetail("store", sessionStore.getClass().getSimpleName()).build();
    } catch (SessionStoreException e) {
      return Health.down(e).withDetail("store", sessionStore.getClass().getSimpleName()).build();
    }
  }
}
