package com.infound.creatorportal.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;

import com.codahale.metrics.health.HealthCheck;
import com.infound.creatorportal.server.store.InMemorySessionStore;
import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.server.store.SessionStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionStoreHealthCheckTest {

  @Mock private SessionStore failingStore;

  @Test
  void inMemoryStore_healthy() {
    HealthCheck.Result result = new SessionStoreHealthCheck(new InMemorySessionStore()).execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).contains("InMemorySessionStore");
  }

  @Test
  void unreachableStore_unhealthy() {
    doThrow(new SessionStoreException("connection refused")).when(failingStore).checkAvailable();

    HealthCheck.Result result = new SessionStoreHealthCheck(failingStore).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getError()).isInstanceOf(SessionStoreException.class);
  }
}
