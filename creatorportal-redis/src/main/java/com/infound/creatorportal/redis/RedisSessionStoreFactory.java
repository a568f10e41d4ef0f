package com.infound.creatorportal.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infound.creatorportal.server.store.SessionLimits;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Owns a Lettuce connection for hosts without a Spring container.
 * <p>
 * Call {@link #start()} before {@link #create} and {@link #close()} on shutdown. In Dropwizard
 * the bundle registers this as a managed object; Spring Boot uses its own connection factory.
 */
public class RedisSessionStoreFactory implements AutoCloseable {

  /**
   * Command timeout unless configured otherwise.
   */
  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(2);

  private static final Logger log = LoggerFactory.getLogger(RedisSessionStoreFactory.class);

  private final LettuceConnectionFactory connectionFactory;
  private final String description;
  private StringRedisTemplate template;

  /**
   * Instantiates a new Redis session store factory.
   *
   * @param host           Redis host
   * @param port           Redis port
   * @param password       password, null or blank for none
   * @param database       database index
   * @param commandTimeout per-command timeout
   */
  public RedisSessionStoreFactory(String host, int port, String password, int database,
                                  Duration commandTimeout) {
    RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(host, port);
    server.setDatabase(database);
    if (password != null && !password.isBlank()) {
      server.setPassword(RedisPassword.of(password));
    }
    LettuceClientConfiguration client = LettuceClientConfiguration.builder()
        .commandTimeout(commandTimeout == null ? DEFAULT_COMMAND_TIMEOUT : commandTimeout)
        .build();
    this.connectionFactory = new LettuceConnectionFactory(server, client);
    this.description = host + ":" + port + "/" + database;
  }

  /**
   * Opens the connection factory.
   */
  public synchronized void start() {
    if (template != null) {
      return;
    }
    connectionFactory.afterPropertiesSet();
    connectionFactory.start();
    template = new StringRedisTemplate(connectionFactory);
    log.info("Redis session store connection started ({})", description);
  }

  /**
   * Builds a store on the started connection.
   *
   * @param objectMapper mapper for the stored snapshots
   * @param prefix       key prefix
   * @param limits       per-user bounds
   * @return the store
   */
  public synchronized RedisSessionStore create(ObjectMapper objectMapper, String prefix,
                                               SessionLimits limits) {
    if (template == null) {
      throw new IllegalStateException("RedisSessionStoreFactory has not been started");
    }
    return new RedisSessionStore(template, objectMapper, prefix, limits);
  }

  @Override
  public synchronized void close() {
    if (template == null) {
      return;
    }
    connectionFactory.destroy();
    template = null;
    log.info("Redis session store connection closed ({})", description);
  }
}
