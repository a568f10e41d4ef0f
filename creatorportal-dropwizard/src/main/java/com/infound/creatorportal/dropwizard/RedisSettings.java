package com.infound.creatorportal.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infound.creatorportal.redis.RedisSessionStoreFactory;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Connection settings for the Redis session store.
 * <p>
 * Example:
 * <pre>{@code
 * redis:
 *   host: redis.internal
 *   port: 6379
 *   database: 0
 *   commandTimeout: 2 seconds
 * }</pre>
 */
public class RedisSettings {

  @NotEmpty
  private String host = "localhost";

  @Min(1)
  @Max(65535)
  private int port = 6379;

  private String password = "";

  @Min(0)
  private int database = 0;

  /**
   * Upper bound for a single Redis command; a slower reply fails the request with 503.
   */
  @NotNull
  private Duration commandTimeout = Duration.seconds(2);

  /**
   * Builds an unstarted factory for these settings.
   *
   * @return the factory
   */
  public RedisSessionStoreFactory buildFactory() {
    return new RedisSessionStoreFactory(host, port, password, database,
        commandTimeout.toJavaDuration());
  }

  @JsonProperty
  public String getHost() {
    return host;
  }

  @JsonProperty
  public void setHost(String host) {
    this.host = host;
  }

  @JsonProperty
  public int getPort() {
    return port;
  }

  @JsonProperty
  public void setPort(int port) {
    this.port = port;
  }

  @JsonProperty
  public String getPassword() {
    return password;
  }

  @JsonProperty
  public void setPassword(String password) {
    this.password = password;
  }

  @JsonProperty
  public int getDatabase() {
    return database;
  }

  @JsonProperty
  public void setDatabase(int database) {
    this.database = database;
  }

  @JsonProperty
  public Duration getCommandTimeout() {
    return commandTimeout;
  }

  @JsonProperty
  public void setCommandTimeout(Duration commandTimeout) {
    this.commandTimeout = commandTimeout;
  }
}
