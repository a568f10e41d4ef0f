package com.infound.creatorportal.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infound.creatorportal.server.gate.AccessGate;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the creator portal access-token gate.
 * <p>
 * For production, supply {@code jwtSecretHex} (a hex-encoded 32-byte random value, shared by
 * every node) and a {@code redis} block so sessions are shared and survive restarts.
 * <p>
 * Generate the secret with: {@code openssl rand -hex 32}
 */
public class CreatorPortalConfiguration extends Configuration {
  /**
   * Service name reported by {@code GET /}.
   */
  @NotEmpty
  private String serviceName = "portal-creator-open-api";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for access tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Value of the {@code iss} claim. Empty omits it and skips the issuer check.
   */
  private String jwtIssuer = "";

  /**
   * Lifetime of access tokens and of each user's session set, in days.
   */
  @Min(1)
  private long accessTokenTtlDays = 14;

  /**
   * Live sessions a creator may hold; the oldest is evicted beyond this.
   */
  @Min(1)
  private int maxSessionsPerUser = 5;

  /**
   * Request header carrying the access token.
   */
  @NotEmpty
  private String accessTokenHeader = AccessGate.DEFAULT_TOKEN_HEADER;

  /**
   * Exact paths reachable without a token.
   */
  @NotNull
  private List<String> allowedPaths = new ArrayList<>(AccessGate.DEFAULT_ALLOWED_PATHS);

  /**
   * Prefix of the Redis session keys.
   */
  @NotEmpty
  private String redisPrefix = "infound";

  /**
   * Redis connection. When absent the bundle uses its own session store, in-memory by default.
   */
  @Valid
  private RedisSettings redis;

  /**
   * Gets service name.
   *
   * @return the service name
   */
  @JsonProperty
  public String getServiceName() {
    return serviceName;
  }

  /**
   * Sets service name.
   *
   * @param serviceName the service name
   */
  @JsonProperty
  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets access token ttl days.
   *
   * @return the access token ttl days
   */
  @JsonProperty
  public long getAccessTokenTtlDays() {
    return accessTokenTtlDays;
  }

  /**
   * Sets access token ttl days.
   *
   * @param accessTokenTtlDays the access token ttl days
   */
  @JsonProperty
  public void setAccessTokenTtlDays(long accessTokenTtlDays) {
    this.accessTokenTtlDays = accessTokenTtlDays;
  }

  /**
   * Gets max sessions per user.
   *
   * @return the max sessions per user
   */
  @JsonProperty
  public int getMaxSessionsPerUser() {
    return maxSessionsPerUser;
  }

  /**
   * Sets max sessions per user.
   *
   * @param maxSessionsPerUser the max sessions per user
   */
  @JsonProperty
  public void setMaxSessionsPerUser(int maxSessionsPerUser) {
    this.maxSessionsPerUser = maxSessionsPerUser;
  }

  /**
   * Gets access token header.
   *
   * @return the access token header
   */
  @JsonProperty
  public String getAccessTokenHeader() {
    return accessTokenHeader;
  }

  /**
   * Sets access token header.
   *
   * @param accessTokenHeader the access token header
   */
  @JsonProperty
  public void setAccessTokenHeader(String accessTokenHeader) {
    this.accessTokenHeader = accessTokenHeader;
  }

  /**
   * Gets allowed paths.
   *
   * @return the allowed paths
   */
  @JsonProperty
  public List<String> getAllowedPaths() {
    return allowedPaths;
  }

  /**
   * Sets allowed paths.
   *
   * @param allowedPaths the allowed paths
   */
  @JsonProperty
  public void setAllowedPaths(List<String> allowedPaths) {
    this.allowedPaths = allowedPaths;
  }

  /**
   * Gets redis prefix.
   *
   * @return the redis prefix
   */
  @JsonProperty
  public String getRedisPrefix() {
    return redisPrefix;
  }

  /**
   * Sets redis prefix.
   *
   * @param redisPrefix the redis prefix
   */
  @JsonProperty
  public void setRedisPrefix(String redisPrefix) {
    this.redisPrefix = redisPrefix;
  }

  /**
   * Gets redis.
   *
   * @return the redis
   */
  @JsonProperty
  public RedisSettings getRedis() {
    return redis;
  }

  /**
   * Sets redis.
   *
   * @param redis the redis
   */
  @JsonProperty
  public void setRedis(RedisSettings redis) {
    this.redis = redis;
  }
}
