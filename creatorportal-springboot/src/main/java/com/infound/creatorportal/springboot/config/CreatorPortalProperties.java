package com.infound.creatorportal.springboot.config;

import com.infound.creatorportal.server.gate.AccessGate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "creatorportal")
public class CreatorPortalProperties {

  private String serviceName = "portal-creator-open-api";
  private String jwtSecretHex = "";
  private String jwtIssuer = "";
  private long accessTokenTtlDays = 14;
  private int maxSessionsPerUser = 5;
  private String accessTokenHeader = AccessGate.DEFAULT_TOKEN_HEADER;
  private String redisPrefix = "infound";
  private String sessionStore = "redis";
  private List<String> allowedPaths = defaultAllowedPaths();

  private static List<String> defaultAllowedPaths() {
    List<String> paths = new ArrayList<>(AccessGate.DEFAULT_ALLOWED_PATHS);
    paths.add("/actuator/health");
    return paths;
  }

  public String getServiceName() {
    return serviceName;
  }

  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public long getAccessTokenTtlDays() {
    return accessTokenTtlDays;
  }

  public void setAccessTokenTtlDays(long accessTokenTtlDays) {
    this.accessTokenTtlDays = accessTokenTtlDays;
  }

  public int getMaxSessionsPerUser() {
    return maxSessionsPerUser;
  }

  public void setMaxSessionsPerUser(int maxSessionsPerUser) {
    this.maxSessionsPerUser = maxSessionsPerUser;
  }

  public String getAccessTokenHeader() {
    return accessTokenHeader;
  }

  public void setAccessTokenHeader(String accessTokenHeader) {
    this.accessTokenHeader = accessTokenHeader;
  }

  public String getRedisPrefix() {
    return redisPrefix;
  }

  public void setRedisPrefix(String redisPrefix) {
    this.redisPrefix = redisPrefix;
  }

  public String getSessionStore() {
    return sessionStore;
  }

  public void setSessionStore(String sessionStore) {
    this.sessionStore = sessionStore;
  }

  public List<String> getAllowedPaths() {
    return allowedPaths;
  }

  public void setAllowedPaths(List<String> allowedPaths) {
    this.allowedPaths = allowedPaths;
  }
}
