package com.infound.creatorportal.springboot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infound.creatorportal.redis.RedisSessionStore;
import com.infound.creatorportal.server.auth.AccessTokenAuthenticator;
import com.infound.creatorportal.server.auth.AccessTokenCodec;
import com.infound.creatorportal.server.directory.CreatorDirectory;
import com.infound.creatorportal.server.directory.InMemoryCreatorDirectory;
import com.infound.creatorportal.server.gate.AccessGate;
import com.infound.creatorportal.server.manager.CreatorAccountManager;
import com.infound.creatorportal.server.store.InMemorySessionStore;
import com.infound.creatorportal.server.store.SessionIdGenerator;
import com.infound.creatorportal.server.store.SessionLimits;
import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.springboot.controller.AccountController;
import com.infound.creatorportal.springboot.controller.ApiExceptionHandler;
import com.infound.creatorportal.springboot.controller.HomeController;
import com.infound.creatorportal.springboot.health.SessionStoreHealthIndicator;
import com.infound.creatorportal.springboot.security.CreatorPortalSecurityConfig;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Wires the access-token gate, session store and account endpoints into a servlet application.
 * <p>
 * Every bean backs off when the application defines its own. The session store is Redis-backed
 * unless {@code creatorportal.session-store=memory}; the creator directory defaults to an empty
 * in-memory one and should be replaced by a datastore-backed bean.
 */
@AutoConfiguration(after = {RedisAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(CreatorPortalProperties.class)
@Import({CreatorPortalSecurityConfig.class, AccountController.class, HomeController.class,
    ApiExceptionHandler.class})
public class CreatorPortalAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(CreatorPortalAutoConfiguration.class);

  /**
   * Redis-backed store, the default for shared deployments.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(StringRedisTemplate.class)
  @ConditionalOnProperty(prefix = "creatorportal", name = "session-store", havingValue = "redis",
      matchIfMissing = true)
  static class RedisSessionStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(SessionStore.class)
    public SessionStore sessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                     CreatorPortalProperties props, SessionLimits sessionLimits) {
      return new RedisSessionStore(redisTemplate, objectMapper, props.getRedisPrefix(), sessionLimits);
    }
  }

  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionLimits sessionLimits(CreatorPortalProperties props) {
    return new SessionLimits(props.getMaxSessionsPerUser(),
        Duration.ofDays(props.getAccessTokenTtlDays()));
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionStore inMemorySessionStore(SessionLimits sessionLimits) {
    log.warn("Using in-memory session store. Sessions are lost on restart and not shared "
        + "between nodes. Do not use in production.");
    return new InMemorySessionStore(sessionLimits);
  }

  @Bean
  @ConditionalOnMissingBean
  public CreatorDirectory creatorDirectory() {
    log.warn("Using an empty in-memory creator directory. Provide a CreatorDirectory bean backed "
        + "by the creator datastore. Do not use in production.");
    return new InMemoryCreatorDirectory();
  }

  @Bean
  @ConditionalOnMissingBean
  public AccessTokenCodec accessTokenCodec(CreatorPortalProperties props, SecureRandom secureRandom) {
    String secretHex = props.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating one randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      secureRandom.nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new AccessTokenCodec(secret, props.getJwtIssuer(),
        Duration.ofDays(props.getAccessTokenTtlDays()));
  }

  @Bean
  @ConditionalOnMissingBean
  public AccessTokenAuthenticator accessTokenAuthenticator(AccessTokenCodec codec,
                                                           SessionStore sessionStore) {
    return new AccessTokenAuthenticator(codec, sessionStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public AccessGate accessGate(AccessTokenAuthenticator authenticator, CreatorPortalProperties props) {
    return new AccessGate(authenticator, props.getAccessTokenHeader(), props.getAllowedPaths());
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionIdGenerator sessionIdGenerator() {
    return new SessionIdGenerator();
  }

  @Bean
  @ConditionalOnMissingBean
  public CreatorAccountManager creatorAccountManager(CreatorDirectory directory,
                                                     AccessTokenCodec codec,
                                                     SessionStore sessionStore,
                                                     SessionIdGenerator sessionIdGenerator,
                                                     CreatorPortalProperties props) {
    return new CreatorAccountManager(directory, codec, sessionStore, sessionIdGenerator,
        props.getAccessTokenHeader());
  }

  @Bean
  @ConditionalOnMissingBean(name = "sessionStoreHealthIndicator")
  public SessionStoreHealthIndicator sessionStoreHealthIndicator(SessionStore sessionStore) {
    return new SessionStoreHealthIndicator(sessionStore);
  }
}
