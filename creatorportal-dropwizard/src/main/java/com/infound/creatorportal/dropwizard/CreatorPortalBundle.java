package com.infound.creatorportal.dropwizard;

import com.infound.creatorportal.dropwizard.auth.AccessTokenRequestFilter;
import com.infound.creatorportal.dropwizard.health.SessionStoreHealthCheck;
import com.infound.creatorportal.redis.RedisSessionStoreFactory;
import com.infound.creatorportal.server.auth.AccessTokenAuthenticator;
import com.infound.creatorportal.server.auth.AccessTokenCodec;
import com.infound.creatorportal.server.auth.CreatorPrincipal;
import com.infound.creatorportal.server.directory.CreatorDirectory;
import com.infound.creatorportal.server.gate.AccessGate;
import com.infound.creatorportal.server.manager.CreatorAccountManager;
import com.infound.creatorportal.server.resource.AccountResource;
import com.infound.creatorportal.server.resource.HomeResource;
import com.infound.creatorportal.server.store.InMemorySessionStore;
import com.infound.creatorportal.server.store.SessionIdGenerator;
import com.infound.creatorportal.server.store.SessionLimits;
import com.infound.creatorportal.server.store.SessionStore;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.AutoCloseableManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that puts the access-token gate and the account endpoints into an existing
 * Dropwizard application.
 * <p>
 * Registers the gate filter, {@code @Auth CreatorPrincipal} injection, the account and home
 * resources and a session-store health check. Requires a {@link CreatorPortalConfiguration}.
 * <p>
 * The session store follows the configuration: a {@code redis} block selects Redis, otherwise
 * sessions are kept in memory (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new CreatorPortalBundle<>(creatorDirectory));
 * }</pre>
 * <p>
 * Or supply a store of your own:
 * <pre>{@code
 *   bootstrap.addBundle(new CreatorPortalBundle<>(creatorDirectory, mySessionStore));
 * }</pre>
 */
@Singleton
public class CreatorPortalBundle<C extends CreatorPortalConfiguration> implements ConfiguredBundle<C> {

  /**
   * Name of the registered health check.
   */
  public static final String HEALTH_CHECK_NAME = "session-store";

  private static final Logger log = LoggerFactory.getLogger(CreatorPortalBundle.class);

  private final CreatorDirectory creatorDirectory;
  private final SessionStore suppliedSessionStore;
  private volatile SessionStore sessionStore;

  /**
   * Creates a bundle whose session store is chosen by the configuration.
   *
   * @param creatorDirectory sample and creator lookup
   */
  public CreatorPortalBundle(CreatorDirectory creatorDirectory) {
    this(creatorDirectory, null);
  }

  /**
   * Creates a bundle backed by the supplied session store. The {@code redis} block and session
   * limits in the configuration are then ignored.
   *
   * @param creatorDirectory sample and creator lookup
   * @param sessionStore     the session store, null to choose from the configuration
   */
  @Inject
  public CreatorPortalBundle(CreatorDirectory creatorDirectory, SessionStore sessionStore) {
    this.creatorDirectory = creatorDirectory;
    this.suppliedSessionStore = sessionStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    Duration ttl = Duration.ofDays(configuration.getAccessTokenTtlDays());
    SessionLimits limits = new SessionLimits(configuration.getMaxSessionsPerUser(), ttl);
    sessionStore = buildSessionStore(configuration, environment, limits);
    AccessTokenCodec codec = buildCodec(configuration, ttl);

    AccessTokenAuthenticator authenticator = new AccessTokenAuthenticator(codec, sessionStore);
    AccessGate gate = new AccessGate(authenticator, configuration.getAccessTokenHeader(),
        configuration.getAllowedPaths());
    environment.jersey().register(new AccessTokenRequestFilter(gate));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(CreatorPrincipal.class));

    CreatorAccountManager manager = new CreatorAccountManager(creatorDirectory, codec,
        sessionStore, new SessionIdGenerator(), configuration.getAccessTokenHeader());
    environment.jersey().register(new AccountResource(manager));
    environment.jersey().register(new HomeResource(configuration.getServiceName()));
    environment.healthChecks().register(HEALTH_CHECK_NAME, new SessionStoreHealthCheck(sessionStore));
  }

  /**
   * The session store in use, available once the bundle has run.
   *
   * @return the session store
   */
  public SessionStore sessionStore() {
    if (sessionStore == null) {
      throw new IllegalStateException("CreatorPortalBundle has not run yet");
    }
    return sessionStore;
  }

  private SessionStore buildSessionStore(C configuration, Environment environment,
                                         SessionLimits limits) {
    if (suppliedSessionStore != null) {
      return suppliedSessionStore;
    }
    RedisSettings redis = configuration.getRedis();
    if (redis == null) {
      log.warn("""
          #################################################################
          # WARNING: No redis block configured, sessions are kept in      #
          # memory. They are lost on restart and not shared across nodes. #
          # Do not use in production.                                     #
          #################################################################
          """);
      return new InMemorySessionStore(limits);
    }
    RedisSessionStoreFactory factory = redis.buildFactory();
    factory.start();
    environment.lifecycle().manage(new AutoCloseableManager(factory));
    return factory.create(environment.getObjectMapper(), configuration.getRedisPrefix(), limits);
  }

  private AccessTokenCodec buildCodec(C configuration, Duration ttl) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating one randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new AccessTokenCodec(secret, configuration.getJwtIssuer(), ttl);
  }
}
