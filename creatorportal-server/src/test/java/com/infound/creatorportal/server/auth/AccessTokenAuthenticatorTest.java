package com.infound.creatorportal.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.server.store.InMemorySessionStore;
import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.server.store.SessionStoreException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccessTokenAuthenticatorTest {

  private static final byte[] SECRET =
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);

  @Mock private SessionStore failingStore;

  private AccessTokenCodec codec;
  private InMemorySessionStore sessionStore;
  private AccessTokenAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    codec = new AccessTokenCodec(SECRET, null, Duration.ofDays(14));
    sessionStore = new InMemorySessionStore();
    authenticator = new AccessTokenAuthenticator(codec, sessionStore);
  }

  @Test
  void authenticate_liveSession_returnsPrincipal() {
    CurrentUserInfo info = CurrentUserInfo.forUsernameOnly("100", "creator_a");
    sessionStore.put("creator_a", "100", info);
    String token = codec.issue("creator_a", "100", Map.of("creator_id", "s-1"));

    AuthResult result = authenticator.authenticate(token);

    assertThat(result.isAuthenticated()).isTrue();
    assertThat(result.principal().username()).isEqualTo("creator_a");
    assertThat(result.principal().sessionId()).isEqualTo("100");
    assertThat(result.principal().userInfo()).isEqualTo(info);
    assertThat(result.principal().getName()).isEqualTo("creator_a");
  }

  @Test
  void authenticate_nullOrBlank_missing() {
    assertThat(authenticator.authenticate(null).failure()).isEqualTo(AuthFailure.MISSING);
    assertThat(authenticator.authenticate("  ").failure()).isEqualTo(AuthFailure.MISSING);
  }

  @Test
  void authenticate_garbage_invalid() {
    assertThat(authenticator.authenticate("abc.def.ghi").failure()).isEqualTo(AuthFailure.INVALID);
  }

  @Test
  void authenticate_missingClaims_invalid() {
    String token = JWT.create().withSubject("creator_a")
        .withExpiresAt(Instant.now().plusSeconds(60)).sign(Algorithm.HMAC256(SECRET));

    assertThat(authenticator.authenticate(token).failure()).isEqualTo(AuthFailure.INVALID);
  }

  @Test
  void authenticate_expiredToken_expired() {
    Clock past = Clock.fixed(Instant.now().minus(Duration.ofDays(15)), ZoneOffset.UTC);
    String token = new AccessTokenCodec(SECRET, null, Duration.ofDays(14), past)
        .issue("creator_a", "100", Map.of());
    sessionStore.put("creator_a", "100", CurrentUserInfo.forUsernameOnly("100", "creator_a"));

    assertThat(authenticator.authenticate(token).failure()).isEqualTo(AuthFailure.EXPIRED);
  }

  @Test
  void authenticate_validTokenWithoutSession_notLiveRatherThanInvalid() {
    String token = codec.issue("creator_a", "100", Map.of());

    AuthResult result = authenticator.authenticate(token);

    assertThat(result.failure())
        .as("a signature-valid token without a session is NOT_LIVE")
        .isEqualTo(AuthFailure.NOT_LIVE);
    assertThat(result.failure().detail())
        .isEqualTo("Invalid AccessToken (logged out or exceeded the limit)");
  }

  @Test
  void authenticate_storeDown_storeUnavailable() {
    AccessTokenAuthenticator withFailingStore = new AccessTokenAuthenticator(codec, failingStore);
    when(failingStore.exists("creator_a", "100"))
        .thenThrow(new SessionStoreException("connection refused"));

    AuthResult result = withFailingStore.authenticate(codec.issue("creator_a", "100", Map.of()));

    assertThat(result.failure()).isEqualTo(AuthFailure.STORE_UNAVAILABLE);
    assertThat(result.failure().status()).isEqualTo(503);
  }

  @Test
  void authenticate_sessionVanishesBetweenChecks_notLive() {
    AccessTokenAuthenticator racing = new AccessTokenAuthenticator(codec, failingStore);
    when(failingStore.exists("creator_a", "100")).thenReturn(true);
    when(failingStore.get("creator_a", "100")).thenReturn(Optional.empty());

    assertThat(racing.authenticate(codec.issue("creator_a", "100", Map.of())).failure())
        .isEqualTo(AuthFailure.NOT_LIVE);
    verify(failingStore).get("creator_a", "100");
  }

  @Test
  void authenticate_badToken_neverTouchesStore() {
    AccessTokenAuthenticator guarded = new AccessTokenAuthenticator(codec, failingStore);

    guarded.authenticate("not-a-token");

    verifyNoInteractions(failingStore);
  }
}
