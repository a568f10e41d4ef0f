package com.infound.creatorportal.server.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.server.auth.AccessTokenAuthenticator;
import com.infound.creatorportal.server.auth.AccessTokenCodec;
import com.infound.creatorportal.server.auth.AuthFailure;
import com.infound.creatorportal.server.store.InMemorySessionStore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccessGateTest {

  private static final byte[] SECRET =
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);

  private AccessTokenCodec codec;
  private InMemorySessionStore sessionStore;
  private AccessGate gate;

  @BeforeEach
  void setUp() {
    codec = new AccessTokenCodec(SECRET, null, Duration.ofDays(14));
    sessionStore = new InMemorySessionStore();
    gate = new AccessGate(new AccessTokenAuthenticator(codec, sessionStore));
  }

  @Test
  void evaluate_allowListedPathWithoutHeader_bypassed() {
    for (String path : List.of("/", "/account/login", "/docs", "/redoc", "/openapi.json")) {
      assertThat(gate.evaluate(path, null).outcome())
          .as("path %s", path)
          .isEqualTo(GateDecision.Outcome.BYPASSED);
    }
  }

  @Test
  void evaluate_protectedPathWithoutHeader_rejectedMissing() {
    GateDecision decision = gate.evaluate("/account/me", null);

    assertThat(decision.outcome()).isEqualTo(GateDecision.Outcome.REJECTED);
    assertThat(decision.failure()).isEqualTo(AuthFailure.MISSING);
    assertThat(decision.failure().detail()).isEqualTo("No AccessToken");
    assertThat(decision.failure().status()).isEqualTo(401);
  }

  @Test
  void evaluate_prefixOfAllowListedPath_notBypassed() {
    assertThat(gate.evaluate("/docs/extra", null).failure()).isEqualTo(AuthFailure.MISSING);
    assertThat(gate.evaluate("/account/login/", null).failure()).isEqualTo(AuthFailure.MISSING);
  }

  @Test
  void evaluate_liveToken_authenticated() {
    sessionStore.put("creator_a", "7", CurrentUserInfo.forUsernameOnly("7", "creator_a"));

    GateDecision decision = gate.evaluate("/account/me", codec.issue("creator_a", "7", Map.of()));

    assertThat(decision.outcome()).isEqualTo(GateDecision.Outcome.AUTHENTICATED);
    assertThat(decision.principal().username()).isEqualTo("creator_a");
  }

  @Test
  void evaluate_evictedSession_rejectedNotLive() {
    String token = codec.issue("creator_a", "s1", Map.of());
    for (int i = 1; i <= 6; i++) {
      sessionStore.put("creator_a", "s" + i, CurrentUserInfo.forUsernameOnly("s" + i, "creator_a"));
    }

    assertThat(gate.evaluate("/account/me", token).failure()).isEqualTo(AuthFailure.NOT_LIVE);
  }

  @Test
  void evaluate_customAllowList_replacesDefaults() {
    AccessGate custom = new AccessGate(new AccessTokenAuthenticator(codec, sessionStore),
        "X-Token", List.of("/health"));

    assertThat(custom.evaluate("/health", null).outcome()).isEqualTo(GateDecision.Outcome.BYPASSED);
    assertThat(custom.evaluate("/docs", null).outcome()).isEqualTo(GateDecision.Outcome.REJECTED);
    assertThat(custom.tokenHeader()).isEqualTo("X-Token");
  }

  @Test
  void isAllowListed_emptyPath_treatedAsRoot() {
    assertThat(gate.isAllowListed("")).isTrue();
    assertThat(gate.isAllowListed(null)).isTrue();
  }

  @Test
  void constructor_blankHeader_throws() {
    assertThatThrownBy(() -> new AccessGate(new AccessTokenAuthenticator(codec, sessionStore),
        " ", List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
