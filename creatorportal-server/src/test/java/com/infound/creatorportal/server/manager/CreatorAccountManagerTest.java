package com.infound.creatorportal.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.model.LoginRequest;
import com.infound.creatorportal.model.LoginResponse;
import com.infound.creatorportal.server.auth.AccessTokenAuthenticator;
import com.infound.creatorportal.server.auth.AccessTokenCodec;
import com.infound.creatorportal.server.auth.AuthFailure;
import com.infound.creatorportal.server.auth.AuthResult;
import com.infound.creatorportal.server.auth.CreatorPrincipal;
import com.infound.creatorportal.server.directory.CreatorRecord;
import com.infound.creatorportal.server.directory.InMemoryCreatorDirectory;
import com.infound.creatorportal.server.directory.SampleRecord;
import com.infound.creatorportal.server.store.InMemorySessionStore;
import com.infound.creatorportal.server.store.SessionIdGenerator;
import com.infound.creatorportal.server.store.SessionStore;
import com.infound.creatorportal.server.store.SessionStoreException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CreatorAccountManagerTest {

  private static final byte[] SECRET =
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);

  @Mock private SessionStore brokenStore;

  private InMemoryCreatorDirectory directory;
  private AccessTokenCodec codec;
  private InMemorySessionStore sessionStore;
  private AccessTokenAuthenticator authenticator;
  private CreatorAccountManager manager;

  @BeforeEach
  void setUp() {
    directory = new InMemoryCreatorDirectory()
        .addSample(new SampleRecord("sample-1", "creator_a"))
        .addSample(new SampleRecord("sample-2", "creator_b"))
        .addCreator(new CreatorRecord("if-1", "tt-1", "creator_a", "Creator A",
            "a@example.com", "+100"));
    codec = new AccessTokenCodec(SECRET, null, Duration.ofDays(14));
    sessionStore = new InMemorySessionStore();
    authenticator = new AccessTokenAuthenticator(codec, sessionStore);
    manager = new CreatorAccountManager(directory, codec, sessionStore,
        new SessionIdGenerator(), "AccessToken");
  }

  @Test
  void login_knownSample_issuesLiveToken() {
    LoginResponse response = manager.login(new LoginRequest("sample-1", "creator_a"));

    assertThat(response.header()).isEqualTo("AccessToken");
    assertThat(response.jti()).isNotBlank();
    AuthResult result = authenticator.authenticate(response.token());
    assertThat(result.isAuthenticated()).isTrue();
    assertThat(result.principal().sessionId()).isEqualTo(response.jti());
    assertThat(result.principal().userInfo().platformCreatorDisplayName()).isEqualTo("Creator A");
    assertThat(result.principal().userInfo().email()).isEqualTo("a@example.com");
    assertThat(result.principal().userInfo().jti()).isEqualTo(response.jti());
    assertThat(codec.verify(response.token()).claims().extensions())
        .containsEntry(CreatorAccountManager.CREATOR_ID_CLAIM, "sample-1");
  }

  @Test
  void login_creatorWithoutProfile_storesUsernameSnapshot() {
    LoginResponse response = manager.login(new LoginRequest("sample-2", "creator_b"));

    CurrentUserInfo info = sessionStore.get("creator_b", response.jti()).orElseThrow();
    assertThat(info.platformCreatorUsername()).isEqualTo("creator_b");
    assertThat(info.ifId()).isEmpty();
  }

  @Test
  void login_sampleOfAnotherUser_securityException() {
    assertThatThrownBy(() -> manager.login(new LoginRequest("sample-1", "creator_b")))
        .isInstanceOf(SecurityException.class)
        .hasMessage(CreatorAccountManager.LOGIN_FAILED);
    assertThat(sessionStore.count("creator_b")).isZero();
  }

  @Test
  void login_missingField_illegalArgument() {
    assertThatThrownBy(() -> manager.login(new LoginRequest(null, "creator_a")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("sampleId");
    assertThatThrownBy(() -> manager.login(new LoginRequest("sample-1", " ")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("userName");
    assertThatThrownBy(() -> manager.login(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void login_storeDown_reportedAsFailedLogin() {
    CreatorAccountManager failing = new CreatorAccountManager(directory, codec, brokenStore,
        new SessionIdGenerator(), "AccessToken");
    when(brokenStore.put(eq("creator_a"), anyString(), any(CurrentUserInfo.class)))
        .thenThrow(new SessionStoreException("timeout"));

    assertThatThrownBy(() -> failing.login(new LoginRequest("sample-1", "creator_a")))
        .isInstanceOf(SecurityException.class)
        .hasMessage(CreatorAccountManager.LOGIN_FAILED);
  }

  @Test
  void login_newIdOrderedBeforeLiveOnes_failsInsteadOfReturningDeadToken() {
    Iterator<String> ids = List.of("200", "201", "202", "203", "204", "100").iterator();
    CreatorAccountManager laggingClock = new CreatorAccountManager(directory, codec, sessionStore,
        ids::next, "AccessToken");
    for (int i = 0; i < 5; i++) {
      laggingClock.login(new LoginRequest("sample-1", "creator_a"));
    }

    assertThatThrownBy(() -> laggingClock.login(new LoginRequest("sample-1", "creator_a")))
        .isInstanceOf(SecurityException.class)
        .hasMessage(CreatorAccountManager.LOGIN_FAILED);
    assertThat(sessionStore.count("creator_a")).isEqualTo(5);
    assertThat(sessionStore.exists("creator_a", "100")).isFalse();
    assertThat(sessionStore.exists("creator_a", "200")).isTrue();
  }

  @Test
  void login_sixTimes_firstTokenRejectedAsNotLive() {
    List<LoginResponse> logins = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      logins.add(manager.login(new LoginRequest("sample-1", "creator_a")));
    }

    assertThat(sessionStore.count("creator_a")).isEqualTo(5);
    assertThat(authenticator.authenticate(logins.get(0).token()).failure())
        .isEqualTo(AuthFailure.NOT_LIVE);
    for (LoginResponse login : logins.subList(1, 6)) {
      assertThat(authenticator.authenticate(login.token()).isAuthenticated()).isTrue();
    }
  }

  @Test
  void login_externalRemovalOfOneSession_onlyThatTokenRejected() {
    List<LoginResponse> logins = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      logins.add(manager.login(new LoginRequest("sample-1", "creator_a")));
    }

    sessionStore.remove("creator_a", logins.get(2).jti());

    assertThat(authenticator.authenticate(logins.get(2).token()).failure())
        .isEqualTo(AuthFailure.NOT_LIVE);
    assertThat(authenticator.authenticate(logins.get(3).token()).isAuthenticated()).isTrue();
  }

  @Test
  void logout_endsOnlyCurrentSession() {
    LoginResponse first = manager.login(new LoginRequest("sample-1", "creator_a"));
    LoginResponse second = manager.login(new LoginRequest("sample-1", "creator_a"));
    CreatorPrincipal principal = authenticator.authenticate(first.token()).principal();

    assertThat(manager.logout(principal)).isTrue();

    assertThat(authenticator.authenticate(first.token()).failure()).isEqualTo(AuthFailure.NOT_LIVE);
    assertThat(authenticator.authenticate(second.token()).isAuthenticated()).isTrue();
    assertThat(manager.logout(principal)).isFalse();
  }

  @Test
  void logoutEverywhere_endsAllSessions() {
    LoginResponse first = manager.login(new LoginRequest("sample-1", "creator_a"));
    manager.login(new LoginRequest("sample-1", "creator_a"));
    CreatorPrincipal principal = authenticator.authenticate(first.token()).principal();

    assertThat(manager.logoutEverywhere(principal)).isEqualTo(2);
    assertThat(sessionStore.count("creator_a")).isZero();
  }

  @Test
  void currentUser_withoutPrincipal_securityException() {
    assertThatThrownBy(() -> manager.currentUser(null)).isInstanceOf(SecurityException.class);
    assertThatThrownBy(() -> manager.logout(null)).isInstanceOf(SecurityException.class);
  }
}
