package com.infound.creatorportal.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.model.ErrorDetail;
import com.infound.creatorportal.server.auth.AccessTokenAuthenticator;
import com.infound.creatorportal.server.auth.AccessTokenCodec;
import com.infound.creatorportal.server.auth.CreatorPrincipal;
import com.infound.creatorportal.server.gate.AccessGate;
import com.infound.creatorportal.server.store.InMemorySessionStore;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.core.UriInfo;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccessTokenRequestFilterTest {

  private static final byte[] SECRET =
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);

  @Mock private ContainerRequestContext requestContext;
  @Mock private UriInfo uriInfo;
  @Mock private SecurityContext originalContext;

  private AccessTokenCodec codec;
  private InMemorySessionStore sessionStore;
  private AccessTokenRequestFilter filter;

  @BeforeEach
  void setUp() {
    codec = new AccessTokenCodec(SECRET, null, Duration.ofDays(14));
    sessionStore = new InMemorySessionStore();
    AccessGate gate = new AccessGate(new AccessTokenAuthenticator(codec, sessionStore),
        "AccessToken", List.of("/", "/account/login"));
    filter = new AccessTokenRequestFilter(gate);
    when(requestContext.getUriInfo()).thenReturn(uriInfo);
  }

  @Test
  void allowListedPath_passesUntouched() {
    when(uriInfo.getPath()).thenReturn("account/login");

    filter.filter(requestContext);

    verify(requestContext, never()).abortWith(any());
    verify(requestContext, never()).setSecurityContext(any());
  }

  @Test
  void emptyPath_treatedAsRoot() {
    when(uriInfo.getPath()).thenReturn("");

    filter.filter(requestContext);

    verify(requestContext, never()).abortWith(any());
  }

  @Test
  void missingToken_abortsWith401() {
    when(uriInfo.getPath()).thenReturn("account/me");

    filter.filter(requestContext);

    Response response = abortedResponse();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getEntity()).isEqualTo(new ErrorDetail("No AccessToken"));
  }

  @Test
  void liveToken_installsCreatorSecurityContext() {
    sessionStore.put("alice", "100", CurrentUserInfo.forUsernameOnly("100", "alice"));
    String token = codec.issue("alice", "100", Map.of());
    when(uriInfo.getPath()).thenReturn("account/me");
    when(requestContext.getHeaderString("AccessToken")).thenReturn(token);
    when(requestContext.getSecurityContext()).thenReturn(originalContext);
    when(originalContext.isSecure()).thenReturn(true);

    filter.filter(requestContext);

    ArgumentCaptor<SecurityContext> captor = ArgumentCaptor.forClass(SecurityContext.class);
    verify(requestContext).setSecurityContext(captor.capture());
    SecurityContext installed = captor.getValue();
    assertThat(installed.getUserPrincipal()).isInstanceOf(CreatorPrincipal.class);
    assertThat(installed.getUserPrincipal().getName()).isEqualTo("alice");
    assertThat(installed.isSecure()).isTrue();
    assertThat(installed.getAuthenticationScheme())
        .isEqualTo(CreatorSecurityContext.AUTHENTICATION_SCHEME);
    verify(requestContext, never()).abortWith(any());
  }

  @Test
  void evictedSession_abortsWithNotLive() {
    String token = codec.issue("alice", "100", Map.of());
    when(uriInfo.getPath()).thenReturn("/account/me");
    when(requestContext.getHeaderString("AccessToken")).thenReturn(token);

    filter.filter(requestContext);

    assertThat(abortedResponse().getEntity())
        .isEqualTo(new ErrorDetail("Invalid AccessToken (logged out or exceeded the limit)"));
  }

  private Response abortedResponse() {
    ArgumentCaptor<Response> captor = ArgumentCaptor.forClass(Response.class);
    verify(requestContext).abortWith(captor.capture());
    return captor.getValue();
  }
}
