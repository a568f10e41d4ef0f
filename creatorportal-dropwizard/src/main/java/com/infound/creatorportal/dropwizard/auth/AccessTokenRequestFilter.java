package com.infound.creatorportal.dropwizard.auth;

import com.infound.creatorportal.model.ErrorDetail;
import com.infound.creatorportal.server.auth.AuthFailure;
import com.infound.creatorportal.server.gate.AccessGate;
import com.infound.creatorportal.server.gate.GateDecision;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Jersey adapter for the {@link AccessGate}.
 * <p>
 * Runs before resource matching, so unknown paths are gated too. An accepted token replaces the
 * request's security context with a {@link CreatorSecurityContext}, which both
 * {@code @Context SecurityContext} and {@code @Auth CreatorPrincipal} parameters read from.
 */
@PreMatching
@Priority(Priorities.AUTHENTICATION)
public class AccessTokenRequestFilter implements ContainerRequestFilter {

  private final AccessGate gate;

  /**
   * Instantiates a new Access token request filter.
   *
   * @param gate the gate
   */
  public AccessTokenRequestFilter(AccessGate gate) {
    this.gate = gate;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    GateDecision decision = gate.evaluate(pathOf(requestContext),
        requestContext.getHeaderString(gate.tokenHeader()));
    switch (decision.outcome()) {
      case BYPASSED -> {
        // allow-listed
      }
      case AUTHENTICATED -> requestContext.setSecurityContext(new CreatorSecurityContext(
          decision.principal(), requestContext.getSecurityContext().isSecure()));
      case REJECTED -> requestContext.abortWith(rejection(decision.failure()));
      default -> throw new IllegalStateException("Unknown gate outcome " + decision.outcome());
    }
  }

  private static Response rejection(AuthFailure failure) {
    return Response.status(failure.status())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorDetail(failure.detail()))
        .build();
  }

  /**
   * Path relative to the application root, with a leading slash.
   *
   * @param requestContext the request
   * @return the path, {@code /} for the root
   */
  static String pathOf(ContainerRequestContext requestContext) {
    String path = requestContext.getUriInfo().getPath();
    if (path == null || path.isEmpty()) {
      return "/";
    }
    return path.startsWith("/") ? path : "/" + path;
  }
}
