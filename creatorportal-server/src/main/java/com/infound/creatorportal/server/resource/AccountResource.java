package com.infound.creatorportal.server.resource;

import com.infound.creatorportal.model.ApiResponse;
import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.model.LoginRequest;
import com.infound.creatorportal.model.LoginResponse;
import com.infound.creatorportal.server.auth.CreatorPrincipal;
import com.infound.creatorportal.server.manager.CreatorAccountManager;
import com.infound.creatorportal.server.store.SessionStoreException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for creator accounts.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /account/login}: open a session, returns the token</li>
 *   <li>{@code GET /account/me}: snapshot of the authenticated creator</li>
 *   <li>{@code POST /account/logout}: end the current session</li>
 *   <li>{@code POST /account/logout/all}: end every session of the creator</li>
 * </ul>
 * All work is delegated to {@link CreatorAccountManager}; this class only maps its exceptions
 * to HTTP responses. The principal is expected on the {@link SecurityContext}, placed there by
 * the access-token filter.
 */
@Singleton
@Path("/account")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccountResource {

  private static final Logger log = LoggerFactory.getLogger(AccountResource.class);

  private final CreatorAccountManager manager;

  /**
   * Instantiates a new Account resource.
   *
   * @param manager the account manager
   */
  @Inject
  public AccountResource(CreatorAccountManager manager) {
    this.manager = manager;
    log.info("AccountResource({})", manager);
  }

  /**
   * Login.
   *
   * @param request the request
   * @return the token envelope
   */
  @POST
  @Path("/login")
  public ApiResponse<LoginResponse> login(LoginRequest request) {
    try {
      return ApiResponse.success(manager.login(request));
    } catch (IllegalArgumentException e) {
      throw error(Response.Status.BAD_REQUEST, e.getMessage());
    } catch (SecurityException e) {
      throw error(Response.Status.UNAUTHORIZED, e.getMessage());
    }
  }

  @GET
  @Path("/me")
  public ApiResponse<CurrentUserInfo> me(@Context SecurityContext securityContext) {
    try {
      return ApiResponse.success(manager.currentUser(principalOf(securityContext)));
    } catch (SecurityException e) {
      throw error(Response.Status.UNAUTHORIZED, e.getMessage());
    }
  }

  @POST
  @Path("/logout")
  public ApiResponse<Void> logout(@Context SecurityContext securityContext) {
    try {
      manager.logout(principalOf(securityContext));
      return ApiResponse.success(null);
    } catch (SecurityException e) {
      throw error(Response.Status.UNAUTHORIZED, e.getMessage());
    } catch (SessionStoreException e) {
      log.error("Logout failed", e);
      throw error(Response.Status.SERVICE_UNAVAILABLE, "Session store unavailable");
    }
  }

  @POST
  @Path("/logout/all")
  public ApiResponse<Map<String, Integer>> logoutEverywhere(
      @Context SecurityContext securityContext) {
    try {
      int removed = manager.logoutEverywhere(principalOf(securityContext));
      return ApiResponse.success(Map.of("revoked", removed));
    } catch (SecurityException e) {
      throw error(Response.Status.UNAUTHORIZED, e.getMessage());
    } catch (SessionStoreException e) {
      log.error("Logout of all sessions failed", e);
      throw error(Response.Status.SERVICE_UNAVAILABLE, "Session store unavailable");
    }
  }

  private static CreatorPrincipal principalOf(SecurityContext securityContext) {
    if (securityContext != null
        && securityContext.getUserPrincipal() instanceof CreatorPrincipal principal) {
      return principal;
    }
    return null;
  }

  private static WebApplicationException error(Response.Status status, String message) {
    return new WebApplicationException(Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(ApiResponse.error(status.getStatusCode(), message))
        .build());
  }
}
