package com.infound.creatorportal.springboot.controller;

import com.infound.creatorportal.model.ApiResponse;
import com.infound.creatorportal.model.CurrentUserInfo;
import com.infound.creatorportal.model.LoginRequest;
import com.infound.creatorportal.model.LoginResponse;
import com.infound.creatorportal.server.auth.CreatorPrincipal;
import com.infound.creatorportal.server.manager.CreatorAccountManager;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Spring MVC controller for creator accounts. Delegates to {@link CreatorAccountManager}.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /account/login}</li>
 *   <li>{@code GET  /account/me}</li>
 *   <li>{@code POST /account/logout}</li>
 *   <li>{@code POST /account/logout/all}</li>
 * </ul>
 * Store outages propagate and are answered by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/account")
public class AccountController {

  private final CreatorAccountManager manager;

  public AccountController(CreatorAccountManager manager) {
    this.manager = manager;
  }

  @PostMapping("/login")
  public ApiResponse<LoginResponse> login(@RequestBody(required = false) LoginRequest request) {
    try {
      return ApiResponse.success(manager.login(request));
    } catch (IllegalArgumentException e) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
    } catch (SecurityException e) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, e.getMessage());
    }
  }

  @GetMapping("/me")
  public ApiResponse<CurrentUserInfo> me(@AuthenticationPrincipal CreatorPrincipal principal) {
    try {
      return ApiResponse.success(manager.currentUser(principal));
    } catch (SecurityException e) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, e.getMessage());
    }
  }

  @PostMapping("/logout")
  public ApiResponse<Void> logout(@AuthenticationPrincipal CreatorPrincipal principal) {
    try {
      manager.logout(principal);
      return ApiResponse.success(null);
    } catch (SecurityException e) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, e.getMessage());
    }
  }

  @PostMapping("/logout/all")
  public ApiResponse<Map<String, Integer>> logoutEverywhere(
      @AuthenticationPrincipal CreatorPrincipal principal) {
    try {
      return ApiResponse.success(Map.of("revoked", manager.logoutEverywhere(principal)));
    } catch (SecurityException e) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, e.getMessage());
    }
  }
}
