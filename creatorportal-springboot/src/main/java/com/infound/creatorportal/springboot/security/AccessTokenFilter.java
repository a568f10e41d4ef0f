package com.infound.creatorportal.springboot.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infound.creatorportal.model.ErrorDetail;
import com.infound.creatorportal.server.auth.AuthFailure;
import com.infound.creatorportal.server.gate.AccessGate;
import com.infound.creatorportal.server.gate.GateDecision;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet adapter for the {@link AccessGate}.
 * <p>
 * Allow-listed paths pass through. An accepted token places its
 * {@link com.infound.creatorportal.server.auth.CreatorPrincipal} in the security context; a
 * refused one ends the request here with {@code {"detail": reason}}.
 */
public class AccessTokenFilter extends OncePerRequestFilter {

  private final AccessGate gate;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Access token filter.
   *
   * @param gate         the gate
   * @param objectMapper mapper for rejection bodies
   */
  public AccessTokenFilter(AccessGate gate, ObjectMapper objectMapper) {
    this.gate = gate;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    GateDecision decision = gate.evaluate(pathWithinApplication(request),
        request.getHeader(gate.tokenHeader()));
    switch (decision.outcome()) {
      case BYPASSED -> filterChain.doFilter(request, response);
      case AUTHENTICATED -> {
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(
            UsernamePasswordAuthenticationToken.authenticated(decision.principal(), null, List.of()));
        SecurityContextHolder.setContext(context);
        filterChain.doFilter(request, response);
      }
      case REJECTED -> reject(response, decision.failure());
      default -> throw new IllegalStateException("Unknown gate outcome " + decision.outcome());
    }
  }

  private void reject(HttpServletResponse response, AuthFailure failure) throws IOException {
    response.setStatus(failure.status());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getOutputStream(), new ErrorDetail(failure.detail()));
  }

  /**
   * Request path with the context path removed and without the query string.
   *
   * @param request the request
   * @return the path, {@code /} when empty
   */
  static String pathWithinApplication(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      uri = uri.substring(contextPath.length());
    }
    return uri.isEmpty() ? "/" : uri;
  }
}
