package com.infound.creatorportal.springboot.controller;

import com.infound.creatorportal.model.ApiResponse;
import com.infound.creatorportal.server.store.SessionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Renders controller failures in the {@link ApiResponse} envelope.
 */
@RestControllerAdvice(assignableTypes = {AccountController.class, HomeController.class})
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ApiResponse<Void>> handleStatus(ResponseStatusException e) {
    int status = e.getStatusCode().value();
    return ResponseEntity.status(status).body(ApiResponse.error(status, e.getReason()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
    log.debug("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(ApiResponse.error(HttpStatus.BAD_REQUEST.value(), "Malformed request body"));
  }

  @ExceptionHandler(SessionStoreException.class)
  public ResponseEntity<ApiResponse<Void>> handleStoreOutage(SessionStoreException e) {
    log.error("Session store unavailable", e);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiResponse.error(HttpStatus.SERVICE_UNAVAILABLE.value(), "Session store unavailable"));
  }
}
