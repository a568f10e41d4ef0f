package com.infound.creatorportal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope wrapped around every portal response body.
 * <p>
 * Successful calls carry {@code code = 200} and {@code msg = "success"}; failures reuse the HTTP
 * status as the code and put a human-readable reason in {@code msg}.
 *
 * @param code status code mirrored into the body
 * @param msg  short outcome message
 * @param data payload, may be null
 * @param <T>  payload type
 */
public record ApiResponse<T>(
    @JsonProperty("code") int code,
    @JsonProperty("msg") String msg,
    @JsonProperty("data") T data) {

  /**
   * Success envelope.
   *
   * @param data the payload
   * @param <T>  payload type
   * @return the envelope
   */
  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(200, "success", data);
  }

  /**
   * Error envelope without a payload.
   *
   * @param code    the status code
   * @param message the reason
   * @param <T>     payload type
   * @return the envelope
   */
  public static <T> ApiResponse<T> error(int code, String message) {
    return new ApiResponse<>(code, message, null);
  }
}
