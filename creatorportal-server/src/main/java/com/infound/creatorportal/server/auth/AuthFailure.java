package com.infound.creatorportal.server.auth;

/**
 * Reasons a request credential is refused, with the HTTP status and the {@code detail} string
 * clients see.
 */
public enum AuthFailure {
  /** No token header, or a blank one. */
  MISSING(401, "No AccessToken"),
  /** Malformed, forged, or missing required claims. */
  INVALID(401, "Invalid AccessToken"),
  /** Authentic but past its expiry. */
  EXPIRED(401, "Invalid AccessToken (expired)"),
  /** Authentic and fresh but its session was logged out or evicted. */
  NOT_LIVE(401, "Invalid AccessToken (logged out or exceeded the limit)"),
  /** The session store could not be consulted. */
  STORE_UNAVAILABLE(503, "Session store unavailable");

  private final int status;
  private final String detail;

  AuthFailure(int status, String detail) {
    this.status = status;
    this.detail = detail;
  }

  public int status() {
    return status;
  }

  public String detail() {
    return detail;
  }
}
