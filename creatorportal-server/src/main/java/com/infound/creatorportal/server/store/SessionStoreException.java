package com.infound.creatorportal.server.store;

/**
 * Thrown when the backing session store cannot be reached or answers unexpectedly.
 * <p>
 * Distinct from credential failures: callers treat it as the store being unavailable.
 */
public class SessionStoreException extends RuntimeException {

  public SessionStoreException(String message) {
    super(message);
  }

  public SessionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
