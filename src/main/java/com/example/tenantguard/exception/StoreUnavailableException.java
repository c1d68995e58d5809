package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

/**
 * A backing store could not be reached.
 */
public class StoreUnavailableException extends ApiException {

  private final String store;

  public StoreUnavailableException(String store, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.forStatus(503),
          "Service temporarily unavailable", cause);
    this.store = store;
  }

  public String getStore() {
    return store;
  }
}
