package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

/**
 * Client is temporarily blocked after repeated credential failures.
 */
public class TooManyAttemptsException extends ApiException {

  public TooManyAttemptsException() {
    super(HttpStatus.TOO_MANY_REQUESTS, ErrorKind.forStatus(429),
          "Too many failed authentication attempts. Try again later");
  }
}
