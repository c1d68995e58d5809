package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

/**
 * Conflict Exception
 */
public class ConflictException extends ApiException {

  public ConflictException(String message) {
    super(HttpStatus.CONFLICT, ErrorKind.CONFLICT_ERROR, message);
  }
}
