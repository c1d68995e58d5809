package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

/**
 * Resource Not Found Exception
 */
public class ResourceNotFoundException extends ApiException {

  public ResourceNotFoundException(String message) {
    super(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND_ERROR, message);
  }
}
