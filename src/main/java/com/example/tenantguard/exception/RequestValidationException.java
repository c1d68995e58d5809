package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Malformed request input.
 */
public class RequestValidationException extends ApiException {

  public RequestValidationException(String message) {
    super(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, message);
  }

  public RequestValidationException(List<String> messages) {
    super(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, messages, null);
  }
}
