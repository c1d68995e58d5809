package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Base class for errors that already know their HTTP status and client-facing messages.
 */
public abstract class ApiException extends RuntimeException {

  private final HttpStatus status;
  private final String errorKind;
  private final List<String> messages;

  protected ApiException(HttpStatus status, String errorKind, String message) {
    this(status, errorKind, List.of(message), null);
  }

  protected ApiException(HttpStatus status, String errorKind, String message, Throwable cause) {
    this(status, errorKind, List.of(message), cause);
  }

  protected ApiException(HttpStatus status, String errorKind, List<String> messages, Throwable cause) {
    super(String.join("; ", messages), cause);
    this.status = status;
    this.errorKind = errorKind;
    this.messages = List.copyOf(messages);
  }

  public HttpStatus getStatus() {
    return status;
  }

  public String getErrorKind() {
    return errorKind;
  }

  public List<String> getMessages() {
    return messages;
  }
}
