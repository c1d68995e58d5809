package com.example.tenantguard.web.rest.errors;

import com.example.tenantguard.exception.ErrorKind;
import org.springframework.http.HttpStatus;

import java.util.Arrays;

/**
 * Fixed mapping of storage error codes (SQLState) to HTTP responses.
 */
public enum StorageErrorCode {

  UNIQUE_VIOLATION("23505", HttpStatus.CONFLICT, ErrorKind.CONFLICT_ERROR, "%s already exists"),
  NO_DATA("02000", HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND_ERROR, "Record not found"),
  FOREIGN_KEY_VIOLATION("23503", HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR,
                        "Invalid reference to related record"),
  INVALID_IDENTIFIER("22P02", HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR,
                     "Invalid ID provided"),
  OTHER(null, HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.DATABASE_ERROR,
        "Database error occurred");

  private static final String DEFAULT_FIELD = "field";

  private final String code;
  private final HttpStatus status;
  private final String errorKind;
  private final String messageTemplate;

  StorageErrorCode(String code, HttpStatus status, String errorKind, String messageTemplate) {
    this.code = code;
    this.status = status;
    this.errorKind = errorKind;
    this.messageTemplate = messageTemplate;
  }

  public static StorageErrorCode fromCode(String code) {
    return Arrays.stream(values())
        .filter(value -> value.code != null && value.code.equals(code))
        .findFirst()
        .orElse(OTHER);
  }

  public HttpStatus getStatus() {
    return status;
  }

  public String getErrorKind() {
    return errorKind;
  }

  /**
   * Client-facing message. Only {@link #UNIQUE_VIOLATION} names the offending field.
   */
  public String message(String field) {
    if (this != UNIQUE_VIOLATION) {
      return messageTemplate;
    }
    return messageTemplate.formatted(field == null || field.isBlank() ? DEFAULT_FIELD : field);
  }
}
