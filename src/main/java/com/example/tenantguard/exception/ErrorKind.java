package com.example.tenantguard.exception;

import lombok.experimental.UtilityClass;
import org.springframework.http.HttpStatus;

import java.util.Locale;

/**
 * Error kind tags rendered in the {@code error} field of every error response.
 */
@UtilityClass
public class ErrorKind {

  public static final String VALIDATION_ERROR = "ValidationError";
  public static final String AUTHENTICATION_ERROR = "AuthenticationError";
  public static final String AUTHORIZATION_ERROR = "AuthorizationError";
  public static final String NOT_FOUND_ERROR = "NotFoundError";
  public static final String CONFLICT_ERROR = "ConflictError";
  public static final String DATABASE_ERROR = "DatabaseError";
  public static final String INTERNAL_SERVER_ERROR = "InternalServerError";

  /**
   * Tag for an HTTP-level error that carries no tag of its own.
   */
  public static String forStatus(int statusCode) {
    return switch (statusCode) {
      case 400 -> VALIDATION_ERROR;
      case 401 -> AUTHENTICATION_ERROR;
      case 403 -> AUTHORIZATION_ERROR;
      case 404 -> NOT_FOUND_ERROR;
      case 409 -> CONFLICT_ERROR;
      case 500 -> INTERNAL_SERVER_ERROR;
      default -> pascalCase(statusCode);
    };
  }

  private static String pascalCase(int statusCode) {
    HttpStatus status = HttpStatus.resolve(statusCode);
    if (status == null) {
      return "HttpError";
    }
    StringBuilder tag = new StringBuilder();
    for (String word : status.getReasonPhrase().split("[^A-Za-z0-9]+")) {
      if (!word.isEmpty()) {
        tag.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
            .append(word.substring(1).toLowerCase(Locale.ROOT));
      }
    }
    return tag.toString();
  }
}
