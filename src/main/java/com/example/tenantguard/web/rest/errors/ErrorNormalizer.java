package com.example.tenantguard.web.rest.errors;

import com.example.tenantguard.exception.ApiException;
import com.example.tenantguard.exception.ErrorKind;
import com.example.tenantguard.exception.StoreConstraintViolationException;
import com.example.tenantguard.properties.ApplicationProperties;
import com.example.tenantguard.web.context.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Component;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Error Normalizer - turns any failure raised anywhere in the request pipeline into one
 * {@link ErrorEnvelope}.
 * <p>
 * Classification order: {@link ApiException}, Spring Security failures, Spring MVC HTTP-level
 * errors, storage constraint violations, anything else. Unclassified failures become 500 with a
 * generic message. Stack traces are rendered only while a debug profile is active, and exception
 * type names are never rendered outside one. This class never throws.
 */
@Slf4j
@Component
public class ErrorNormalizer {

  static final String INTERNAL_MESSAGE = "Internal server error";
  static final String AUTHENTICATION_REQUIRED = "Authentication required";
  static final String ACCESS_DENIED = "Access denied";
  static final String MALFORMED_BODY = "Malformed request body";

  private final Environment environment;
  private final List<String> debugProfiles;
  private final Clock clock;

  @Autowired
  public ErrorNormalizer(Environment environment, ApplicationProperties properties, Clock clock) {
    this(environment, properties.errors().debugProfiles(), clock);
  }

  public ErrorNormalizer(Environment environment, List<String> debugProfiles, Clock clock) {
    this.environment = environment;
    this.debugProfiles = debugProfiles == null ? List.of() : List.copyOf(debugProfiles);
    this.clock = clock;
  }

  /**
   * Classifies the failure and logs it: 5xx at error with the stack trace, 4xx at warn.
   */
  public NormalizedError handle(Throwable error, RequestContext context) {
    NormalizedError normalized = normalize(error, context);
    ErrorEnvelope envelope = normalized.envelope();
    if (normalized.severity() == Level.ERROR) {
      log.error("{} {} - {} - {}", envelope.method(), envelope.path(), envelope.statusCode(),
                envelope.message(), error);
    } else {
      log.warn("{} {} - {} - {}", envelope.method(), envelope.path(), envelope.statusCode(),
               envelope.message());
    }
    return normalized;
  }

  public NormalizedError normalize(Throwable error, RequestContext context) {
    try {
      return classify(error, context);
    } catch (RuntimeException e) {
      log.error("Failed to classify {}", error == null ? null : error.getClass().getName(), e);
      return build(HttpStatus.INTERNAL_SERVER_ERROR.value(), ErrorKind.INTERNAL_SERVER_ERROR,
                   INTERNAL_MESSAGE, error, context);
    }
  }

  public boolean isDebugMode() {
    return !debugProfiles.isEmpty()
        && environment.acceptsProfiles(Profiles.of(debugProfiles.toArray(String[]::new)));
  }

  private NormalizedError classify(Throwable error, RequestContext context) {
    if (error instanceof ApiException apiException) {
      List<String> messages = apiException.getMessages();
      Object message = messages.size() == 1 ? messages.get(0) : messages;
      return build(apiException.getStatus().value(), apiException.getErrorKind(), message, error,
                   context);
    }
    if (error instanceof AuthenticationException) {
      return build(HttpStatus.UNAUTHORIZED.value(), ErrorKind.AUTHENTICATION_ERROR,
                   AUTHENTICATION_REQUIRED, error, context);
    }
    if (error instanceof AccessDeniedException) {
      return build(HttpStatus.FORBIDDEN.value(), ErrorKind.AUTHORIZATION_ERROR, ACCESS_DENIED,
                   error, context);
    }
    if (error instanceof MethodArgumentNotValidException invalid) {
      List<String> messages = invalid.getBindingResult().getAllErrors().stream()
          .map(ErrorNormalizer::describe)
          .toList();
      return build(HttpStatus.BAD_REQUEST.value(), ErrorKind.VALIDATION_ERROR, messages, error,
                   context);
    }
    if (error instanceof HttpMessageNotReadableException) {
      return build(HttpStatus.BAD_REQUEST.value(), ErrorKind.VALIDATION_ERROR, MALFORMED_BODY,
                   error, context);
    }
    if (error instanceof ErrorResponse errorResponse) {
      int status = errorResponse.getStatusCode().value();
      String detail = errorResponse.getBody().getDetail();
      return build(status, ErrorKind.forStatus(status),
                   detail == null ? reasonPhrase(status) : detail, error, context);
    }

    Optional<NormalizedError> storage = classifyStorage(error, context);
    if (storage.isPresent()) {
      return storage.get();
    }

    String kind = isDebugMode() && error != null
        ? error.getClass().getSimpleName()
        : ErrorKind.INTERNAL_SERVER_ERROR;
    return build(HttpStatus.INTERNAL_SERVER_ERROR.value(), kind, INTERNAL_MESSAGE, error, context);
  }

  private Optional<NormalizedError> classifyStorage(Throwable error, RequestContext context) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable current = error; current != null && seen.add(current);
         current = current.getCause()) {
      if (current instanceof StoreConstraintViolationException violation) {
        String field = violation.getTarget().isEmpty() ? null : violation.getTarget().get(0);
        return Optional.of(fromStorageCode(violation.getCode(), field, error, context));
      }
      if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
        return Optional.of(fromStorageCode(sqlException.getSQLState(), null, error, context));
      }
    }
    return Optional.empty();
  }

  private NormalizedError fromStorageCode(String code, String field, Throwable error,
                                          RequestContext context) {
    StorageErrorCode storageError = StorageErrorCode.fromCode(code);
    return build(storageError.getStatus().value(), storageError.getErrorKind(),
                 storageError.message(field), error, context);
  }

  private NormalizedError build(int status, String kind, Object message, Throwable error,
                                RequestContext context) {
    ErrorEnvelope envelope = new ErrorEnvelope(
        status,
        clock.instant(),
        context == null ? null : context.path(),
        context == null ? null : context.method(),
        kind,
        message,
        isDebugMode() ? stackTrace(error) : null
    );
    return new NormalizedError(envelope, status >= 500 ? Level.ERROR : Level.WARN);
  }

  private static String describe(ObjectError error) {
    if (error instanceof FieldError fieldError) {
      return fieldError.getField() + " " + fieldError.getDefaultMessage();
    }
    return error.getDefaultMessage();
  }

  private static String reasonPhrase(int status) {
    HttpStatus resolved = HttpStatus.resolve(status);
    return resolved == null ? String.valueOf(status) : resolved.getReasonPhrase();
  }

  private static String stackTrace(Throwable error) {
    if (error == null) {
      return null;
    }
    StringWriter writer = new StringWriter();
    error.printStackTrace(new PrintWriter(writer));
    return writer.toString();
  }
}
