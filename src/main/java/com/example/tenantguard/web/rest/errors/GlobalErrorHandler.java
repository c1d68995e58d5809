package com.example.tenantguard.web.rest.errors;

import com.example.tenantguard.web.context.RequestContextResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global Error Handler
 * <p>
 * Every exception that reaches Spring MVC, including policy denials raised before the handler
 * runs, is rendered through the {@link ErrorNormalizer}.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalErrorHandler {

  private final ErrorNormalizer errorNormalizer;
  private final RequestContextResolver contextResolver;

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorEnvelope> handleException(Exception ex, HttpServletRequest request) {
    NormalizedError normalized = errorNormalizer.handle(ex, contextResolver.resolve(request));
    return ResponseEntity.status(normalized.statusCode())
        .contentType(MediaType.APPLICATION_JSON)
        .body(normalized.envelope());
  }
}
