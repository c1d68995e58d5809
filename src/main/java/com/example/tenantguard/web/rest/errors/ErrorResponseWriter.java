package com.example.tenantguard.web.rest.errors;

import com.example.tenantguard.web.context.RequestContextResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes normalized error envelopes straight to the servlet response, for failures raised in
 * filters and security handlers where no controller advice applies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

  private final ErrorNormalizer errorNormalizer;
  private final RequestContextResolver contextResolver;
  private final ObjectMapper objectMapper;

  public void write(HttpServletRequest request, HttpServletResponse response, Throwable error)
      throws IOException {
    NormalizedError normalized = errorNormalizer.handle(error, contextResolver.resolve(request));
    if (response.isCommitted()) {
      log.warn("Response already committed, cannot render {} for {} {}",
               normalized.statusCode(), request.getMethod(), request.getRequestURI());
      return;
    }
    response.setStatus(normalized.statusCode());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getOutputStream(), normalized.envelope());
  }
}
