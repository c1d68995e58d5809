package com.example.tenantguard.web.filter;

import com.example.tenantguard.exception.PayloadTooLargeException;
import com.example.tenantguard.web.context.CachedBodyHttpServletRequest;
import com.example.tenantguard.web.rest.errors.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Buffers JSON request bodies so tenant and owner fields can be inspected before the handler
 * reads the body.
 * <p>
 * Bodies larger than the inspection limit are rejected with 413, so no field can reach a handler
 * without having been inspected.
 */
@Slf4j
public class RequestBodyCachingFilter extends OncePerRequestFilter {

  private final long maxBodyBytes;
  private final ErrorResponseWriter errorResponseWriter;

  public RequestBodyCachingFilter(long maxBodyBytes, ErrorResponseWriter errorResponseWriter) {
    this.maxBodyBytes = maxBodyBytes;
    this.errorResponseWriter = errorResponseWriter;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isJson(request.getContentType());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
  ) throws ServletException, IOException {

    if (request.getContentLengthLong() > maxBodyBytes) {
      reject(request, response);
      return;
    }

    byte[] body = request.getInputStream().readNBytes(readLimit(maxBodyBytes));
    if (body.length > maxBodyBytes) {
      reject(request, response);
      return;
    }

    filterChain.doFilter(new CachedBodyHttpServletRequest(request, body), response);
  }

  private void reject(HttpServletRequest request, HttpServletResponse response) throws IOException {
    log.debug("Rejecting {} {}: body exceeds {} bytes", request.getMethod(),
              request.getRequestURI(), maxBodyBytes);
    errorResponseWriter.write(request, response, new PayloadTooLargeException(maxBodyBytes));
  }

  /** One byte past the limit, so an oversized body is detectable, capped at the array size limit. */
  static int readLimit(long maxBodyBytes) {
    return (int) Math.min(maxBodyBytes, Integer.MAX_VALUE - 1L) + 1;
  }

  static boolean isJson(String contentType) {
    if (!StringUtils.hasText(contentType)) {
      return false;
    }
    try {
      MediaType mediaType = MediaType.parseMediaType(contentType);
      return MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)
          || (mediaType.getSubtype() != null && mediaType.getSubtype().endsWith("+json"));
    } catch (InvalidMediaTypeException e) {
      log.debug("Unparseable content type {}", contentType);
      return false;
    }
  }
}
