package com.example.tenantguard.audit;

import com.example.tenantguard.web.context.RequestContextResolver;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;

/**
 * Hands every finished request to the {@link AuditRecorder}.
 * <p>
 * Registered ahead of Spring Security so that rejected requests are audited too. A request counts
 * as finished once the filter chain has returned and the response has been flushed, or, for
 * async requests, once the async cycle completes. Requests whose chain throws, whose flush fails
 * or whose async cycle times out or errors are not audited.
 */
@Slf4j
@RequiredArgsConstructor
public class AuditFilter extends OncePerRequestFilter {

  private final AuditRecorder auditRecorder;
  private final RequestContextResolver contextResolver;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
  ) throws ServletException, IOException {

    long start = System.nanoTime();
    filterChain.doFilter(request, response);

    if (request.isAsyncStarted()) {
      request.getAsyncContext().addListener(new AuditAsyncListener(request, response, start));
      return;
    }

    try {
      response.flushBuffer();
    } catch (IOException e) {
      log.debug("Response for {} {} could not be completed, skipping audit: {}",
                request.getMethod(), request.getRequestURI(), e.getMessage());
      return;
    }
    record(request, response, start);
  }

  private void record(HttpServletRequest request, HttpServletResponse response, long start) {
    Duration duration = Duration.ofNanos(System.nanoTime() - start);
    auditRecorder.maybeRecord(contextResolver.resolve(request),
                              new ResponseMeta(response.getStatus()), duration);
  }

  private final class AuditAsyncListener implements AsyncListener {

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private final long start;
    private volatile boolean abandoned;

    private AuditAsyncListener(HttpServletRequest request, HttpServletResponse response,
                               long start) {
      this.request = request;
      this.response = response;
      this.start = start;
    }

    @Override
    public void onComplete(AsyncEvent event) {
      if (!abandoned) {
        record(request, response, start);
      }
    }

    @Override
    public void onTimeout(AsyncEvent event) {
      abandoned = true;
      log.debug("Async request {} {} timed out, skipping audit", request.getMethod(),
                request.getRequestURI());
    }

    @Override
    public void onError(AsyncEvent event) {
      abandoned = true;
      log.debug("Async request {} {} failed, skipping audit", request.getMethod(),
                request.getRequestURI());
    }

    @Override
    public void onStartAsync(AsyncEvent event) {
      event.getAsyncContext().addListener(this);
    }
  }
}
