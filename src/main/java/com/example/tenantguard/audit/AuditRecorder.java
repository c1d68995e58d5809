package com.example.tenantguard.audit;

import com.example.tenantguard.domain.entity.AuditRecord;
import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.domain.store.AuditStore;
import com.example.tenantguard.properties.ApplicationProperties;
import com.example.tenantguard.web.context.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Audit Recorder - captures one audit record per eligible finished request.
 * <p>
 * The record is built on the request thread; persistence runs on the bounded audit executor so
 * the response never waits on the audit store. Audit is best-effort: a full queue or a failing
 * store loses the record and is logged, never surfaced to the client.
 */
@Slf4j
@Component
public class AuditRecorder {

  static final String REDACTED = "[REDACTED]";
  private static final Set<String> SENSITIVE_QUERY_KEYS = Set.of(
      "token", "access_token", "refresh_token", "password", "secret", "code", "otp", "api_key",
      "apikey");

  private final AuditStore auditStore;
  private final Executor auditExecutor;
  private final Clock clock;
  private final boolean enabled;

  @Autowired
  public AuditRecorder(AuditStore auditStore,
                       @Qualifier("auditExecutor") Executor auditExecutor,
                       Clock clock,
                       ApplicationProperties properties) {
    this(auditStore, auditExecutor, clock, properties.audit().enabled());
  }

  public AuditRecorder(AuditStore auditStore, Executor auditExecutor, Clock clock,
                       boolean enabled) {
    this.auditStore = auditStore;
    this.auditExecutor = auditExecutor;
    this.clock = clock;
    this.enabled = enabled;
  }

  /**
   * Records the request if it is audit-eligible.
   *
   * @return the record handed to persistence, or empty when the request is not audited
   */
  public Optional<AuditRecord> maybeRecord(RequestContext context, ResponseMeta response,
                                           Duration duration) {
    if (!enabled
        || !AuditClassifier.shouldAudit(context.method(), context.path(),
                                        context.principal() != null)) {
      return Optional.empty();
    }

    AuditRecord record = buildRecord(context, response, duration);
    try {
      auditExecutor.execute(() -> persist(record));
    } catch (RejectedExecutionException e) {
      log.warn("Audit queue full, dropping {} record for {} {}", record.action(),
               record.method(), record.endpoint());
    }
    return Optional.of(record);
  }

  AuditRecord buildRecord(RequestContext context, ResponseMeta response, Duration duration) {
    Principal principal = context.principal();
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("queryParams", redact(context.queryParameters()));
    metadata.put("bodyKeys", context.bodyFieldNames());
    metadata.put("bodyKeyCount", context.bodyFieldNames().size());

    return new AuditRecord(
        AuditClassifier.eventTypeFor(context.path(), response.statusCode()),
        principal == null ? null : principal.id(),
        principal == null ? null : principal.tenantId(),
        AuditClassifier.actionFor(context.method(), context.path()),
        AuditClassifier.resourceFor(context.path()),
        context.pathVariables().get("id"),
        context.clientIp(),
        context.userAgent(),
        context.method(),
        context.path(),
        duration.toMillis(),
        response.statusCode(),
        !response.isError(),
        response.isError() ? reasonPhrase(response.statusCode()) : null,
        metadata,
        clock.instant()
    );
  }

  private void persist(AuditRecord record) {
    try {
      auditStore.append(record);
    } catch (RuntimeException e) {
      log.error("Failed to persist audit record {} {} for tenant {}", record.action(),
                record.endpoint(), record.tenantId(), e);
    }
  }

  private static Map<String, List<String>> redact(Map<String, List<String>> queryParameters) {
    Map<String, List<String>> redacted = new LinkedHashMap<>();
    queryParameters.forEach((name, values) -> {
      if (SENSITIVE_QUERY_KEYS.contains(name.toLowerCase(Locale.ROOT))) {
        List<String> masked = new ArrayList<>(values.size());
        values.forEach(value -> masked.add(REDACTED));
        redacted.put(name, masked);
      } else {
        redacted.put(name, values);
      }
    });
    return redacted;
  }

  private static String reasonPhrase(int statusCode) {
    HttpStatus status = HttpStatus.resolve(statusCode);
    return status == null ? String.valueOf(statusCode) : status.getReasonPhrase();
  }
}
