package com.example.tenantguard.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Audit Record - durable trace of one request.
 * <p>
 * Holds request metadata only: query parameters (sensitive values redacted) and the names of
 * body fields. Body values and credentials are never captured.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditRecord(
    AuditEventType eventType,
    String actorId,
    String tenantId,
    AuditAction action,
    String resource,
    String resourceId,
    String ipAddress,
    String userAgent,
    String method,
    String endpoint,
    long durationMs,
    int statusCode,
    boolean success,
    String errorMessage,
    Map<String, Object> metadata,
    Instant occurredAt
) {

  public static final String UNKNOWN_TENANT = "unknown";

  public AuditRecord {
    tenantId = (tenantId == null || tenantId.isBlank()) ? UNKNOWN_TENANT : tenantId;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
