package com.example.tenantguard.adapter.redis.store;

import com.example.tenantguard.domain.entity.AuditRecord;
import com.example.tenantguard.domain.store.AuditStore;
import com.example.tenantguard.exception.AuditStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Audit store keeping one append-only Redis list of JSON records per tenant.
 * <p>
 * Records without a tenant land under the {@code unknown} tenant. Writes are protected by the
 * "auditStore" circuit breaker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisAuditStore implements AuditStore {

  static final String KEY_PREFIX = "audit:tenant:";
  private static final String AUDIT_STORE_BREAKER = "auditStore";

  private final RedisTemplate<String, String> redisTemplate;
  private final ObjectMapper objectMapper;

  @Override
  @CircuitBreaker(name = AUDIT_STORE_BREAKER, fallbackMethod = "appendFallback")
  public void append(AuditRecord record) {
    String json;
    try {
      json = objectMapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new AuditStoreException("Failed to serialize audit record", e);
    }
    try {
      redisTemplate.opsForList().rightPush(key(record.tenantId()), json);
    } catch (DataAccessException e) {
      throw new AuditStoreException("Failed to append audit record for tenant " + record.tenantId(), e);
    }
  }

  /**
   * Fallback for the audit store circuit breaker.
   */
  public void appendFallback(AuditRecord record, Throwable ex) {
    if (ex instanceof AuditStoreException auditStoreException) {
      throw auditStoreException;
    }
    throw new AuditStoreException("Audit store unavailable", ex);
  }

  @Override
  public List<AuditRecord> findRecent(String tenantId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<String> raw;
    try {
      raw = redisTemplate.opsForList().range(key(tenantId), -limit, -1);
    } catch (DataAccessException e) {
      throw new AuditStoreException("Failed to read audit records for tenant " + tenantId, e);
    }
    if (raw == null) {
      return List.of();
    }
    List<AuditRecord> records = new ArrayList<>(raw.size());
    for (String json : raw) {
      try {
        records.add(objectMapper.readValue(json, AuditRecord.class));
      } catch (JsonProcessingException e) {
        log.warn("Skipping unreadable audit record for tenant {}: {}", tenantId, e.getOriginalMessage());
      }
    }
    return records;
  }

  private static String key(String tenantId) {
    return KEY_PREFIX + (tenantId == null || tenantId.isBlank() ? AuditRecord.UNKNOWN_TENANT : tenantId);
  }
}
