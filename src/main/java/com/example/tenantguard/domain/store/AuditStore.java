package com.example.tenantguard.domain.store;

import com.example.tenantguard.domain.entity.AuditRecord;
import com.example.tenantguard.exception.AuditStoreException;

import java.util.List;

/**
 * Append-only audit trail.
 */
public interface AuditStore {

  /**
   * Durably writes one record.
   *
   * @throws AuditStoreException if the record could not be written
   */
  void append(AuditRecord record);

  /**
   * Most recent records for a tenant, oldest first.
   */
  List<AuditRecord> findRecent(String tenantId, int limit);
}
