package com.example.tenantguard.domain.store;

import com.example.tenantguard.domain.entity.PrincipalRecord;

import java.util.Optional;

/**
 * Read access to principal records.
 */
public interface PrincipalStore {

  /**
   * Looks up a principal that is still active.
   *
   * @param id the subject identifier carried by the credential
   * @return the active record, or empty when the principal is missing or inactive
   */
  Optional<PrincipalRecord> findActiveById(String id);
}
