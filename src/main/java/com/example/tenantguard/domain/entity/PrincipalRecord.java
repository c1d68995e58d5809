package com.example.tenantguard.domain.entity;

import java.time.Instant;

/**
 * Principal as held by the principal store.
 */
public record PrincipalRecord(
    String id,
    String email,
    Role role,
    String tenantId,
    boolean verified,
    boolean mfaEnabled,
    Instant lockedUntil,
    boolean active
) {

  public boolean isLockedAt(Instant now) {
    return lockedUntil != null && lockedUntil.isAfter(now);
  }

  public Principal toPrincipal() {
    return new Principal(id, email, role, tenantId, verified, mfaEnabled, lockedUntil);
  }
}
