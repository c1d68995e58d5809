package com.example.tenantguard.domain.entity;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Principal - the authenticated identity of the current request.
 * Built fresh per request by the credential validator and never mutated.
 */
public record Principal(
    String id,
    String email,
    Role role,
    String tenantId,
    boolean verified,
    boolean mfaEnabled,
    Instant lockedUntil
) {

  public Principal {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
  }

  public Optional<String> tenant() {
    return Optional.ofNullable(tenantId).filter(t -> !t.isBlank());
  }
}
