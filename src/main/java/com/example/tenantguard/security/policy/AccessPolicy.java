package com.example.tenantguard.security.policy;

import com.example.tenantguard.domain.entity.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative authorization rule bound to a handler.
 * <p>
 * Immutable and shared across requests. An empty {@code allowedRoles} set is accepted so that a
 * misconfigured policy can exist, but such a policy denies every principal.
 *
 * @param name               identifier used for registration and logging
 * @param allowedRoles       roles that may pass the policy
 * @param requireTenantMatch the resource tenant (when present) must equal the principal's tenant
 * @param requireOwnership   the resource owner (when present) must be the principal
 * @param resource           informational resource label, may be null
 * @param action             informational action label, may be null
 */
public record AccessPolicy(
    String name,
    Set<Role> allowedRoles,
    boolean requireTenantMatch,
    boolean requireOwnership,
    String resource,
    String action
) {

  public AccessPolicy {
    Objects.requireNonNull(name, "name");
    allowedRoles = allowedRoles == null || allowedRoles.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(allowedRoles));
  }

  public static AccessPolicy of(String name, Set<Role> allowedRoles, boolean requireTenantMatch) {
    return new AccessPolicy(name, allowedRoles, requireTenantMatch, false, null, null);
  }

  public boolean permits(Role role) {
    return allowedRoles.contains(role);
  }

  public AccessPolicy withOwnership() {
    return new AccessPolicy(name, allowedRoles, requireTenantMatch, true, resource, action);
  }

  public AccessPolicy describing(String resource, String action) {
    return new AccessPolicy(name, allowedRoles, requireTenantMatch, requireOwnership, resource, action);
  }
}
