package com.example.tenantguard.domain.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Privilege levels, highest first. {@link #PLATFORM_ADMIN} is the only platform-level role and
 * the only role that is not scoped to a tenant.
 */
public enum Role {
  PLATFORM_ADMIN,
  TENANT_ADMIN,
  END_USER,
  COLLABORATOR;

  public boolean isPlatformSuperRole() {
    return this == PLATFORM_ADMIN;
  }

  /**
   * Parses a stored role value. Unknown values yield an empty result rather than a default role.
   */
  public static Optional<Role> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Role.valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * Spring Security authority name for this role.
   */
  public String authority() {
    return "ROLE_" + name();
  }
}
