package com.example.tenantguard.security.policy;

import static com.example.tenantguard.domain.entity.Role.COLLABORATOR;
import static com.example.tenantguard.domain.entity.Role.END_USER;
import static com.example.tenantguard.domain.entity.Role.PLATFORM_ADMIN;
import static com.example.tenantguard.domain.entity.Role.TENANT_ADMIN;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Canonical policies. They differ only in data, so each is a named constant.
 */
public final class AccessPolicies {

  public static final AccessPolicy PLATFORM_ADMIN_ONLY =
      AccessPolicy.of("PLATFORM_ADMIN_ONLY", Set.of(PLATFORM_ADMIN), false);

  public static final AccessPolicy TENANT_ADMIN_OR_ABOVE =
      AccessPolicy.of("TENANT_ADMIN_OR_ABOVE", Set.of(PLATFORM_ADMIN, TENANT_ADMIN), true);

  public static final AccessPolicy AUTHENTICATED_USERS =
      AccessPolicy.of("AUTHENTICATED_USERS",
                      EnumSet.of(PLATFORM_ADMIN, TENANT_ADMIN, END_USER, COLLABORATOR), false);

  public static final AccessPolicy TENANT_USERS =
      AccessPolicy.of("TENANT_USERS", Set.of(PLATFORM_ADMIN, TENANT_ADMIN, END_USER), true);

  /**
   * Bound to protected handlers that declare no policy.
   */
  public static final AccessPolicy DENY_ALL = AccessPolicy.of("DENY_ALL", Set.of(), false);

  private static final Map<String, AccessPolicy> BY_NAME = Stream.of(
          PLATFORM_ADMIN_ONLY, TENANT_ADMIN_OR_ABOVE, AUTHENTICATED_USERS, TENANT_USERS, DENY_ALL)
      .collect(Collectors.toUnmodifiableMap(AccessPolicy::name, Function.identity()));

  private AccessPolicies() {}

  public static Optional<AccessPolicy> byName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
