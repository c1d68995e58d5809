package com.example.tenantguard.security.authorization;

import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.domain.entity.Role;
import com.example.tenantguard.properties.ApplicationProperties;
import com.example.tenantguard.security.policy.AccessPolicy;
import com.example.tenantguard.web.context.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Authorization Engine - decides whether a principal may invoke a handler bound to a policy.
 * <p>
 * Pure: the decision depends only on the principal, the policy and the request's resource
 * identifiers. Checks run in a fixed order and the first failing check names the denial:
 * <ol>
 *   <li>no principal: {@link DenialReason#UNAUTHENTICATED}</li>
 *   <li>policy with no allowed roles, or role not allowed: {@link DenialReason#ROLE_NOT_PERMITTED}</li>
 *   <li>{@link Role#PLATFORM_ADMIN}: allowed, tenant and ownership checks are skipped</li>
 *   <li>tenant match: {@link DenialReason#NO_TENANT_CONTEXT} or {@link DenialReason#TENANT_MISMATCH}</li>
 *   <li>ownership: {@link DenialReason#OWNERSHIP_VIOLATION} unless the role overrides ownership</li>
 * </ol>
 * A resource identifier the request does not carry is treated as not applicable.
 */
@Slf4j
@Component
public class AuthorizationEngine {

  private final Set<Role> ownershipOverrideRoles;

  @Autowired
  public AuthorizationEngine(ApplicationProperties properties) {
    this(properties.security().ownershipOverrideRoles());
  }

  public AuthorizationEngine(Set<Role> ownershipOverrideRoles) {
    this.ownershipOverrideRoles = ownershipOverrideRoles == null || ownershipOverrideRoles.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(ownershipOverrideRoles));
  }

  public AuthorizationDecision authorize(Principal principal, AccessPolicy policy,
                                         RequestContext context) {
    if (principal == null) {
      return AuthorizationDecision.deny(policy, DenialReason.UNAUTHENTICATED);
    }

    if (policy.allowedRoles().isEmpty()) {
      log.error("Policy {} allows no roles; denying {} {}", policy.name(), context.method(),
                context.path());
      return AuthorizationDecision.deny(policy, DenialReason.ROLE_NOT_PERMITTED);
    }

    Role role = principal.role();
    if (!policy.permits(role)) {
      log.debug("Role {} not permitted by policy {}", role, policy.name());
      return AuthorizationDecision.deny(policy, DenialReason.ROLE_NOT_PERMITTED);
    }

    if (role.isPlatformSuperRole()) {
      return AuthorizationDecision.allow(policy);
    }

    if (policy.requireTenantMatch()) {
      Optional<String> principalTenant = principal.tenant();
      if (principalTenant.isEmpty()) {
        return AuthorizationDecision.deny(policy, DenialReason.NO_TENANT_CONTEXT);
      }
      Optional<String> resourceTenant = context.resourceTenant();
      if (resourceTenant.isPresent() && !resourceTenant.get().equals(principalTenant.get())) {
        log.debug("Principal {} of tenant {} denied access to tenant {}", principal.id(),
                  principalTenant.get(), resourceTenant.get());
        return AuthorizationDecision.deny(policy, DenialReason.TENANT_MISMATCH);
      }
    }

    if (policy.requireOwnership() && !ownershipOverrideRoles.contains(role)) {
      Optional<String> owner = context.resourceOwner();
      if (owner.isPresent() && !owner.get().equals(principal.id())) {
        return AuthorizationDecision.deny(policy, DenialReason.OWNERSHIP_VIOLATION);
      }
    }

    return AuthorizationDecision.allow(policy);
  }
}
