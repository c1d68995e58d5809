package com.example.tenantguard.security.authorization;

import com.example.tenantguard.security.policy.AccessPolicy;

import java.util.Optional;

/**
 * Outcome of evaluating one policy for one request. A denial always carries its reason.
 */
public record AuthorizationDecision(boolean allowed, DenialReason denialReason, String policyName) {

  public AuthorizationDecision {
    if (allowed == (denialReason != null)) {
      throw new IllegalArgumentException("A denial reason is required exactly when access is denied");
    }
  }

  public static AuthorizationDecision allow(AccessPolicy policy) {
    return new AuthorizationDecision(true, null, policy.name());
  }

  public static AuthorizationDecision deny(AccessPolicy policy, DenialReason reason) {
    return new AuthorizationDecision(false, reason, policy.name());
  }

  public Optional<DenialReason> reason() {
    return Optional.ofNullable(denialReason);
  }
}
