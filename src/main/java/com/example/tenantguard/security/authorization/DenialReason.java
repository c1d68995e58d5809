package com.example.tenantguard.security.authorization;

/**
 * Why a policy denied a request. The message is safe to return to clients.
 */
public enum DenialReason {
  UNAUTHENTICATED("Authentication required"),
  ROLE_NOT_PERMITTED("Access denied. Your role is not permitted for this resource"),
  NO_TENANT_CONTEXT("User must belong to a tenant"),
  TENANT_MISMATCH("Access denied to resources outside your tenant"),
  OWNERSHIP_VIOLATION("Access denied to resources you do not own");

  private final String message;

  DenialReason(String message) {
    this.message = message;
  }

  public String getMessage() {
    return message;
  }
}
