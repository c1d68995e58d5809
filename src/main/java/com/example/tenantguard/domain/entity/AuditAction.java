package com.example.tenantguard.domain.entity;

/**
 * Coarse action label recorded with each audit entry.
 */
public enum AuditAction {
  LOGIN,
  LOGOUT,
  REGISTER,
  FORGOT_PASSWORD,
  RESET_PASSWORD,
  VERIFY_EMAIL,
  CHANGE_PASSWORD,
  CREATE,
  UPDATE,
  DELETE,
  VIEW,
  UNKNOWN
}
