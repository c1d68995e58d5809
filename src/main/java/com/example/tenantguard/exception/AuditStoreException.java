package com.example.tenantguard.exception;

/**
 * Audit Store Exception
 */
public class AuditStoreException extends RuntimeException {
  public AuditStoreException(String message) {
    super(message);
  }

  public AuditStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
