package com.example.tenantguard.audit;

/**
 * What the audit trail needs to know about a finished response.
 */
public record ResponseMeta(int statusCode) {

  public boolean isError() {
    return statusCode >= 400;
  }
}
