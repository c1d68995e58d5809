package com.example.tenantguard.domain.entity;

public enum AuditEventType {
  AUTHENTICATION,
  SECURITY_EVENT,
  DATA_ACCESS
}
