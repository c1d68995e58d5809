package com.example.tenantguard.support;

import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.domain.entity.PrincipalRecord;
import com.example.tenantguard.domain.entity.Role;
import com.example.tenantguard.web.context.RequestContext;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Domain fixtures shared by unit and integration tests.
 */
public final class Fixtures {

  private Fixtures() {}

  public static Principal principal(String id, Role role, String tenantId) {
    return new Principal(id, id + "@example.com", role, tenantId, true, false, null);
  }

  public static PrincipalRecord activeRecord(String id, Role role, String tenantId) {
    return new PrincipalRecord(id, id + "@example.com", role, tenantId, true, false, null, true);
  }

  public static PrincipalRecord lockedRecord(String id, Role role, String tenantId,
                                             Instant lockedUntil) {
    return new PrincipalRecord(id, id + "@example.com", role, tenantId, true, false, lockedUntil,
                               true);
  }

  public static RequestContext context(String method, String path, String resourceTenant,
                                       String resourceOwner, Principal principal) {
    return new RequestContext(method, path, Map.of(), Map.of(), List.of(), resourceTenant,
                              resourceOwner, "203.0.113.7", "junit", principal);
  }
}
