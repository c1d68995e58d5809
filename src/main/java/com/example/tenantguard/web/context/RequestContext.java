package com.example.tenantguard.web.context;

import com.example.tenantguard.domain.entity.Principal;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-request view consumed by authorization, audit and error rendering.
 * <p>
 * Carries names and identifiers only; the raw credential and body values are never held here.
 */
public record RequestContext(
    String method,
    String path,
    Map<String, String> pathVariables,
    Map<String, List<String>> queryParameters,
    List<String> bodyFieldNames,
    String resourceTenantId,
    String resourceOwnerId,
    String clientIp,
    String userAgent,
    Principal principal
) {

  public RequestContext {
    pathVariables = pathVariables == null ? Map.of() : Map.copyOf(pathVariables);
    queryParameters = queryParameters == null ? Map.of() : Map.copyOf(queryParameters);
    bodyFieldNames = bodyFieldNames == null ? List.of() : List.copyOf(bodyFieldNames);
  }

  public Optional<String> resourceTenant() {
    return Optional.ofNullable(resourceTenantId);
  }

  public Optional<String> resourceOwner() {
    return Optional.ofNullable(resourceOwnerId);
  }

  public Optional<Principal> currentPrincipal() {
    return Optional.ofNullable(principal);
  }
}
