package com.example.tenantguard.web.rest.dto;

import com.example.tenantguard.domain.entity.Principal;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The authenticated principal as returned to its owner.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrincipalResponse(
    String id,
    String email,
    String role,
    String tenantId,
    boolean verified,
    boolean mfaEnabled
) {

  public static PrincipalResponse from(Principal principal) {
    return new PrincipalResponse(
        principal.id(),
        principal.email(),
        principal.role().name(),
        principal.tenant().orElse(null),
        principal.verified(),
        principal.mfaEnabled());
  }
}
