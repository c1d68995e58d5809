package com.example.tenantguard.web.rest.controller;

import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.exception.CredentialException.CredentialFailure;
import com.example.tenantguard.exception.CredentialException;
import com.example.tenantguard.security.policy.RequiresPolicy;
import com.example.tenantguard.web.context.RequestContextResolver;
import com.example.tenantguard.web.rest.dto.PrincipalResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PrincipalController implements PrincipalAPI {

  private final HttpServletRequest request;

  @Override
  @RequiresPolicy(value = "AUTHENTICATED_USERS", resource = "user", action = "VIEW")
  public ResponseEntity<PrincipalResponse> currentPrincipal() {
    Principal principal = RequestContextResolver.principal(request);
    if (principal == null) {
      throw new CredentialException(CredentialFailure.INVALID_CREDENTIAL);
    }
    return ResponseEntity.ok(PrincipalResponse.from(principal));
  }
}
