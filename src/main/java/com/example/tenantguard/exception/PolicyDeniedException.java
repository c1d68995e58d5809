package com.example.tenantguard.exception;

import com.example.tenantguard.security.authorization.DenialReason;
import org.springframework.http.HttpStatus;

/**
 * Translation of a denied authorization decision into a 403 response.
 */
public class PolicyDeniedException extends ApiException {

  private final DenialReason reason;
  private final String policyName;

  public PolicyDeniedException(DenialReason reason, String policyName) {
    super(HttpStatus.FORBIDDEN, ErrorKind.AUTHORIZATION_ERROR, reason.getMessage());
    this.reason = reason;
    this.policyName = policyName;
  }

  public DenialReason getReason() {
    return reason;
  }

  public String getPolicyName() {
    return policyName;
  }
}
