package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

/**
 * Bearer credential could not be turned into a principal. Always rendered as 401.
 */
public class CredentialException extends ApiException {

  private final CredentialFailure failure;

  public CredentialException(CredentialFailure failure) {
    super(HttpStatus.UNAUTHORIZED, ErrorKind.AUTHENTICATION_ERROR, failure.getMessage());
    this.failure = failure;
  }

  public CredentialException(CredentialFailure failure, Throwable cause) {
    super(HttpStatus.UNAUTHORIZED, ErrorKind.AUTHENTICATION_ERROR, failure.getMessage(), cause);
    this.failure = failure;
  }

  public CredentialFailure getFailure() {
    return failure;
  }

  public enum CredentialFailure {
    INVALID_CREDENTIAL("Invalid or expired token"),
    PRINCIPAL_NOT_FOUND("User not found or inactive"),
    ACCOUNT_LOCKED("Account is temporarily locked");

    private final String message;

    CredentialFailure(String message) {
      this.message = message;
    }

    public String getMessage() {
      return message;
    }
  }
}
