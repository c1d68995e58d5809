package com.example.tenantguard.exception;

import org.springframework.http.HttpStatus;

/**
 * Request body exceeds the size the pipeline is willing to inspect.
 */
public class PayloadTooLargeException extends ApiException {

  public PayloadTooLargeException(long limitBytes) {
    super(HttpStatus.PAYLOAD_TOO_LARGE, ErrorKind.forStatus(413),
          "Request body exceeds " + limitBytes + " bytes");
  }
}
