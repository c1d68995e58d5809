package com.example.tenantguard.web.rest.errors;

import org.slf4j.event.Level;

/**
 * A classified failure: what to send back and how loudly to log it.
 */
public record NormalizedError(ErrorEnvelope envelope, Level severity) {

  public int statusCode() {
    return envelope.statusCode();
  }
}
