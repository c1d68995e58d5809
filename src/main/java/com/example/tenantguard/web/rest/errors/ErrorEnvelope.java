package com.example.tenantguard.web.rest.errors;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * The one error response shape every failure is rendered with.
 *
 * @param message a single string, or an ordered list of strings for multi-message validation
 *                failures
 * @param stack   stack trace, only present when a debug profile is active
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEnvelope(
    int statusCode,
    Instant timestamp,
    String path,
    String method,
    String error,
    Object message,
    String stack
) {}
