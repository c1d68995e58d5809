package com.example.tenantguard.adapter.redis.dto;

/**
 * Outcome of one Redis round trip made by the readiness probe.
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String version,
    int connectedClients,
    String error
) {

  public static RedisHealthResponse up(long responseTimeMs, String version, int connectedClients) {
    return new RedisHealthResponse(true, responseTimeMs, version, connectedClients, null);
  }

  public static RedisHealthResponse down(long responseTimeMs, String error) {
    return new RedisHealthResponse(false, responseTimeMs, null, 0, error);
  }
}
