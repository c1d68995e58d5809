package com.example.tenantguard.security.credential;

import com.example.tenantguard.properties.ApplicationProperties.SecurityProperties.FailureTrackingProperties;
import com.example.tenantguard.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Counts failed bearer authentications per client IP and blocks IPs that keep failing.
 * <p>
 * Counters and blocks are Redis keys with TTLs. Redis errors never block a request: they are
 * logged and the tracker answers as if the IP were clean.
 */
@Slf4j
@Component
public class CredentialFailureTracker {

  static final String FAILURE_COUNT_PREFIX = "auth:fail:count:";
  static final String BLOCK_PREFIX = "auth:fail:block:";

  private final RedisTemplate<String, String> redisTemplate;
  private final FailureTrackingProperties properties;
  private final Clock clock;

  public CredentialFailureTracker(RedisTemplate<String, String> redisTemplate,
                                  ApplicationProperties properties, Clock clock) {
    this.redisTemplate = redisTemplate;
    this.properties = properties.security().failureTracking();
    this.clock = clock;
  }

  public void recordFailure(String clientIp) {
    if (!properties.enabled() || clientIp == null) {
      return;
    }
    String countKey = FAILURE_COUNT_PREFIX + clientIp;

    try {
      Long failureCount = redisTemplate.opsForValue().increment(countKey);
      if (failureCount == null) {
        return;
      }
      if (failureCount == 1) {
        redisTemplate.expire(countKey, properties.window());
      }

      log.info("Credential failure recorded for IP: {} (count: {})",
               maskIpAddress(clientIp), failureCount);

      if (failureCount >= properties.maxFailures()) {
        blockIp(clientIp);
      }
    } catch (DataAccessException e) {
      log.error("Error recording credential failure", e);
    }
  }

  public boolean isBlocked(String clientIp) {
    if (!properties.enabled() || clientIp == null) {
      return false;
    }
    try {
      return Boolean.TRUE.equals(redisTemplate.hasKey(BLOCK_PREFIX + clientIp));
    } catch (DataAccessException e) {
      log.error("Error checking block status", e);
      return false;
    }
  }

  public void clearFailures(String clientIp) {
    if (!properties.enabled() || clientIp == null) {
      return;
    }
    try {
      redisTemplate.delete(FAILURE_COUNT_PREFIX + clientIp);
      log.debug("Cleared failure history for IP: {}", maskIpAddress(clientIp));
    } catch (DataAccessException e) {
      log.error("Error clearing failures", e);
    }
  }

  private void blockIp(String clientIp) {
    redisTemplate.opsForValue().set(
        BLOCK_PREFIX + clientIp,
        String.valueOf(clock.millis()),
        properties.blockDuration());
    redisTemplate.delete(FAILURE_COUNT_PREFIX + clientIp);

    log.warn("Blocked IP {} for {} due to repeated credential failures",
             maskIpAddress(clientIp), properties.blockDuration());
  }

  static String maskIpAddress(String ip) {
    if (ip == null) {
      return "***";
    }
    if (ip.contains(".")) {
      String[] parts = ip.split("\\.");
      if (parts.length == 4) {
        return parts[0] + "." + parts[1] + ".***." + parts[3];
      }
      return "***";
    }
    if (ip.contains(":")) {
      String[] groups = ip.split(":");
      return groups[0] + ":***";
    }
    return "***";
  }
}
