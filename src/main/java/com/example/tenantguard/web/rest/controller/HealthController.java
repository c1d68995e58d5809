package com.example.tenantguard.web.rest.controller;

import com.example.tenantguard.adapter.redis.client.RedisHealthClient;
import com.example.tenantguard.adapter.redis.dto.RedisHealthResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Health Check Controller
 * <p>
 * Probes answer with their own status codes and never go through the error normalizer.
 */
@Slf4j
@RestController
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final long REDIS_RESPONSE_TIME_WARNING_MS = 100L;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";

  private final RedisHealthClient redisHealthClient;
  private final ThreadPoolTaskExecutor auditExecutor;
  private final Clock clock;

  public HealthController(RedisHealthClient redisHealthClient,
                          @Qualifier("auditExecutor") ThreadPoolTaskExecutor auditExecutor,
                          Clock clock) {
    this.redisHealthClient = redisHealthClient;
    this.auditExecutor = auditExecutor;
    this.clock = clock;
  }

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", clock.instant()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_UP);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DOWN);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
  }

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    RedisHealthResponse redisHealth = redisHealthClient.checkHealth();

    Map<String, Object> redisStatus = new LinkedHashMap<>();
    redisStatus.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    redisStatus.put("responseTimeMs", redisHealth.responseTimeMs());
    if (redisHealth.version() != null) {
      redisStatus.put("version", redisHealth.version());
    }
    if (redisHealth.error() != null) {
      redisStatus.put("error", redisHealth.error());
    }

    ThreadPoolExecutor executor = auditExecutor.getThreadPoolExecutor();
    int queued = executor.getQueue().size();
    int remaining = executor.getQueue().remainingCapacity();
    Map<String, Object> auditStatus = new LinkedHashMap<>();
    auditStatus.put("status", remaining > 0 ? STATUS_UP : STATUS_DOWN);
    auditStatus.put("queued", queued);
    auditStatus.put("remainingCapacity", remaining);

    boolean ready = redisHealth.healthy()
        && redisHealth.responseTimeMs() <= REDIS_RESPONSE_TIME_WARNING_MS;
    if (!ready) {
      log.warn("Readiness check failed: Redis health={}, responseTime={}ms",
               redisHealth.healthy(), redisHealth.responseTimeMs());
    }
    if (remaining == 0) {
      log.warn("Audit queue is full ({} pending records)", queued);
    }

    Map<String, Object> status = new LinkedHashMap<>();
    status.put("ready", ready);
    status.put("redis", redisStatus);
    status.put("audit", auditStatus);
    status.put("timestamp", clock.instant());

    return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(status);
  }
}
