package com.example.tenantguard.adapter.redis.client;

import com.example.tenantguard.adapter.redis.dto.RedisHealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Pings the Redis instance backing the principal store, audit store and failure tracker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisHealthClient {

  private static final String PONG = "PONG";

  private final RedisTemplate<String, String> redisTemplate;

  public RedisHealthResponse checkHealth() {
    long start = System.nanoTime();
    try {
      String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      if (!PONG.equalsIgnoreCase(pong)) {
        return RedisHealthResponse.down(elapsedMillis(start), "Unexpected PING reply: " + pong);
      }

      Properties server = redisTemplate.execute(
          (RedisCallback<Properties>) connection -> connection.serverCommands().info("server"));
      Properties clients = redisTemplate.execute(
          (RedisCallback<Properties>) connection -> connection.serverCommands().info("clients"));

      return RedisHealthResponse.up(
          elapsedMillis(start),
          server == null ? "unknown" : server.getProperty("redis_version", "unknown"),
          clients == null ? 0 : parseInteger(clients.getProperty("connected_clients", "0")));
    } catch (DataAccessException e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.down(elapsedMillis(start), e.getMessage());
    }
  }

  private static long elapsedMillis(long start) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
  }

  private static int parseInteger(String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
