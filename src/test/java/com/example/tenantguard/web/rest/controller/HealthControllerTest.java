package com.example.tenantguard.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.tenantguard.adapter.redis.client.RedisHealthClient;
import com.example.tenantguard.adapter.redis.dto.RedisHealthResponse;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock
  private RedisHealthClient redisHealthClient;

  private ThreadPoolTaskExecutor auditExecutor;
  private HealthController controller;

  @BeforeEach
  void setUp() {
    auditExecutor = new ThreadPoolTaskExecutor();
    auditExecutor.setCorePoolSize(1);
    auditExecutor.setMaxPoolSize(1);
    auditExecutor.setQueueCapacity(10);
    auditExecutor.initialize();
    controller = new HealthController(redisHealthClient, auditExecutor,
                                      Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @AfterEach
  void tearDown() {
    auditExecutor.shutdown();
  }

  @Test
  @DisplayName("readiness should be UP when Redis answers quickly")
  void readiness_shouldBeUp_whenRedisHealthy() {
    when(redisHealthClient.checkHealth()).thenReturn(RedisHealthResponse.up(3, "7.2.4", 5));

    ResponseEntity<Map<String, Object>> response = controller.readiness();

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("ready", true);
    assertThat(response.getBody().get("audit"))
        .asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
        .containsEntry("status", "UP")
        .containsEntry("remainingCapacity", 10);
  }

  @Test
  @DisplayName("readiness should be 503 when Redis is down or slow")
  void readiness_shouldBeDown_whenRedisUnhealthy() {
    when(redisHealthClient.checkHealth())
        .thenReturn(RedisHealthResponse.down(2000, "connection refused"))
        .thenReturn(RedisHealthResponse.up(250, "7.2.4", 5));

    assertThat(controller.readiness().getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(controller.readiness().getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
  }

  @Test
  @DisplayName("health should always report UP")
  void health_shouldReportUp() {
    assertThat(controller.health().getBody()).containsEntry("status", "UP");
  }
}
