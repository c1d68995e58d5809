package com.example.tenantguard.security.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.tenantguard.properties.ApplicationProperties.SecurityProperties;
import com.example.tenantguard.properties.ApplicationProperties;
import com.example.tenantguard.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

@ExtendWith(MockitoExtension.class)
class CredentialFailureTrackerTest {

  private static final String IP = "203.0.113.7";
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

  @Mock
  private RedisTemplate<String, String> redisTemplate;

  @Mock
  private ValueOperations<String, String> valueOperations;

  private CredentialFailureTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new CredentialFailureTracker(redisTemplate, TestProperties.defaults(), CLOCK);
  }

  @Test
  @DisplayName("recordFailure should start the failure window on the first failure")
  void recordFailure_shouldStartWindowOnFirstFailure() {
    // Arrange
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    when(valueOperations.increment(CredentialFailureTracker.FAILURE_COUNT_PREFIX + IP)).thenReturn(1L);

    // Act
    tracker.recordFailure(IP);

    // Assert
    verify(redisTemplate).expire(CredentialFailureTracker.FAILURE_COUNT_PREFIX + IP, Duration.ofMinutes(5));
    verify(valueOperations, never()).set(anyString(), anyString(), eq(Duration.ofMinutes(15)));
  }

  @Test
  @DisplayName("recordFailure should block the IP once the limit is reached")
  void recordFailure_shouldBlockAtLimit() {
    // Arrange
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    when(valueOperations.increment(CredentialFailureTracker.FAILURE_COUNT_PREFIX + IP)).thenReturn(5L);

    // Act
    tracker.recordFailure(IP);

    // Assert
    verify(valueOperations).set(CredentialFailureTracker.BLOCK_PREFIX + IP,
                                String.valueOf(CLOCK.millis()), Duration.ofMinutes(15));
    verify(redisTemplate).delete(CredentialFailureTracker.FAILURE_COUNT_PREFIX + IP);
  }

  @Test
  @DisplayName("isBlocked should report the block key")
  void isBlocked_shouldReportBlockKey() {
    when(redisTemplate.hasKey(CredentialFailureTracker.BLOCK_PREFIX + IP)).thenReturn(true);

    assertThat(tracker.isBlocked(IP)).isTrue();
  }

  @Test
  @DisplayName("Redis outages should never block a request")
  void redisOutage_shouldFailOpen() {
    // Arrange
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    when(valueOperations.increment(anyString()))
        .thenThrow(new RedisConnectionFailureException("connection refused"));
    when(redisTemplate.hasKey(anyString()))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    // Act & Assert
    assertThatCode(() -> tracker.recordFailure(IP)).doesNotThrowAnyException();
    assertThat(tracker.isBlocked(IP)).isFalse();
  }

  @Test
  @DisplayName("clearFailures should delete the failure counter")
  void clearFailures_shouldDeleteCounter() {
    tracker.clearFailures(IP);

    verify(redisTemplate).delete(CredentialFailureTracker.FAILURE_COUNT_PREFIX + IP);
  }

  @Test
  @DisplayName("a disabled tracker should never touch Redis")
  void disabledTracker_shouldNotTouchRedis() {
    // Arrange
    SecurityProperties base = TestProperties.security();
    ApplicationProperties disabled = TestProperties.with(new SecurityProperties(
        base.ownershipOverrideRoles(), base.resourceFields(), base.maxInspectedBodySize(),
        TestProperties.failureTracking(false)));
    CredentialFailureTracker off = new CredentialFailureTracker(redisTemplate, disabled, CLOCK);

    // Act
    off.recordFailure(IP);
    off.clearFailures(IP);

    // Assert
    assertThat(off.isBlocked(IP)).isFalse();
    verifyNoInteractions(redisTemplate);
  }

  @Test
  @DisplayName("maskIpAddress should hide the third IPv4 octet and all but the first IPv6 group")
  void maskIpAddress_shouldMaskAddresses() {
    assertThat(CredentialFailureTracker.maskIpAddress("203.0.113.7")).isEqualTo("203.0.***.7");
    assertThat(CredentialFailureTracker.maskIpAddress("2001:db8::1")).isEqualTo("2001:***");
    assertThat(CredentialFailureTracker.maskIpAddress(null)).isEqualTo("***");
  }
}
