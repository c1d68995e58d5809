package com.example.tenantguard.adapter.redis.store;

import com.example.tenantguard.domain.entity.PrincipalRecord;
import com.example.tenantguard.domain.entity.Role;
import com.example.tenantguard.domain.store.PrincipalStore;
import com.example.tenantguard.exception.StoreUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Principal store backed by one Redis hash per principal.
 * <p>
 * Hash {@code principal:{id}} with fields {@code email}, {@code role}, {@code tenantId},
 * {@code verified}, {@code mfaEnabled}, {@code lockedUntil} (epoch millis) and {@code active}.
 * Inactive principals and principals whose stored role is not a known role are reported as
 * absent. Lookups are protected by the "principalStore" circuit breaker and fail closed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisPrincipalStore implements PrincipalStore {

  static final String KEY_PREFIX = "principal:";
  static final String STORE_NAME = "principal store";
  private static final String PRINCIPAL_STORE_BREAKER = "principalStore";

  private final RedisTemplate<String, String> redisTemplate;

  @Override
  @CircuitBreaker(name = PRINCIPAL_STORE_BREAKER, fallbackMethod = "findActiveByIdFallback")
  public Optional<PrincipalRecord> findActiveById(String id) {
    if (!StringUtils.hasText(id)) {
      return Optional.empty();
    }
    Map<String, String> fields = redisTemplate.<String, String>opsForHash().entries(KEY_PREFIX + id);
    if (fields == null || fields.isEmpty()) {
      return Optional.empty();
    }
    if (!Boolean.parseBoolean(fields.get("active"))) {
      log.debug("Principal {} is inactive", id);
      return Optional.empty();
    }

    Optional<Role> role = Role.fromValue(fields.get("role"));
    if (role.isEmpty()) {
      log.warn("Principal {} has unrecognized role '{}', treating as absent", id, fields.get("role"));
      return Optional.empty();
    }

    return Optional.of(new PrincipalRecord(
        id,
        fields.get("email"),
        role.get(),
        StringUtils.hasText(fields.get("tenantId")) ? fields.get("tenantId") : null,
        Boolean.parseBoolean(fields.get("verified")),
        Boolean.parseBoolean(fields.get("mfaEnabled")),
        parseInstant(id, fields.get("lockedUntil")),
        true));
  }

  /**
   * Fallback for the principal store circuit breaker. A principal that cannot be looked up is
   * never authenticated.
   */
  public Optional<PrincipalRecord> findActiveByIdFallback(String id, Throwable ex) {
    log.error("Principal store unavailable while resolving principal {}", id, ex);
    throw new StoreUnavailableException(STORE_NAME, ex);
  }

  private static Instant parseInstant(String id, String epochMillis) {
    if (!StringUtils.hasText(epochMillis)) {
      return null;
    }
    try {
      return Instant.ofEpochMilli(Long.parseLong(epochMillis.trim()));
    } catch (NumberFormatException e) {
      // An unreadable lock is treated as a lock that never expires.
      log.warn("Principal {} has unreadable lockedUntil '{}'", id, epochMillis);
      return Instant.MAX;
    }
  }
}
