package com.example.tenantguard.properties;

import com.example.tenantguard.domain.entity.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

/**
 * Centralized configuration properties for tenant-guard.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid AuthProperties auth,
    @NotNull @Valid SecurityProperties security,
    @NotNull @Valid ErrorProperties errors,
    @NotNull @Valid AuditProperties audit,
    @NotNull @Valid RedisProperties redis
) {

  /**
   * Bearer credential verification
   */
  public record AuthProperties(@NotNull @Valid JwtProperties jwt) {

    public record JwtProperties(
        @NotBlank String secret,
        @NotBlank String issuer,
        @NotBlank String audience,
        @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration clockSkew
    ) {}
  }

  /**
   * Authorization and request inspection
   */
  public record SecurityProperties(
      @DefaultValue("TENANT_ADMIN") Set<Role> ownershipOverrideRoles,
      @NotNull @Valid ResourceFieldProperties resourceFields,
      @DefaultValue("1MB") DataSize maxInspectedBodySize,
      @NotNull @Valid FailureTrackingProperties failureTracking
  ) {

    public record ResourceFieldProperties(
        @DefaultValue("tenantId") String tenant,
        @DefaultValue("userId") String owner
    ) {}

    public record FailureTrackingProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("5") @Positive int maxFailures,
        @DefaultValue("5m") Duration window,
        @DefaultValue("15m") Duration blockDuration
    ) {}
  }

  /**
   * Error rendering
   */
  public record ErrorProperties(
      @DefaultValue({"dev", "local"}) List<String> debugProfiles
  ) {}

  /**
   * Audit trail capture
   */
  public record AuditProperties(
      @DefaultValue("true") boolean enabled,
      @NotNull @Valid ExecutorProperties executor
  ) {

    public record ExecutorProperties(
        @DefaultValue("2") @Positive int coreSize,
        @DefaultValue("4") @Positive int maxSize,
        @DefaultValue("1000") @Positive int queueCapacity
    ) {}
  }

  /**
   * Redis connection
   */
  public record RedisProperties(
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid SslProperties ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("2") @Min(0) int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }
}
