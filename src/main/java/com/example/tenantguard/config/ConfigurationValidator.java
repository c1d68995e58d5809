package com.example.tenantguard.config;

import com.example.tenantguard.domain.entity.Role;
import com.example.tenantguard.properties.ApplicationProperties.AuditProperties.ExecutorProperties;
import com.example.tenantguard.properties.ApplicationProperties.AuthProperties.JwtProperties;
import com.example.tenantguard.properties.ApplicationProperties.SecurityProperties;
import com.example.tenantguard.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.util.unit.DataSize;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Cross-field configuration rules that bean validation on {@link ApplicationProperties} cannot
 * express. All violations are collected and reported together, then startup fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  static final int MIN_SECRET_BYTES = 32;
  static final Duration MIN_FAILURE_WINDOW = Duration.ofMinutes(1);
  static final DataSize MAX_INSPECTED_BODY_SIZE = DataSize.ofMegabytes(100);

  private static final String ERROR_INVALID_URI = "%s is invalid: %s";
  private static final String ERROR_BLANK = "%s must not be blank.";
  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateJwtConfig(properties.auth().jwt(), errors);
    validateSecurityConfig(properties.security(), errors);
    validateAuditConfig(properties.audit().executor(), errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateJwtConfig(JwtProperties jwt, List<String> errors) {
    if (jwt.secret() == null || jwt.secret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      errors.add("JWT secret must be at least %d bytes for HS256.".formatted(MIN_SECRET_BYTES));
    }
    validateUri(jwt.issuer(), "JWT issuer", errors);
    if (jwt.clockSkew() != null && jwt.clockSkew().isNegative()) {
      errors.add("JWT clock skew cannot be negative.");
    }
  }

  private void validateSecurityConfig(SecurityProperties security, List<String> errors) {
    if (!StringUtils.hasText(security.resourceFields().tenant())) {
      errors.add(ERROR_BLANK.formatted("Resource tenant field"));
    }
    if (!StringUtils.hasText(security.resourceFields().owner())) {
      errors.add(ERROR_BLANK.formatted("Resource owner field"));
    }
    if (security.ownershipOverrideRoles() != null
        && security.ownershipOverrideRoles().contains(Role.PLATFORM_ADMIN)) {
      errors.add("Ownership override roles must not include " + Role.PLATFORM_ADMIN
                 + "; it already bypasses tenant and ownership checks.");
    }
    DataSize bodySize = security.maxInspectedBodySize();
    if (bodySize != null && bodySize.toBytes() < 1) {
      errors.add("Max inspected body size must be positive.");
    }
    if (bodySize != null && bodySize.compareTo(MAX_INSPECTED_BODY_SIZE) > 0) {
      errors.add("Max inspected body size (%s) must not exceed %s."
                     .formatted(bodySize, MAX_INSPECTED_BODY_SIZE));
    }

    SecurityProperties.FailureTrackingProperties tracking = security.failureTracking();
    if (tracking.enabled()) {
      if (tracking.window() == null || tracking.window().compareTo(MIN_FAILURE_WINDOW) < 0) {
        errors.add(ERROR_MIN_DURATION.formatted("Credential failure window", "1 minute"));
      }
      if (tracking.blockDuration() == null || tracking.blockDuration().compareTo(MIN_FAILURE_WINDOW) < 0) {
        errors.add(ERROR_MIN_DURATION.formatted("Credential block duration", "1 minute"));
      }
    }
  }

  private void validateAuditConfig(ExecutorProperties executor, List<String> errors) {
    if (executor.maxSize() < executor.coreSize()) {
      errors.add("Audit executor max size (%d) must be greater than or equal to core size (%d)."
                     .formatted(executor.maxSize(), executor.coreSize()));
    }
  }

  private void validateUri(String uri, String fieldName, List<String> errors) {
    if (!StringUtils.hasText(uri)) {
      errors.add(ERROR_BLANK.formatted(fieldName));
      return;
    }
    try {
      new URI(uri);
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URI.formatted(fieldName, uri));
    }
  }
}
