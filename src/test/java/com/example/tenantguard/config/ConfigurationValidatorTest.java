package com.example.tenantguard.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.tenantguard.domain.entity.Role;
import com.example.tenantguard.properties.ApplicationProperties.AuditProperties.ExecutorProperties;
import com.example.tenantguard.properties.ApplicationProperties.AuthProperties.JwtProperties;
import com.example.tenantguard.properties.ApplicationProperties.SecurityProperties.FailureTrackingProperties;
import com.example.tenantguard.properties.ApplicationProperties.SecurityProperties.ResourceFieldProperties;
import com.example.tenantguard.properties.ApplicationProperties.SecurityProperties;
import com.example.tenantguard.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.Set;

class ConfigurationValidatorTest {

  @Test
  @DisplayName("default configuration should pass")
  void afterPropertiesSet_shouldAcceptDefaults() {
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.defaults());

    assertThatCode(validator::afterPropertiesSet).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("a short JWT secret should fail startup")
  void afterPropertiesSet_shouldRejectShortSecret() {
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.with(
        new JwtProperties("too-short", TestProperties.ISSUER, TestProperties.AUDIENCE,
                          Duration.ofSeconds(60))));

    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("JWT secret must be at least 32 bytes");
  }

  @Test
  @DisplayName("an issuer that is not a URI should fail startup")
  void afterPropertiesSet_shouldRejectInvalidIssuer() {
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.with(
        new JwtProperties(TestProperties.SECRET, "https://bad issuer", TestProperties.AUDIENCE,
                          Duration.ofSeconds(60))));

    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("JWT issuer is invalid");
  }

  @Test
  @DisplayName("all security violations should be reported together")
  void afterPropertiesSet_shouldCollectAllSecurityErrors() {
    // Arrange
    SecurityProperties broken = new SecurityProperties(
        Set.of(Role.PLATFORM_ADMIN),
        new ResourceFieldProperties(" ", ""),
        DataSize.ofMegabytes(1),
        new FailureTrackingProperties(true, 5, Duration.ofSeconds(10), Duration.ofMinutes(15)));
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.with(broken));

    // Act & Assert
    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("4 error(s)")
        .hasMessageContaining("Resource tenant field must not be blank")
        .hasMessageContaining("Resource owner field must not be blank")
        .hasMessageContaining("Ownership override roles must not include PLATFORM_ADMIN")
        .hasMessageContaining("Credential failure window must be at least 1 minute");
  }

  @Test
  @DisplayName("an inspected body size above 100MB should fail startup, 100MB should pass")
  void afterPropertiesSet_shouldBoundInspectedBodySize() {
    assertThatThrownBy(new ConfigurationValidator(TestProperties.with(
        withBodySize(DataSize.ofGigabytes(2))))::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Max inspected body size")
        .hasMessageContaining("must not exceed");

    assertThatCode(new ConfigurationValidator(TestProperties.with(
        withBodySize(DataSize.ofMegabytes(100))))::afterPropertiesSet)
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("an audit executor smaller than its core size should fail startup")
  void afterPropertiesSet_shouldRejectInconsistentExecutor() {
    ConfigurationValidator validator =
        new ConfigurationValidator(TestProperties.with(new ExecutorProperties(4, 2, 100)));

    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Audit executor max size (2)");
  }

  private static SecurityProperties withBodySize(DataSize size) {
    SecurityProperties base = TestProperties.security();
    return new SecurityProperties(base.ownershipOverrideRoles(), base.resourceFields(), size,
                                  base.failureTracking());
  }
}
