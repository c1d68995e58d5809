package com.example.tenantguard.security.credential;

import static com.example.tenantguard.support.Fixtures.activeRecord;
import static com.example.tenantguard.support.Fixtures.lockedRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.tenantguard.config.JwtDecoderConfig;
import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.domain.entity.Role;
import com.example.tenantguard.domain.store.PrincipalStore;
import com.example.tenantguard.exception.CredentialException.CredentialFailure;
import com.example.tenantguard.exception.CredentialException;
import com.example.tenantguard.exception.StoreUnavailableException;
import com.example.tenantguard.support.TestProperties;
import com.example.tenantguard.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Optional;

/**
 * Unit tests for CredentialValidator, using the real HS256 decoder.
 */
@ExtendWith(MockitoExtension.class)
class CredentialValidatorTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  @Mock
  private PrincipalStore principalStore;

  private CredentialValidator validator;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    validator = new CredentialValidator(
        JwtDecoderConfig.createDecoder(TestProperties.jwt(), clock), principalStore, clock);
  }

  @Test
  @DisplayName("validate should return the principal for a valid credential")
  void validate_shouldReturnPrincipal_whenCredentialValid() {
    // Arrange
    when(principalStore.findActiveById("u1"))
        .thenReturn(Optional.of(activeRecord("u1", Role.END_USER, "t1")));

    // Act
    Principal principal = validator.validate(TestTokens.valid("u1", NOW));

    // Assert
    assertThat(principal.id()).isEqualTo("u1");
    assertThat(principal.role()).isEqualTo(Role.END_USER);
    assertThat(principal.tenantId()).isEqualTo("t1");
  }

  @Test
  @DisplayName("validate should reject an expired credential as invalid")
  void validate_shouldRejectExpiredCredential() {
    // Arrange: expired well beyond the allowed clock skew
    Instant issued = NOW.minus(Duration.ofHours(3));
    String token = TestTokens.sign(
        TestTokens.claims("u1", issued)
            .expirationTime(Date.from(NOW.minus(Duration.ofHours(1))))
            .build(),
        TestProperties.SECRET);

    // Act & Assert
    assertThatThrownBy(() -> validator.validate(token))
        .isInstanceOf(CredentialException.class)
        .extracting(e -> ((CredentialException) e).getFailure())
        .isEqualTo(CredentialFailure.INVALID_CREDENTIAL);
    verify(principalStore, never()).findActiveById(anyString());
  }

  @Test
  @DisplayName("validate should accept a credential expired within the clock skew")
  void validate_shouldAcceptCredentialExpiredWithinClockSkew() {
    // Arrange
    String token = TestTokens.sign(
        TestTokens.claims("u1", NOW.minus(Duration.ofHours(1)))
            .expirationTime(Date.from(NOW.minusSeconds(30)))
            .build(),
        TestProperties.SECRET);
    when(principalStore.findActiveById("u1"))
        .thenReturn(Optional.of(activeRecord("u1", Role.END_USER, "t1")));

    // Act & Assert
    assertThat(validator.validate(token).id()).isEqualTo("u1");
  }

  @Test
  @DisplayName("validate should reject a credential signed with another secret")
  void validate_shouldRejectForeignSignature() {
    String token = TestTokens.sign(TestTokens.claims("u1", NOW).build(),
                                   "some-other-secret-that-is-also-32-bytes-long");

    assertThatThrownBy(() -> validator.validate(token))
        .isInstanceOf(CredentialException.class)
        .hasMessage(CredentialFailure.INVALID_CREDENTIAL.getMessage());
  }

  @Test
  @DisplayName("validate should reject a credential for another audience")
  void validate_shouldRejectWrongAudience() {
    String token = TestTokens.sign(
        TestTokens.claims("u1", NOW).audience("another-service").build(), TestProperties.SECRET);

    assertThatThrownBy(() -> validator.validate(token))
        .isInstanceOf(CredentialException.class)
        .hasMessage(CredentialFailure.INVALID_CREDENTIAL.getMessage());
  }

  @Test
  @DisplayName("validate should reject a credential from another issuer")
  void validate_shouldRejectWrongIssuer() {
    String token = TestTokens.sign(
        TestTokens.claims("u1", NOW).issuer("https://evil.example.com").build(),
        TestProperties.SECRET);

    assertThatThrownBy(() -> validator.validate(token))
        .isInstanceOf(CredentialException.class)
        .hasMessage(CredentialFailure.INVALID_CREDENTIAL.getMessage());
  }

  @Test
  @DisplayName("validate should reject a credential without expiry")
  void validate_shouldRejectCredentialWithoutExpiry() {
    String token = TestTokens.sign(
        TestTokens.claims("u1", NOW).expirationTime(null).build(), TestProperties.SECRET);

    assertThatThrownBy(() -> validator.validate(token))
        .isInstanceOf(CredentialException.class)
        .hasMessage(CredentialFailure.INVALID_CREDENTIAL.getMessage());
  }

  @Test
  @DisplayName("validate should reject blank and malformed credentials without touching the store")
  void validate_shouldRejectBlankAndMalformedCredentials() {
    assertThatThrownBy(() -> validator.validate(" "))
        .isInstanceOf(CredentialException.class);
    assertThatThrownBy(() -> validator.validate(null))
        .isInstanceOf(CredentialException.class);
    assertThatThrownBy(() -> validator.validate("not-a-jwt"))
        .isInstanceOf(CredentialException.class)
        .hasMessage(CredentialFailure.INVALID_CREDENTIAL.getMessage());

    verify(principalStore, never()).findActiveById(anyString());
  }

  @Test
  @DisplayName("validate should fail with PRINCIPAL_NOT_FOUND when the subject is unknown or inactive")
  void validate_shouldFail_whenPrincipalMissing() {
    // Arrange
    when(principalStore.findActiveById("ghost")).thenReturn(Optional.empty());

    // Act & Assert
    assertThatThrownBy(() -> validator.validate(TestTokens.valid("ghost", NOW)))
        .isInstanceOf(CredentialException.class)
        .extracting(e -> ((CredentialException) e).getFailure())
        .isEqualTo(CredentialFailure.PRINCIPAL_NOT_FOUND);
  }

  @Test
  @DisplayName("validate should fail with ACCOUNT_LOCKED while the lock is in the future")
  void validate_shouldFail_whenPrincipalLocked() {
    // Arrange: locked principal with an otherwise perfect credential
    when(principalStore.findActiveById("u1"))
        .thenReturn(Optional.of(lockedRecord("u1", Role.PLATFORM_ADMIN, null,
                                             NOW.plus(Duration.ofMinutes(10)))));

    // Act & Assert
    assertThatThrownBy(() -> validator.validate(TestTokens.valid("u1", NOW)))
        .isInstanceOf(CredentialException.class)
        .extracting(e -> ((CredentialException) e).getFailure())
        .isEqualTo(CredentialFailure.ACCOUNT_LOCKED);
  }

  @Test
  @DisplayName("validate should accept a principal whose lock has expired")
  void validate_shouldAccept_whenLockExpired() {
    when(principalStore.findActiveById("u1"))
        .thenReturn(Optional.of(lockedRecord("u1", Role.END_USER, "t1",
                                             NOW.minus(Duration.ofMinutes(1)))));

    assertThat(validator.validate(TestTokens.valid("u1", NOW)).id()).isEqualTo("u1");
  }

  @Test
  @DisplayName("validate should propagate store outages instead of reporting a credential failure")
  void validate_shouldPropagateStoreOutage() {
    // Arrange
    when(principalStore.findActiveById("u1"))
        .thenThrow(new StoreUnavailableException("principal store",
                                                 new QueryTimeoutException("timeout")));

    // Act & Assert
    assertThatThrownBy(() -> validator.validate(TestTokens.valid("u1", NOW)))
        .isInstanceOf(StoreUnavailableException.class);
  }
}
