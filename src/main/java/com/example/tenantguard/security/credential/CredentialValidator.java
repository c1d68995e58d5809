package com.example.tenantguard.security.credential;

import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.domain.entity.PrincipalRecord;
import com.example.tenantguard.domain.store.PrincipalStore;
import com.example.tenantguard.exception.CredentialException.CredentialFailure;
import com.example.tenantguard.exception.CredentialException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;

/**
 * Credential Validator - turns a raw bearer credential into a {@link Principal}.
 * <p>
 * Signature, expiry, issuer and audience are verified by the {@link JwtDecoder}; the subject must
 * name an active principal that is not locked. The principal store lookup is the only I/O, and
 * store outages propagate unchanged rather than being reported as credential failures.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialValidator {

  private final JwtDecoder jwtDecoder;
  private final PrincipalStore principalStore;
  private final Clock clock;

  public Principal validate(String rawCredential) {
    if (!StringUtils.hasText(rawCredential)) {
      throw new CredentialException(CredentialFailure.INVALID_CREDENTIAL);
    }

    Jwt jwt;
    try {
      jwt = jwtDecoder.decode(rawCredential);
    } catch (JwtException e) {
      log.debug("Bearer credential rejected: {}", e.getMessage());
      throw new CredentialException(CredentialFailure.INVALID_CREDENTIAL, e);
    }

    String subject = jwt.getSubject();
    if (!StringUtils.hasText(subject)) {
      throw new CredentialException(CredentialFailure.INVALID_CREDENTIAL);
    }

    PrincipalRecord record = principalStore.findActiveById(subject)
        .orElseThrow(() -> {
          log.debug("No active principal for subject {}", subject);
          return new CredentialException(CredentialFailure.PRINCIPAL_NOT_FOUND);
        });

    if (record.isLockedAt(clock.instant())) {
      log.info("Principal {} is locked until {}", subject, record.lockedUntil());
      throw new CredentialException(CredentialFailure.ACCOUNT_LOCKED);
    }

    return record.toPrincipal();
  }
}
