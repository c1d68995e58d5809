package com.example.tenantguard.config;

import com.example.tenantguard.properties.ApplicationProperties.AuthProperties.JwtProperties;
import com.example.tenantguard.properties.ApplicationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Bearer credential verification: HS256 signature with the shared secret, then expiry (required),
 * not-before, issuer, audience and a non-blank subject.
 */
@Configuration(proxyBeanMethods = false)
public class JwtDecoderConfig {

  private static final String HMAC_SHA_256 = "HmacSHA256";
  private static final String INVALID_TOKEN = "invalid_token";

  @Bean
  public JwtDecoder jwtDecoder(ApplicationProperties properties, Clock clock) {
    return createDecoder(properties.auth().jwt(), clock);
  }

  public static JwtDecoder createDecoder(JwtProperties jwt, Clock clock) {
    SecretKey key = new SecretKeySpec(jwt.secret().getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
        .macAlgorithm(MacAlgorithm.HS256)
        .build();

    JwtTimestampValidator timestampValidator = new JwtTimestampValidator(jwt.clockSkew());
    timestampValidator.setClock(clock);

    OAuth2TokenValidator<Jwt> audienceValidator = token -> {
      List<String> aud = token.getAudience();
      return (aud != null && aud.contains(jwt.audience()))
          ? OAuth2TokenValidatorResult.success()
          : OAuth2TokenValidatorResult.failure(new OAuth2Error(INVALID_TOKEN, "Invalid audience", null));
    };

    OAuth2TokenValidator<Jwt> validator = new DelegatingOAuth2TokenValidator<>(
        new JwtClaimValidator<Instant>(JwtClaimNames.EXP, Objects::nonNull),
        timestampValidator,
        new JwtIssuerValidator(jwt.issuer()),
        audienceValidator,
        new JwtClaimValidator<String>(JwtClaimNames.SUB, StringUtils::hasText)
    );

    decoder.setJwtValidator(validator);
    return decoder;
  }
}
