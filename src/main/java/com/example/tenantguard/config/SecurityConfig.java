package com.example.tenantguard.config;

import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.API_BASE;
import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.AUTH_BASE;
import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.DOCS_BASE;
import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.HEALTH_BASE;

import com.example.tenantguard.security.credential.CredentialFailureTracker;
import com.example.tenantguard.security.credential.CredentialValidator;
import com.example.tenantguard.security.filter.BearerAuthenticationFilter;
import com.example.tenantguard.web.rest.errors.DelegatedAuthenticationEntryPoint;
import com.example.tenantguard.web.rest.errors.ErrorResponseWriter;
import com.example.tenantguard.web.rest.errors.JsonAccessDeniedHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.security.web.header.writers.StaticHeadersWriter;

import java.time.Duration;

/**
 * Stateless security configuration with three filter chains.
 * <p>
 * PUBLIC (@Order(1)): health probes, credential endpoints reserved under {@code /auth} and API
 * docs. PROTECTED (@Order(2)): everything under {@code /api}, authenticated from the bearer
 * credential; per-handler access policies are enforced afterwards by the MVC interceptor.
 * DEFAULT (@Order(3)): everything else is denied.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final CredentialValidator credentialValidator;
  private final CredentialFailureTracker credentialFailureTracker;
  private final ErrorResponseWriter errorResponseWriter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;
  private final JsonAccessDeniedHandler jsonAccessDeniedHandler;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(HEALTH_BASE, HEALTH_BASE + "/**",
                         AUTH_BASE + "/**",
                         DOCS_BASE, DOCS_BASE + "/**",
                         "/v3/api-docs", "/v3/api-docs/**")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(API_BASE + "/**")
        // Not a bean, so it only runs inside this chain and not as a plain servlet filter
        .addFilterBefore(new BearerAuthenticationFilter(credentialValidator,
                                                        credentialFailureTracker,
                                                        errorResponseWriter),
                         AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Settings shared by every chain: no sessions, no CSRF (bearer credentials only), JSON error
   * rendering and hardened response headers.
   */
  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        .csrf(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
            .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(exceptions -> exceptions
            .authenticationEntryPoint(delegatedAuthenticationEntryPoint)
            .accessDeniedHandler(jsonAccessDeniedHandler))
        .headers(headers -> headers
            .frameOptions(FrameOptionsConfig::deny)
            .contentTypeOptions(contentType -> {
            })
            .referrerPolicy(referrer -> referrer
                .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
            .addHeaderWriter(new StaticHeadersWriter("Permissions-Policy",
                "camera=(), microphone=(), geolocation=(), payment=()"))
            .httpStrictTransportSecurity(hsts -> hsts
                .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                .includeSubDomains(true))
            // API responses carry tenant data and must never be cached
            .addHeaderWriter((request, response) -> {
              response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
              response.setHeader("Pragma", "no-cache");
              response.setHeader("Expires", "0");
            }));
  }
}
