package com.example.tenantguard;

import com.example.tenantguard.properties.ApplicationProperties;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tenant Guard Application
 *
 * Request authorization pipeline for a multi-tenant backend:
 * - Bearer credential validation against the principal store
 * - Role, tenant and ownership checks per route policy
 * - Asynchronous audit trail per tenant
 * - Uniform JSON error envelopes
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
@SecurityScheme(name = "bearerAuth", type = SecuritySchemeType.HTTP, scheme = "bearer",
                bearerFormat = "JWT")
public class TenantGuardApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(TenantGuardApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
