package com.example.tenantguard.config;

import com.example.tenantguard.audit.AuditFilter;
import com.example.tenantguard.audit.AuditRecorder;
import com.example.tenantguard.properties.ApplicationProperties;
import com.example.tenantguard.security.interceptor.PolicyEnforcementInterceptor;
import com.example.tenantguard.web.context.RequestContextResolver;
import com.example.tenantguard.web.filter.RequestBodyCachingFilter;
import com.example.tenantguard.web.rest.errors.ErrorResponseWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Servlet and MVC glue for the request pipeline.
 * <p>
 * Filter order: body buffering, then audit, then the Spring Security chains. Policy enforcement
 * runs as an MVC interceptor once the handler is known.
 */
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  static final int BODY_CACHING_FILTER_ORDER = SecurityProperties.DEFAULT_FILTER_ORDER - 20;
  static final int AUDIT_FILTER_ORDER = SecurityProperties.DEFAULT_FILTER_ORDER - 10;

  private final PolicyEnforcementInterceptor policyEnforcementInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(policyEnforcementInterceptor);
  }

  @Bean
  public FilterRegistrationBean<RequestBodyCachingFilter> requestBodyCachingFilter(
      ApplicationProperties properties, ErrorResponseWriter errorResponseWriter) {
    FilterRegistrationBean<RequestBodyCachingFilter> registration = new FilterRegistrationBean<>();
    registration.setFilter(new RequestBodyCachingFilter(
        properties.security().maxInspectedBodySize().toBytes(), errorResponseWriter));
    registration.addUrlPatterns("/*");
    registration.setOrder(BODY_CACHING_FILTER_ORDER);
    registration.setName("requestBodyCachingFilter");
    return registration;
  }

  @Bean
  public FilterRegistrationBean<AuditFilter> auditFilter(AuditRecorder auditRecorder,
                                                         RequestContextResolver contextResolver) {
    FilterRegistrationBean<AuditFilter> registration = new FilterRegistrationBean<>();
    registration.setFilter(new AuditFilter(auditRecorder, contextResolver));
    registration.addUrlPatterns("/*");
    registration.setOrder(AUDIT_FILTER_ORDER);
    registration.setName("auditFilter");
    return registration;
  }
}
