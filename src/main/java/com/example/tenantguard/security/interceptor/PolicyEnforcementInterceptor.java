package com.example.tenantguard.security.interceptor;

import com.example.tenantguard.exception.PolicyDeniedException;
import com.example.tenantguard.security.authorization.AuthorizationDecision;
import com.example.tenantguard.security.authorization.AuthorizationEngine;
import com.example.tenantguard.security.policy.AccessPolicy;
import com.example.tenantguard.security.policy.PolicyRegistry;
import com.example.tenantguard.web.context.RequestContext;
import com.example.tenantguard.web.context.RequestContextResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Optional;

/**
 * Enforces the access policy bound to the matched handler before it runs.
 * <p>
 * Runs after handler mapping, so path variables are available to the tenant and ownership
 * checks. A denial is raised as {@link PolicyDeniedException} and rendered by the global error
 * handler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyEnforcementInterceptor implements HandlerInterceptor {

  private final PolicyRegistry policyRegistry;
  private final AuthorizationEngine authorizationEngine;
  private final RequestContextResolver contextResolver;

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                           Object handler) {
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return true;
    }
    Optional<AccessPolicy> policy = policyRegistry.policyFor(handlerMethod);
    if (policy.isEmpty()) {
      return true;
    }

    RequestContext context = contextResolver.resolve(request);
    AuthorizationDecision decision =
        authorizationEngine.authorize(context.principal(), policy.get(), context);
    if (decision.allowed()) {
      return true;
    }

    log.info("Denied {} {} for principal {} under policy {}: {}", context.method(),
             context.path(), context.currentPrincipal().map(p -> p.id()).orElse("<none>"),
             decision.policyName(), decision.denialReason());
    throw new PolicyDeniedException(decision.denialReason(), decision.policyName());
  }
}
