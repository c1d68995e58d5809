package com.example.tenantguard.security.policy;

import com.example.tenantguard.web.rest.ApiConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Binds every protected handler method to exactly one {@link AccessPolicy} at startup.
 * <p>
 * Handlers under {@code /api/} without {@link RequiresPolicy} are bound to
 * {@link AccessPolicies#DENY_ALL}. Handlers outside {@code /api/} without the annotation are
 * public. The bindings are frozen once the application context has started.
 */
@Slf4j
@Component
public class PolicyRegistry implements SmartInitializingSingleton {

  private static final String HANDLER_MAPPING_BEAN = "requestMappingHandlerMapping";
  private static final String PROTECTED_PREFIX = ApiConstants.ApiPath.API_BASE + "/";

  private final ApplicationContext applicationContext;
  private volatile Map<Method, AccessPolicy> bindings = Map.of();

  public PolicyRegistry(ApplicationContext applicationContext) {
    this.applicationContext = applicationContext;
  }

  @Override
  public void afterSingletonsInstantiated() {
    RequestMappingHandlerMapping handlerMapping =
        applicationContext.getBean(HANDLER_MAPPING_BEAN, RequestMappingHandlerMapping.class);
    bindings = bind(handlerMapping.getHandlerMethods());
    log.info("Bound {} handler(s) to access policies", bindings.size());
  }

  /**
   * The policy bound to a handler, or empty for public handlers.
   */
  public Optional<AccessPolicy> policyFor(HandlerMethod handlerMethod) {
    return Optional.ofNullable(bindings.get(handlerMethod.getMethod()));
  }

  static Map<Method, AccessPolicy> bind(Map<RequestMappingInfo, HandlerMethod> handlerMethods) {
    Map<Method, AccessPolicy> result = new HashMap<>();
    handlerMethods.forEach((info, handlerMethod) -> {
      Optional<AccessPolicy> declared = declaredPolicy(handlerMethod);
      if (declared.isPresent()) {
        result.put(handlerMethod.getMethod(), declared.get());
        log.debug("Handler {} bound to policy {}", handlerMethod.getShortLogMessage(),
                  declared.get().name());
      } else if (isProtected(info)) {
        log.warn("Protected handler {} declares no access policy; binding it to {}",
                 handlerMethod.getShortLogMessage(), AccessPolicies.DENY_ALL.name());
        result.put(handlerMethod.getMethod(), AccessPolicies.DENY_ALL);
      }
    });
    return Map.copyOf(result);
  }

  static Optional<AccessPolicy> declaredPolicy(HandlerMethod handlerMethod) {
    RequiresPolicy annotation = AnnotatedElementUtils.findMergedAnnotation(
        handlerMethod.getMethod(), RequiresPolicy.class);
    if (annotation == null) {
      annotation = AnnotatedElementUtils.findMergedAnnotation(
          handlerMethod.getBeanType(), RequiresPolicy.class);
    }
    if (annotation == null) {
      return Optional.empty();
    }
    return Optional.of(resolve(annotation, handlerMethod));
  }

  private static AccessPolicy resolve(RequiresPolicy annotation, HandlerMethod handlerMethod) {
    AccessPolicy policy = AccessPolicies.byName(annotation.value())
        .orElseThrow(() -> new IllegalStateException(
            "Unknown access policy '%s' on %s".formatted(
                annotation.value(), handlerMethod.getShortLogMessage())));
    if (annotation.requireOwnership()) {
      policy = policy.withOwnership();
    }
    if (StringUtils.hasText(annotation.resource()) || StringUtils.hasText(annotation.action())) {
      policy = policy.describing(
          StringUtils.hasText(annotation.resource()) ? annotation.resource() : null,
          StringUtils.hasText(annotation.action()) ? annotation.action() : null);
    }
    return policy;
  }

  private static boolean isProtected(RequestMappingInfo info) {
    return info.getPatternValues().stream()
        .anyMatch(pattern -> pattern.equals(ApiConstants.ApiPath.API_BASE)
            || pattern.startsWith(PROTECTED_PREFIX));
  }
}
