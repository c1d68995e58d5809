package com.example.tenantguard.security.policy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a handler method, or every handler method of a controller, to a canonical policy from
 * {@link AccessPolicies}. A method-level annotation wins over the class-level one.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequiresPolicy {

  /**
   * Name of the canonical policy, e.g. {@code "TENANT_USERS"}.
   */
  String value();

  /**
   * Also require the principal to own the targeted resource.
   */
  boolean requireOwnership() default false;

  String resource() default "";

  String action() default "";
}
