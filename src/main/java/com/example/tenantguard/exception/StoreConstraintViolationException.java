package com.example.tenantguard.exception;

import java.util.List;

/**
 * Constraint violation reported by a storage layer.
 * <p>
 * {@code code} is an SQLState-style code ({@code 23505} unique, {@code 23503} foreign key,
 * {@code 02000} no data, {@code 22P02} invalid identifier); {@code target} lists the offending
 * fields when the store knows them.
 */
public class StoreConstraintViolationException extends RuntimeException {

  private final String code;
  private final List<String> target;

  public StoreConstraintViolationException(String code, List<String> target, String message) {
    super(message);
    this.code = code;
    this.target = target == null ? List.of() : List.copyOf(target);
  }

  public StoreConstraintViolationException(String code, List<String> target, String message,
                                           Throwable cause) {
    super(message, cause);
    this.code = code;
    this.target = target == null ? List.of() : List.copyOf(target);
  }

  public static StoreConstraintViolationException uniqueViolation(String field) {
    return new StoreConstraintViolationException(
        "23505", List.of(field), "Unique constraint failed on " + field);
  }

  public String getCode() {
    return code;
  }

  public List<String> getTarget() {
    return target;
  }
}
