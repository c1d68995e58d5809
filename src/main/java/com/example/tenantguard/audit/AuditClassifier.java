package com.example.tenantguard.audit;

import com.example.tenantguard.domain.entity.AuditAction;
import com.example.tenantguard.domain.entity.AuditEventType;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pure classification rules for the audit trail. Paths are matched on whole segments, case
 * insensitively, so {@code /authors} never counts as an {@code auth} path.
 */
@UtilityClass
public class AuditClassifier {

  private static final String AUTH_SEGMENT = "auth";
  private static final Set<String> SKIPPED_SEGMENTS = Set.of("health", "docs", "static");
  private static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
  private static final Set<String> READ_METHODS = Set.of("GET", "HEAD", "OPTIONS");
  private static final Set<String> SENSITIVE_READ_SEGMENTS =
      Set.of("admin", "users", "tenants", "sbom", "threat-model");

  private static final Map<String, AuditAction> AUTH_ACTIONS = Map.of(
      "login", AuditAction.LOGIN,
      "logout", AuditAction.LOGOUT,
      "register", AuditAction.REGISTER,
      "forgot-password", AuditAction.FORGOT_PASSWORD,
      "reset-password", AuditAction.RESET_PASSWORD,
      "verify-email", AuditAction.VERIFY_EMAIL,
      "change-password", AuditAction.CHANGE_PASSWORD);

  // Evaluated in order, first match wins.
  private static final List<Map.Entry<String, String>> RESOURCE_RULES = List.of(
      Map.entry(AUTH_SEGMENT, "authentication"),
      Map.entry("users", "user"),
      Map.entry("tenants", "tenant"),
      Map.entry("admin", "admin"),
      Map.entry("sbom", "sbom"),
      Map.entry("threat-model", "threat_model"),
      Map.entry("vulnerabilities", "vulnerability"));

  public static final String UNKNOWN_RESOURCE = "unknown";

  public static boolean shouldAudit(String method, String path, boolean principalPresent) {
    List<String> segments = segments(path);
    if (segments.stream().anyMatch(SKIPPED_SEGMENTS::contains)) {
      return false;
    }
    if (segments.contains(AUTH_SEGMENT)) {
      return true;
    }
    String normalizedMethod = normalize(method);
    if (WRITE_METHODS.contains(normalizedMethod)) {
      return true;
    }
    return READ_METHODS.contains(normalizedMethod)
        && principalPresent
        && segments.stream().anyMatch(SENSITIVE_READ_SEGMENTS::contains);
  }

  public static AuditAction actionFor(String method, String path) {
    List<String> segments = segments(path);
    int auth = segments.indexOf(AUTH_SEGMENT);
    if (auth >= 0 && auth + 1 < segments.size()) {
      AuditAction authAction = AUTH_ACTIONS.get(segments.get(auth + 1));
      if (authAction != null) {
        return authAction;
      }
    }
    return switch (normalize(method)) {
      case "POST" -> AuditAction.CREATE;
      case "PUT", "PATCH" -> AuditAction.UPDATE;
      case "DELETE" -> AuditAction.DELETE;
      case "GET" -> AuditAction.VIEW;
      default -> AuditAction.UNKNOWN;
    };
  }

  public static String resourceFor(String path) {
    List<String> segments = segments(path);
    return RESOURCE_RULES.stream()
        .filter(rule -> segments.contains(rule.getKey()))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(UNKNOWN_RESOURCE);
  }

  public static AuditEventType eventTypeFor(String path, int statusCode) {
    if (segments(path).contains(AUTH_SEGMENT)) {
      return AuditEventType.AUTHENTICATION;
    }
    if (statusCode == 401 || statusCode == 403) {
      return AuditEventType.SECURITY_EVENT;
    }
    return AuditEventType.DATA_ACCESS;
  }

  private static List<String> segments(String path) {
    if (path == null || path.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(path.toLowerCase(Locale.ROOT).split("/"))
        .filter(segment -> !segment.isEmpty())
        .toList();
  }

  private static String normalize(String method) {
    return method == null ? "" : method.toUpperCase(Locale.ROOT);
  }
}
