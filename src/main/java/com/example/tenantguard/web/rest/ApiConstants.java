package com.example.tenantguard.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String API_V1 = API_BASE + "/v1";
    public static final String HEALTH_BASE = "/health";
    public static final String AUTH_BASE = "/auth";
    public static final String DOCS_BASE = "/docs";

    // Principal paths
    public static final String ME = "/me";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  public static final class Headers {
    public static final String AUTHORIZATION = "Authorization";
    public static final String BEARER_PREFIX = "Bearer ";
    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String REAL_IP = "X-Real-IP";
    public static final String USER_AGENT = "User-Agent";

    private Headers() {}
  }

  private ApiConstants() {}
}
