package com.example.tenantguard.web.context;

import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.properties.ApplicationProperties;
import com.example.tenantguard.web.rest.ApiConstants.Headers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import org.springframework.web.util.UrlPathHelper;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link RequestContext} for a servlet request.
 * <p>
 * Resource identifiers are looked up under the configured field names, path variables first and
 * then top-level fields of a buffered JSON body. Only the values of those two fields are read
 * from the body; every other body field contributes its name alone.
 */
@Slf4j
@Component
public class RequestContextResolver {

  /**
   * Request attribute holding the {@link Principal} established by bearer authentication.
   */
  public static final String PRINCIPAL_ATTRIBUTE = RequestContextResolver.class.getName() + ".PRINCIPAL";

  private static final String BODY_VIEW_ATTRIBUTE = RequestContextResolver.class.getName() + ".BODY";
  private static final BodyView EMPTY_BODY = new BodyView(List.of(), Map.of());

  private final ObjectMapper objectMapper;
  private final String tenantField;
  private final String ownerField;

  public RequestContextResolver(ObjectMapper objectMapper, ApplicationProperties properties) {
    this.objectMapper = objectMapper;
    this.tenantField = properties.security().resourceFields().tenant();
    this.ownerField = properties.security().resourceFields().owner();
  }

  public RequestContext resolve(HttpServletRequest request) {
    Map<String, String> pathVariables = pathVariables(request);
    BodyView body = bodyView(request);
    return new RequestContext(
        request.getMethod(),
        UrlPathHelper.defaultInstance.getPathWithinApplication(request),
        pathVariables,
        queryParameters(request),
        body.fieldNames(),
        lookup(tenantField, pathVariables, body),
        lookup(ownerField, pathVariables, body),
        clientIp(request),
        request.getHeader(Headers.USER_AGENT),
        principal(request)
    );
  }

  /**
   * Client address: first {@code X-Forwarded-For} entry, then {@code X-Real-IP}, then the remote
   * address.
   */
  public static String clientIp(HttpServletRequest request) {
    String forwardedFor = request.getHeader(Headers.FORWARDED_FOR);
    if (StringUtils.hasText(forwardedFor)) {
      return forwardedFor.split(",")[0].trim();
    }
    String realIp = request.getHeader(Headers.REAL_IP);
    if (StringUtils.hasText(realIp)) {
      return realIp.trim();
    }
    return request.getRemoteAddr();
  }

  public static Principal principal(HttpServletRequest request) {
    Object principal = request.getAttribute(PRINCIPAL_ATTRIBUTE);
    return principal instanceof Principal p ? p : null;
  }

  private static Map<String, String> pathVariables(HttpServletRequest request) {
    Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (!(variables instanceof Map<?, ?> map)) {
      return Map.of();
    }
    Map<String, String> copy = new LinkedHashMap<>();
    map.forEach((name, value) -> {
      if (name != null && value != null) {
        copy.put(name.toString(), value.toString());
      }
    });
    return copy;
  }

  private static Map<String, List<String>> queryParameters(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (!StringUtils.hasText(queryString)) {
      return Map.of();
    }
    MultiValueMap<String, String> raw =
        UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams();
    Map<String, List<String>> decoded = new LinkedHashMap<>();
    raw.forEach((name, values) -> {
      List<String> decodedValues = new ArrayList<>(values.size());
      for (String value : values) {
        decodedValues.add(value == null ? "" : UriUtils.decode(value, StandardCharsets.UTF_8));
      }
      decoded.put(UriUtils.decode(name, StandardCharsets.UTF_8),
                  Collections.unmodifiableList(decodedValues));
    });
    return decoded;
  }

  private String lookup(String field, Map<String, String> pathVariables, BodyView body) {
    if (!StringUtils.hasText(field)) {
      return null;
    }
    String fromPath = pathVariables.get(field);
    if (StringUtils.hasText(fromPath)) {
      return fromPath;
    }
    String fromBody = body.identifiers().get(field);
    return StringUtils.hasText(fromBody) ? fromBody : null;
  }

  private BodyView bodyView(HttpServletRequest request) {
    Object cached = request.getAttribute(BODY_VIEW_ATTRIBUTE);
    if (cached instanceof BodyView view) {
      return view;
    }
    BodyView view = parseBody(request);
    request.setAttribute(BODY_VIEW_ATTRIBUTE, view);
    return view;
  }

  private BodyView parseBody(HttpServletRequest request) {
    CachedBodyHttpServletRequest cachedRequest =
        WebUtils.getNativeRequest(request, CachedBodyHttpServletRequest.class);
    if (cachedRequest == null || cachedRequest.getCachedBody().length == 0) {
      return EMPTY_BODY;
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(cachedRequest.getCachedBody());
    } catch (JsonProcessingException e) {
      log.debug("Request body is not valid JSON, no body fields inspected: {}", e.getOriginalMessage());
      return EMPTY_BODY;
    } catch (IOException e) {
      log.debug("Request body could not be read, no body fields inspected", e);
      return EMPTY_BODY;
    }
    if (root == null || !root.isObject()) {
      return EMPTY_BODY;
    }
    List<String> names = new ArrayList<>();
    root.fieldNames().forEachRemaining(names::add);
    Map<String, String> identifiers = new HashMap<>();
    for (String field : List.of(tenantField, ownerField)) {
      JsonNode value = root.get(field);
      if (value != null && value.isValueNode() && !value.isNull()) {
        identifiers.put(field, value.asText());
      }
    }
    return new BodyView(names, identifiers);
  }

  private record BodyView(List<String> fieldNames, Map<String, String> identifiers) {}
}
