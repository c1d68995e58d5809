package com.example.tenantguard.web.rest.controller;

import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.HEALTH_BASE;
import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.LIVE;
import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.READY;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.Map;

@Tag(
    name = "Health",
    description = "Probes for load balancers and orchestration. Public and never audited."
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Basic health check",
      description = "Answers as long as the process serves requests"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is up")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Liveness probe",
      description = "Reports whether the JVM is healthy enough to keep running"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is alive"),
      @ApiResponse(responseCode = "503", description = "Service should be restarted")
  })
  @GetMapping(value = LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness probe",
      description = "Reports whether Redis is reachable and the audit queue has room"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is ready"),
      @ApiResponse(responseCode = "503", description = "Service is not ready")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();
}
