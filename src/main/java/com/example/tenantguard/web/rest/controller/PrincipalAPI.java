package com.example.tenantguard.web.rest.controller;

import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.API_V1;
import static com.example.tenantguard.web.rest.ApiConstants.ApiPath.ME;

import com.example.tenantguard.web.rest.dto.PrincipalResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Identity of the caller as resolved from its bearer credential.
 */
@Tag(
    name = "Principal",
    description = "The authenticated caller"
)
@RequestMapping(
    value = API_V1,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface PrincipalAPI {

  @Operation(
      summary = "Get current principal",
      description = "Returns the principal resolved from the bearer credential",
      security = @SecurityRequirement(name = "bearerAuth")
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Principal returned"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or expired credential"),
      @ApiResponse(responseCode = "429", description = "Too many failed authentication attempts")
  })
  @GetMapping(value = ME)
  ResponseEntity<PrincipalResponse> currentPrincipal();
}
