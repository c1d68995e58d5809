package com.example.tenantguard.security.filter;

import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.exception.CredentialException;
import com.example.tenantguard.exception.TooManyAttemptsException;
import com.example.tenantguard.security.credential.CredentialFailureTracker;
import com.example.tenantguard.security.credential.CredentialValidator;
import com.example.tenantguard.web.context.RequestContextResolver;
import com.example.tenantguard.web.rest.ApiConstants.Headers;
import com.example.tenantguard.web.rest.errors.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates protected requests from the {@code Authorization: Bearer} header.
 * <p>
 * A request without a bearer credential continues unauthenticated and is turned away by the
 * entry point. An invalid credential is answered with 401 here and counted against the client
 * IP; a blocked IP is answered with 429 before the credential is looked at.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerAuthenticationFilter extends OncePerRequestFilter {

  private final CredentialValidator credentialValidator;
  private final CredentialFailureTracker failureTracker;
  private final ErrorResponseWriter errorResponseWriter;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
  ) throws ServletException, IOException {

    String credential = extractBearer(request);
    if (credential == null) {
      filterChain.doFilter(request, response);
      return;
    }

    String clientIp = RequestContextResolver.clientIp(request);
    if (failureTracker.isBlocked(clientIp)) {
      errorResponseWriter.write(request, response, new TooManyAttemptsException());
      return;
    }

    Principal principal;
    try {
      principal = credentialValidator.validate(credential);
    } catch (CredentialException e) {
      failureTracker.recordFailure(clientIp);
      SecurityContextHolder.clearContext();
      errorResponseWriter.write(request, response, e);
      return;
    } catch (RuntimeException e) {
      SecurityContextHolder.clearContext();
      errorResponseWriter.write(request, response, e);
      return;
    }

    failureTracker.clearFailures(clientIp);
    request.setAttribute(RequestContextResolver.PRINCIPAL_ATTRIBUTE, principal);

    UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
        principal, null, List.of(new SimpleGrantedAuthority(principal.role().authority())));
    SecurityContext context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(authentication);
    SecurityContextHolder.setContext(context);
    log.trace("Authenticated principal {} with role {}", principal.id(), principal.role());

    filterChain.doFilter(request, response);
  }

  private static String extractBearer(HttpServletRequest request) {
    String header = request.getHeader(Headers.AUTHORIZATION);
    if (header == null || !header.regionMatches(true, 0, Headers.BEARER_PREFIX, 0,
                                                  Headers.BEARER_PREFIX.length())) {
      return null;
    }
    return header.substring(Headers.BEARER_PREFIX.length()).trim();
  }
}
