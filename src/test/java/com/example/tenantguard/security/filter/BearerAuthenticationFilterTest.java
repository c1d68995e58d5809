package com.example.tenantguard.security.filter;

import static com.example.tenantguard.support.Fixtures.principal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.tenantguard.domain.entity.Principal;
import com.example.tenantguard.domain.entity.Role;
import com.example.tenantguard.exception.CredentialException.CredentialFailure;
import com.example.tenantguard.exception.CredentialException;
import com.example.tenantguard.exception.StoreUnavailableException;
import com.example.tenantguard.exception.TooManyAttemptsException;
import com.example.tenantguard.security.credential.CredentialFailureTracker;
import com.example.tenantguard.security.credential.CredentialValidator;
import com.example.tenantguard.web.context.RequestContextResolver;
import com.example.tenantguard.web.rest.errors.ErrorResponseWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class BearerAuthenticationFilterTest {

  private static final String IP = "203.0.113.7";

  @Mock
  private CredentialValidator credentialValidator;

  @Mock
  private CredentialFailureTracker failureTracker;

  @Mock
  private ErrorResponseWriter errorResponseWriter;

  private BearerAuthenticationFilter filter;

  @BeforeEach
  void setUp() {
    filter = new BearerAuthenticationFilter(credentialValidator, failureTracker, errorResponseWriter);
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  @Test
  @DisplayName("a valid credential should authenticate the request and clear past failures")
  void doFilter_shouldAuthenticate_whenCredentialValid() throws Exception {
    // Arrange
    Principal principal = principal("u1", Role.END_USER, "t1");
    when(credentialValidator.validate("good-token")).thenReturn(principal);
    MockHttpServletRequest request = request("Bearer good-token");
    MockFilterChain chain = new MockFilterChain();

    // Act
    filter.doFilter(request, new MockHttpServletResponse(), chain);

    // Assert
    assertThat(chain.getRequest()).isNotNull();
    assertThat(request.getAttribute(RequestContextResolver.PRINCIPAL_ATTRIBUTE)).isEqualTo(principal);
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication.getPrincipal()).isEqualTo(principal);
    assertThat(authentication.getAuthorities()).extracting(Object::toString)
        .containsExactly("ROLE_END_USER");
    verify(failureTracker).clearFailures(IP);
  }

  @Test
  @DisplayName("a request without a bearer credential should continue unauthenticated")
  void doFilter_shouldContinue_whenNoBearer() throws Exception {
    MockHttpServletRequest request = request("Basic dXNlcjpwYXNz");
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(chain.getRequest()).isSameAs(request);
    verifyNoInteractions(credentialValidator, failureTracker, errorResponseWriter);
  }

  @Test
  @DisplayName("an invalid credential should be rejected and counted against the client")
  void doFilter_shouldRejectAndCount_whenCredentialInvalid() throws Exception {
    // Arrange
    CredentialException failure = new CredentialException(CredentialFailure.INVALID_CREDENTIAL);
    when(credentialValidator.validate("bad-token")).thenThrow(failure);
    MockFilterChain chain = new MockFilterChain();

    // Act
    filter.doFilter(request("Bearer bad-token"), new MockHttpServletResponse(), chain);

    // Assert
    assertThat(chain.getRequest()).isNull();
    verify(failureTracker).recordFailure(IP);
    verify(errorResponseWriter).write(any(), any(), isA(CredentialException.class));
    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
  }

  @Test
  @DisplayName("a blocked client should be turned away before validation")
  void doFilter_shouldThrottle_whenClientBlocked() throws Exception {
    when(failureTracker.isBlocked(IP)).thenReturn(true);
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request("Bearer any-token"), new MockHttpServletResponse(), chain);

    assertThat(chain.getRequest()).isNull();
    verify(errorResponseWriter).write(any(), any(), isA(TooManyAttemptsException.class));
    verifyNoInteractions(credentialValidator);
  }

  @Test
  @DisplayName("a store outage should be rendered without counting a credential failure")
  void doFilter_shouldNotCount_whenStoreUnavailable() throws Exception {
    when(credentialValidator.validate("good-token"))
        .thenThrow(new StoreUnavailableException("principal store", new QueryTimeoutException("t")));

    filter.doFilter(request("Bearer good-token"), new MockHttpServletResponse(), new MockFilterChain());

    verify(failureTracker, never()).recordFailure(any());
    verify(errorResponseWriter).write(any(), any(), isA(StoreUnavailableException.class));
  }

  private static MockHttpServletRequest request(String authorization) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/me");
    request.setRemoteAddr(IP);
    request.addHeader("Authorization", authorization);
    return request;
  }
}
