package com.cred.freestyle.warranty.infrastructure.ratelimit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RateLimitInterceptor.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitInterceptor Tests")
class RateLimitInterceptorTest {

    @Mock
    private RegistrationRateLimiter rateLimiter;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("preHandle - GET requests are not counted")
    void preHandle_Get_NotCounted() throws Exception {
        // Given
        RateLimitInterceptor interceptor = new RateLimitInterceptor(rateLimiter);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/users/u1/serials");

        // When
        boolean proceed = interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

        // Then
        assertThat(proceed).isTrue();
        verifyNoInteractions(rateLimiter);
    }

    @Test
    @DisplayName("preHandle - Authenticated caller: Should be keyed by user ID")
    void preHandle_Authenticated_KeyedByUser() throws Exception {
        // Given
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                "u1", null, List.of(new SimpleGrantedAuthority("ROLE_CUSTOMER"))));
        when(rateLimiter.tryAcquire("user:u1")).thenReturn(RateLimitResult.allowed(10, 9));
        RateLimitInterceptor interceptor = new RateLimitInterceptor(rateLimiter);
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        boolean proceed = interceptor.preHandle(
                new MockHttpServletRequest("POST", "/api/v1/users/u1/serials"), response, new Object());

        // Then
        assertThat(proceed).isTrue();
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("9");
    }

    @Test
    @DisplayName("preHandle - Anonymous caller: Should be keyed by the forwarded client IP")
    void preHandle_Anonymous_KeyedByIp() throws Exception {
        // Given
        when(rateLimiter.tryAcquire(anyString())).thenReturn(RateLimitResult.allowed(10, 9));
        RateLimitInterceptor interceptor = new RateLimitInterceptor(rateLimiter);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/users/u1/serials");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

        // When
        interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

        // Then
        verify(rateLimiter).tryAcquire("ip:203.0.113.7");
    }

    @Test
    @DisplayName("preHandle - Limit exceeded: Should answer 429 with Retry-After")
    void preHandle_LimitExceeded_Returns429() throws Exception {
        // Given
        when(rateLimiter.tryAcquire(anyString()))
                .thenReturn(RateLimitResult.rejected(10, 120, "Too many registration attempts. Please try again later."));
        RateLimitInterceptor interceptor = new RateLimitInterceptor(rateLimiter);
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        boolean proceed = interceptor.preHandle(
                new MockHttpServletRequest("POST", "/api/v1/users/u1/serials"), response, new Object());

        // Then
        assertThat(proceed).isFalse();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("120");
        assertThat(response.getContentAsString()).contains("\"retryAfter\":120");
    }
}
