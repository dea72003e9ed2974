package com.seamtalk.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private final MdcFilter filter = new MdcFilter();
    private final HttpServletRequest request = mock(HttpServletRequest.class);
    private final HttpServletResponse response = mock(HttpServletResponse.class);
    private final FilterChain chain = mock(FilterChain.class);

    // Context as seen from inside the chain
    private final Map<String, String> seen = new HashMap<>();

    @BeforeEach
    void setUp() throws ServletException, IOException {
        ThreadContext.clearAll();
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/v1/translate/text");
        doAnswer(invocation -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesAndEchoesCallerRequestId() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("trace-42");

        filter.doFilter(request, response, chain);

        assertThat(seen)
                .containsEntry("requestId", "trace-42")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/v1/translate/text");
        verify(response).setHeader("X-Request-ID", "trace-42");
    }

    @Test
    void generatesRequestIdWhenHeaderBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("  ");

        filter.doFilter(request, response, chain);

        String generated = seen.get("requestId");
        assertThat(UUID.fromString(generated)).isNotNull();
        verify(response).setHeader("X-Request-ID", generated);
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        filter.doFilter(request, response, chain);

        assertThat(seen).containsKey("requestId");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextWhenChainFails() throws ServletException, IOException {
        doThrow(new ServletException("handler failed")).when(chain).doFilter(any(), any());

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void passesNonHttpRequestsThrough() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);
        ServletResponse plainResponse = mock(ServletResponse.class);

        filter.doFilter(plain, plainResponse, chain);

        verify(chain).doFilter(plain, plainResponse);
        assertThat(seen).doesNotContainKey("requestId");
    }

    @Test
    void requestsDoNotShareContext() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("first");
        filter.doFilter(request, response, chain);

        seen.clear();
        HttpServletRequest second = mock(HttpServletRequest.class);
        when(second.getMethod()).thenReturn("GET");
        when(second.getRequestURI()).thenReturn("/health");
        filter.doFilter(second, response, chain);

        assertThat(seen.get("requestId")).isNotEqualTo("first");
        assertThat(seen).containsEntry("uri", "/health");
    }
}
