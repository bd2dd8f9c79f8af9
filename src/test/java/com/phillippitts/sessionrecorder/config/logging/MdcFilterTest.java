package com.phillippitts.sessionrecorder.config.logging;

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);

        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesRequestIdHeaderAndEchoesIt() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("test-request-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/recorder/toggle");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("test-request-123");
            assertThat(ThreadContext.get("method")).isEqualTo("POST");
            assertThat(ThreadContext.get("uri")).isEqualTo("/recorder/toggle");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "test-request-123");
        // request values are scoped to the chain call
        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/recorder");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId"))
                    .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void addsUserIdOnlyWhenPresent() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("user-7");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/recorder");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("userId")).isEqualTo("user-7");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void restoresContextWhenChainThrows() throws ServletException, IOException {
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/recorder");
        doThrow(new ServletException("boom")).when(chain).doFilter(any(), any());

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class);

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void restoresOuterContextAfterRequest() throws ServletException, IOException {
        ThreadContext.put("requestId", "outer");
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("inner");

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.get("requestId")).isEqualTo("outer");
        assertThat(ThreadContext.get("method")).isNull();
    }

    @Test
    void passesThroughNonHttpRequests() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);
        ServletResponse plainResponse = mock(ServletResponse.class);

        filter.doFilter(plain, plainResponse, chain);

        verify(chain).doFilter(plain, plainResponse);
        assertThat(ThreadContext.get("requestId")).isNull();
    }
}
