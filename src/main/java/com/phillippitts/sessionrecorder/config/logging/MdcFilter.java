package com.phillippitts.sessionrecorder.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scopes request values into Log4j2's ThreadContext for the duration of one HTTP request.
 *
 * <p>Keys: {@code requestId} (X-Request-ID header or a fresh UUID, echoed on the response),
 * {@code userId} (X-User-ID, only when present), {@code method} and {@code uri}.
 *
 * <p>Toggles submitted while the request is in flight copy this context onto the recorder
 * loop through the executor's task decorator, so session logs carry the originating request id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        Map<String, String> context = contextFor(http);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, context.get("requestId"));
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(context)) {
            chain.doFilter(request, response);
        }
    }

    private static Map<String, String> contextFor(HttpServletRequest http) {
        Map<String, String> context = new LinkedHashMap<>();
        String requestId = http.getHeader(REQUEST_ID_HEADER);
        context.put("requestId", isBlank(requestId) ? UUID.randomUUID().toString() : requestId);
        String userId = http.getHeader(USER_ID_HEADER);
        if (!isBlank(userId)) {
            context.put("userId", userId);
        }
        if (http.getMethod() != null) {
            context.put("method", http.getMethod());
        }
        if (http.getRequestURI() != null) {
            context.put("uri", http.getRequestURI());
        }
        return context;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
