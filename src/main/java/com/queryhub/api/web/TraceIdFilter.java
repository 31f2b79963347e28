package com.queryhub.api.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a per-request trace id into the logging MDC and echoes it back.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "trace_id";

    private static final int MAX_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Object existing = request.getAttribute(MDC_KEY);
        String traceId = existing != null ? existing.toString() : request.getHeader(HEADER);
        if (traceId == null || traceId.isBlank() || traceId.length() > MAX_LENGTH) {
            traceId = UUID.randomUUID().toString();
        }

        MDC.put(MDC_KEY, traceId);
        request.setAttribute(MDC_KEY, traceId);
        response.setHeader(HEADER, traceId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * Async dispatches (Mono results) run the filter again so the MDC is set on
     * the thread that writes the response.
     */
    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    public static String currentTraceId(HttpServletRequest request) {
        Object value = request.getAttribute(MDC_KEY);
        return value == null ? MDC.get(MDC_KEY) : value.toString();
    }
}
