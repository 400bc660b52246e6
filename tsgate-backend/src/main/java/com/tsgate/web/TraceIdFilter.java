package com.tsgate.web;

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
 * Tags every request with a trace id, reusing the caller's {@code X-Request-Id} when it is usable,
 * and echoes it back so panel errors can be matched with gateway logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";
    static final int MAX_TRACE_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    /**
     * Returns the inbound id if it is at most {@value #MAX_TRACE_ID_LENGTH} visible ASCII characters,
     * a fresh UUID otherwise.
     */
    static String resolveTraceId(String inbound) {
        if (inbound == null || inbound.isBlank() || inbound.length() > MAX_TRACE_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        for (int i = 0; i < inbound.length(); i++) {
            char c = inbound.charAt(i);
            if (c < '!' || c > '~') {
                return UUID.randomUUID().toString();
            }
        }
        return inbound;
    }
}
