package com.tsgate.web;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    private String run(String inboundHeader, AtomicReference<String> seenInChain) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/query");
        if (inboundHeader != null) {
            request.addHeader(TraceIdFilter.TRACE_ID_HEADER, inboundHeader);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = (req, res) -> seenInChain.set(MDC.get(TraceIdFilter.MDC_TRACE_ID));

        filter.doFilter(request, response, chain);
        return response.getHeader(TraceIdFilter.TRACE_ID_HEADER);
    }

    @Test
    void inboundRequestIdIsReusedAndEchoed() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();

        String echoed = run("panel-42", seen);

        assertEquals("panel-42", echoed);
        assertEquals("panel-42", seen.get());
        assertNull(MDC.get(TraceIdFilter.MDC_TRACE_ID));
    }

    @Test
    void missingRequestIdIsGenerated() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();

        String echoed = run(null, seen);

        assertNotNull(UUID.fromString(echoed));
        assertEquals(echoed, seen.get());
        assertNull(MDC.get(TraceIdFilter.MDC_TRACE_ID));
    }

    @Test
    void blankOrOversizedRequestIdIsReplaced() throws Exception {
        String oversized = "x".repeat(TraceIdFilter.MAX_TRACE_ID_LENGTH + 1);

        String forBlank = run("   ", new AtomicReference<>());
        String forOversized = run(oversized, new AtomicReference<>());

        assertNotNull(UUID.fromString(forBlank));
        assertNotNull(UUID.fromString(forOversized));
        assertNotEquals(forBlank, forOversized);
    }

    @Test
    void requestIdWithControlCharactersIsReplaced() {
        String resolved = TraceIdFilter.resolveTraceId("abc\r\ninjected: yes");

        assertNotNull(UUID.fromString(resolved));
        assertEquals("a".repeat(128), TraceIdFilter.resolveTraceId("a".repeat(128)));
    }

    @Test
    void mdcIsClearedWhenTheChainFails() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/health");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "failing-request");
        FilterChain chain = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThrows(IllegalStateException.class,
                () -> filter.doFilter(request, new MockHttpServletResponse(), chain));
        assertNull(MDC.get(TraceIdFilter.MDC_TRACE_ID));
    }
}
