package com.flagship.simple_banking.observability;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("Incoming correlation id is logged and echoed, then cleared from the MDC")
    void echoesIncomingId() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));

        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/transactions");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);

        assertEquals("abc-123", seen.get());
        assertEquals("abc-123", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Missing correlation id is generated")
    void generatesId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest("GET", "/health"), response, (req, res) -> { });

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }
}
