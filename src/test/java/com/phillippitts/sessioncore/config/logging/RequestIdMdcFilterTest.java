package com.phillippitts.sessioncore.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestIdMdcFilterTest {

    private RequestIdMdcFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new RequestIdMdcFilter();
        request = new MockHttpServletRequest("GET", "/coordination/status");
        response = new MockHttpServletResponse();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesIncomingRequestIdAndEchoesIt() throws ServletException, IOException {
        request.addHeader("X-Request-ID", "req-123");
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(ThreadContext.get("requestId")));

        assertThat(seen.get()).isEqualTo("req-123");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("req-123");
        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void generatesUuidWhenHeaderMissingOrBlank() throws ServletException, IOException {
        request.addHeader("X-Request-ID", "   ");
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(ThreadContext.get("requestId")));

        assertThat(seen.get()).matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo(seen.get());
    }

    @Test
    void truncatesOversizedRequestId() throws ServletException, IOException {
        request.addHeader("X-Request-ID", "x".repeat(500));
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(ThreadContext.get("requestId")));

        assertThat(seen.get()).hasSize(64);
    }

    @Test
    void recordsEndpointDuringRequest() throws ServletException, IOException {
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(ThreadContext.get("endpoint")));

        assertThat(seen.get()).isEqualTo("GET /coordination/status");
    }

    @Test
    void restoresContextWhenChainThrows() {
        FilterChain failing = (req, res) -> {
            throw new ServletException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(request, response, failing)).isInstanceOf(ServletException.class);

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("endpoint")).isNull();
    }
}
