package com.phillippitts.sessioncore.config.logging;

import com.phillippitts.sessioncore.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a request id into Log4j2's ThreadContext for every HTTP request and echoes it back in the
 * {@code X-Request-ID} response header.
 *
 * <p>The id is taken from the incoming {@code X-Request-ID} header when present, otherwise
 * generated. The {@code requestId} key appears in the console pattern of {@code log4j2-spring.xml}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdMdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String REQUEST_ID_KEY = "requestId";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext
                .put(REQUEST_ID_KEY, requestId)
                .put("endpoint", request.getMethod() + ' ' + request.getRequestURI())) {
            chain.doFilter(request, response);
        }
    }

    private static String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header == null || header.isBlank()) {
            return UUID.randomUUID().toString();
        }
        // Client-supplied; bounded so it cannot flood the log line
        return LogSanitizer.truncate(header, MAX_REQUEST_ID_LENGTH);
    }
}
