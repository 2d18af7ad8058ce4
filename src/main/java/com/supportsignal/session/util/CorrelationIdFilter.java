package com.supportsignal.session.util;

import java.io.IOException;
import java.util.regex.Pattern;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Servlet filter for request correlation IDs.
 *
 * Functionality:
 * 1. Extracts correlation ID from request header (X-Correlation-ID)
 * 2. Generates a new one if absent or malformed
 * 3. Adds it to MDC so every log line of the request carries it
 * 4. Echoes it in the response header
 * 5. Cleans up MDC after request processing
 *
 * This is the request-level id. Each session operation additionally mints
 * its own operation correlation id, returned in the result and audit log.
 *
 * @see com.supportsignal.session.util.SessionAuditLogger
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class CorrelationIdFilter implements Filter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /**
     * MDC key for correlation ID, referenced by logback-spring.xml.
     */
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    /**
     * Accepts UUIDs and our own hex ids; anything else is replaced.
     */
    private static final Pattern ACCEPTED_FORMAT = Pattern.compile("^[A-Za-z0-9-]{16,64}$");

    private final TokenGenerator tokenGenerator;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        Span currentSpan = Span.current();

        try {
            String correlationId = extractOrGenerateCorrelationId(httpRequest);

            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
            httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

            currentSpan.setAttribute("correlation.id", correlationId);
            currentSpan.setAttribute("http.request.method", httpRequest.getMethod());
            currentSpan.setAttribute("http.request.uri", httpRequest.getRequestURI());

            Context contextWithBaggage = Context.current().with(
                Baggage.builder()
                    .put("correlation.id", correlationId)
                    .build()
            );

            try (Scope scope = contextWithBaggage.makeCurrent()) {
                chain.doFilter(request, response);
            }

            currentSpan.setStatus(StatusCode.OK);

        } catch (IOException | ServletException | RuntimeException e) {
            currentSpan.recordException(e);
            currentSpan.setStatus(StatusCode.ERROR, "Request processing failed: " + e.getMessage());
            throw e;
        } finally {
            // MDC is thread-local; pooled request threads must not leak ids
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    private String extractOrGenerateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);

        if (correlationId != null && ACCEPTED_FORMAT.matcher(correlationId).matches()) {
            log.trace("Using correlation ID from request header: {}", correlationId);
            return correlationId;
        }

        if (correlationId != null) {
            log.warn("Rejected malformed correlation ID header, generating a new one");
        }

        return tokenGenerator.newCorrelationId();
    }

    /**
     * Gets the current request correlation ID from MDC.
     *
     * @return correlation ID from MDC, or null if not set
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }
}
