package com.supportsignal.session.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import com.supportsignal.session.config.SessionPolicyProperties;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter =
        new CorrelationIdFilter(new TokenGenerator(new SessionPolicyProperties()));

    @Test
    void doFilter_WithValidHeader_ShouldPropagateIt() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions/validate");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "550e8400-e29b-41d4-a716-446655440000");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        // When
        filter.doFilter(request, response, (req, res) -> seenInChain.set(CorrelationIdFilter.getCurrentCorrelationId()));

        // Then
        assertThat(seenInChain.get()).isEqualTo("550e8400-e29b-41d4-a716-446655440000");
        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
            .isEqualTo("550e8400-e29b-41d4-a716-446655440000");
        assertThat(CorrelationIdFilter.getCurrentCorrelationId()).isNull();
    }

    @Test
    void doFilter_WithMalformedHeader_ShouldGenerateNewId() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions/validate");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "<script>alert(1)</script>");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        filter.doFilter(request, response, (req, res) -> { });

        // Then
        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
            .isNotEqualTo("<script>alert(1)</script>")
            .matches("^[0-9a-f]{32}$");
    }

    @Test
    void doFilter_WithoutHeader_ShouldGenerateId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/sessions");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).hasSize(32);
    }
}
