package com.supportsignal.session.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import com.supportsignal.session.exception.ImpersonationForbiddenException;
import com.supportsignal.session.exception.SessionErrorType;
import com.supportsignal.session.exception.SessionExpiredException;
import com.supportsignal.session.exception.SessionLimitExceededException;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void statusFor_ShouldMapEveryErrorType() {
        assertThat(GlobalExceptionHandler.statusFor(SessionErrorType.NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.statusFor(SessionErrorType.EXPIRED)).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(GlobalExceptionHandler.statusFor(SessionErrorType.LIMIT_EXCEEDED)).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(GlobalExceptionHandler.statusFor(SessionErrorType.FORBIDDEN)).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(GlobalExceptionHandler.statusFor(SessionErrorType.INVALID_REQUEST)).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void handleSessionLifecycleException_ShouldRenderStructuredBody() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/sessions/refresh");

        // When
        ResponseEntity<Map<String, Object>> response =
            handler.handleSessionLifecycleException(new SessionExpiredException("Session expired"), request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody())
            .containsEntry("success", false)
            .containsEntry("error", "Expired")
            .containsEntry("message", "Session expired")
            .containsEntry("path", "/api/sessions/refresh")
            .containsKeys("timestamp", "correlationId");
    }

    @Test
    void handleSessionLifecycleException_ShouldDistinguishForbiddenAndLimit() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/impersonation/start");

        assertThat(handler.handleSessionLifecycleException(
            new ImpersonationForbiddenException("nope"), request).getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(handler.handleSessionLifecycleException(
            new SessionLimitExceededException("too many"), request).getStatusCode())
            .isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    }

    @Test
    void handleStoreUnavailable_ShouldReturn503() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions/validate");

        ResponseEntity<Map<String, Object>> response = handler.handleStoreUnavailable(
            new DataAccessResourceFailureException("connection refused"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("error", "StoreUnavailable");
    }
}
