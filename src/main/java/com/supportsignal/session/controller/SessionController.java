package com.supportsignal.session.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.supportsignal.session.domain.DeviceInfo;
import com.supportsignal.session.domain.WorkflowType;
import com.supportsignal.session.security.SessionPrincipal;
import com.supportsignal.session.service.SessionCleanupService;
import com.supportsignal.session.service.SessionService;
import com.supportsignal.session.util.CorrelationIdFilter;
import com.supportsignal.session.util.RequestTokens;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for regular session operations.
 *
 * The session token travels in X-Session-Token (or Authorization: Bearer),
 * never in the URL or body. Lookups always answer 200 with a result body;
 * command failures are rendered by GlobalExceptionHandler.
 *
 * Timestamps in responses are epoch milliseconds.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Tag(name = "Sessions", description = "Regular session lifecycle")
public class SessionController {

    private final SessionService sessionService;
    private final SessionCleanupService sessionCleanupService;

    @PostMapping
    @Timed(value = "api.sessions.create", description = "Time taken to create a session")
    @Operation(summary = "Create session",
               description = "Issues a session for an authenticated user, evicting the oldest one when the per-user cap is reached")
    public ResponseEntity<SessionService.CreateSessionResult> createSession(
            @Valid @RequestBody CreateSessionRequest request,
            HttpServletRequest httpRequest) {

        log.info("API: Create session - userId={}, rememberMe={}", request.userId(), request.rememberMe());

        SessionService.CreateSessionResult result = sessionService.createSession(
            request.userId(),
            Boolean.TRUE.equals(request.rememberMe()),
            deviceInfo(request.deviceType(), httpRequest),
            request.workflowType(),
            request.workflowData()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/validate")
    @Timed(value = "api.sessions.validate", description = "Time taken to validate a session")
    @Operation(summary = "Validate session",
               description = "Reports whether the presented token is a live session; never fails for bad tokens")
    public ResponseEntity<SessionService.ValidationResult> validateSession(
            @RequestParam(defaultValue = "false") boolean includeWorkflowState,
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(
            sessionService.validateSession(RequestTokens.extractOrEmpty(httpRequest), includeWorkflowState));
    }

    @PostMapping("/refresh")
    @Timed(value = "api.sessions.refresh", description = "Time taken to refresh a session")
    @Operation(summary = "Refresh session", description = "Extends a live session using its own lifetime policy")
    public ResponseEntity<SessionService.RefreshResult> refreshSession(
            @RequestBody(required = false) RefreshRequest request,
            HttpServletRequest httpRequest) {

        boolean extend = request == null || request.extendExpiry() == null || request.extendExpiry();
        return ResponseEntity.ok(sessionService.refreshSession(RequestTokens.extractOrEmpty(httpRequest), extend));
    }

    @PostMapping("/invalidate")
    @Timed(value = "api.sessions.invalidate", description = "Time taken to invalidate a session")
    @Operation(summary = "Invalidate session", description = "Logs the session out; succeeds for unknown tokens")
    public ResponseEntity<SessionService.InvalidateResult> invalidateSession(
            @RequestBody(required = false) InvalidateRequest request,
            HttpServletRequest httpRequest) {

        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(sessionService.invalidateSession(RequestTokens.extractOrEmpty(httpRequest), reason));
    }

    @GetMapping("/active")
    @Timed(value = "api.sessions.active", description = "Time taken to list active sessions")
    @Operation(summary = "List active sessions",
               description = "Lists the caller's live sessions, or another user's for authorized admins")
    public ResponseEntity<SessionService.ActiveSessionsResult> getActiveSessions(
            @RequestParam(required = false) Long targetUserId,
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(
            sessionService.getUserActiveSessions(RequestTokens.extractOrEmpty(httpRequest), targetUserId));
    }

    @PostMapping("/invalidate-others")
    @Timed(value = "api.sessions.invalidate_others", description = "Time taken to log out other sessions")
    @Operation(summary = "Log out everywhere else", description = "Deletes every other live session of the caller")
    public ResponseEntity<SessionService.InvalidateOthersResult> invalidateOtherSessions(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(sessionService.invalidateAllOtherSessions(RequestTokens.extractOrEmpty(httpRequest)));
    }

    @PutMapping("/workflow-state")
    @Timed(value = "api.sessions.workflow_update", description = "Time taken to save workflow state")
    @Operation(summary = "Save workflow state", description = "Merges workflow progress into the session snapshot")
    public ResponseEntity<SessionService.WorkflowUpdateResult> updateWorkflowState(
            @Valid @RequestBody WorkflowStateRequest request,
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(sessionService.updateWorkflowState(
            RequestTokens.extractOrEmpty(httpRequest), request.workflowType(), request.workflowData()));
    }

    @GetMapping("/workflow-state")
    @Timed(value = "api.sessions.workflow_recover", description = "Time taken to recover workflow state")
    @Operation(summary = "Recover workflow state", description = "Returns saved workflow progress; empty for invalid tokens")
    public ResponseEntity<SessionService.WorkflowRecoveryResult> recoverWorkflowState(
            @RequestParam(required = false) WorkflowType workflowType,
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(
            sessionService.recoverWorkflowState(RequestTokens.extractOrEmpty(httpRequest), workflowType));
    }

    @GetMapping("/me")
    @Operation(summary = "Current identity", description = "Effective user behind the presented token")
    public ResponseEntity<Map<String, Object>> currentIdentity(@AuthenticationPrincipal SessionPrincipal principal) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("userId", principal.userId());
        response.put("email", principal.email());
        response.put("role", principal.role());
        response.put("impersonating", principal.isImpersonating());
        response.put("impersonatorId", principal.impersonatorId());
        response.put("impersonationCorrelationId", principal.impersonationCorrelationId());
        response.put("correlationId", CorrelationIdFilter.getCurrentCorrelationId());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/cleanup")
    @Timed(value = "api.sessions.cleanup", description = "Time taken to sweep expired sessions")
    @Operation(summary = "Sweep expired sessions", description = "Runs the expiry sweep immediately (system admins)")
    public ResponseEntity<SessionCleanupService.CleanupResult> cleanupExpiredSessions() {
        log.info("API: Manual expired-session sweep");
        return ResponseEntity.ok(sessionCleanupService.cleanupExpiredSessions());
    }

    private static DeviceInfo deviceInfo(String deviceType, HttpServletRequest request) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return DeviceInfo.builder()
            .userAgent(userAgent != null && userAgent.length() > 512 ? userAgent.substring(0, 512) : userAgent)
            .ipAddress(request.getRemoteAddr())
            .deviceType(deviceType)
            .build();
    }

    // =========================================================================
    // Request DTOs
    // =========================================================================

    public record CreateSessionRequest(
        @NotNull Long userId,
        Boolean rememberMe,
        @Size(max = 32) String deviceType,
        WorkflowType workflowType,
        Map<String, Object> workflowData
    ) {}

    public record RefreshRequest(
        Boolean extendExpiry
    ) {}

    public record InvalidateRequest(
        @Size(max = 255) String reason
    ) {}

    public record WorkflowStateRequest(
        @NotNull WorkflowType workflowType,
        @NotNull Map<String, Object> workflowData
    ) {}
}
