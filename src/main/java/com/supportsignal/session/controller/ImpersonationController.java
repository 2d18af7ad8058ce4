package com.supportsignal.session.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.supportsignal.session.service.ImpersonationService;
import com.supportsignal.session.util.RequestTokens;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for admin impersonation.
 *
 * Admin endpoints (start, users, active, emergency-terminate) expect the
 * admin's own regular session token. End and status expect the
 * impersonation token.
 */
@Slf4j
@RestController
@RequestMapping("/api/impersonation")
@RequiredArgsConstructor
@Tag(name = "Impersonation", description = "Bounded admin-as-user overlays")
public class ImpersonationController {

    private final ImpersonationService impersonationService;

    @PostMapping("/start")
    @Timed(value = "api.impersonation.start", description = "Time taken to start impersonation")
    @Operation(summary = "Start impersonation",
               description = "Creates a short-lived overlay token resolving to the target user")
    public ResponseEntity<ImpersonationService.StartResult> startImpersonation(
            @Valid @RequestBody StartImpersonationRequest request,
            HttpServletRequest httpRequest) {

        log.info("API: Start impersonation - target={}", request.targetUserEmail());

        ImpersonationService.StartResult result = impersonationService.startImpersonation(
            RequestTokens.extractOrEmpty(httpRequest),
            request.targetUserEmail(),
            request.reason()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/end")
    @Timed(value = "api.impersonation.end", description = "Time taken to end impersonation")
    @Operation(summary = "End impersonation",
               description = "Terminates the overlay and returns the admin's original session token")
    public ResponseEntity<ImpersonationService.EndResult> endImpersonation(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(impersonationService.endImpersonation(RequestTokens.extractOrEmpty(httpRequest)));
    }

    @GetMapping("/status")
    @Timed(value = "api.impersonation.status", description = "Time taken to read impersonation status")
    @Operation(summary = "Impersonation status",
               description = "Reports whether the presented token is a live overlay; never fails for bad tokens")
    public ResponseEntity<ImpersonationService.StatusResult> getStatus(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(impersonationService.getImpersonationStatus(RequestTokens.extractOrEmpty(httpRequest)));
    }

    @GetMapping("/users")
    @Timed(value = "api.impersonation.users", description = "Time taken to search impersonation candidates")
    @Operation(summary = "Search users", description = "Finds users that may be impersonated")
    public ResponseEntity<ImpersonationService.UserSearchResult> searchUsers(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer limit,
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(impersonationService.searchUsersForImpersonation(
            RequestTokens.extractOrEmpty(httpRequest), search, limit));
    }

    @GetMapping("/active")
    @Timed(value = "api.impersonation.active", description = "Time taken to list active overlays")
    @Operation(summary = "List active overlays", description = "Every live impersonation system-wide")
    public ResponseEntity<ImpersonationService.ActiveImpersonationsResult> getActiveSessions(
            HttpServletRequest httpRequest) {

        return ResponseEntity.ok(
            impersonationService.getActiveImpersonationSessions(RequestTokens.extractOrEmpty(httpRequest)));
    }

    @PostMapping("/emergency-terminate")
    @Timed(value = "api.impersonation.emergency_terminate", description = "Time taken to terminate all overlays")
    @Operation(summary = "Emergency terminate",
               description = "Deactivates every active impersonation system-wide; safe to repeat")
    public ResponseEntity<ImpersonationService.EmergencyTerminationResult> emergencyTerminate(
            HttpServletRequest httpRequest) {

        log.warn("API: Emergency termination of all impersonation sessions requested");
        return ResponseEntity.ok(
            impersonationService.emergencyTerminateAllSessions(RequestTokens.extractOrEmpty(httpRequest)));
    }

    // =========================================================================
    // Request DTOs
    // =========================================================================

    /**
     * The reason is checked by the service so rejected attempts are still audited.
     */
    public record StartImpersonationRequest(
        @NotBlank @Email String targetUserEmail,
        String reason
    ) {}
}
