package com.supportsignal.session.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.supportsignal.session.config.SessionPolicyProperties;
import com.supportsignal.session.domain.ImpersonationSession;
import com.supportsignal.session.domain.TerminationType;
import com.supportsignal.session.domain.User;
import com.supportsignal.session.domain.UserRole;
import com.supportsignal.session.exception.ImpersonationForbiddenException;
import com.supportsignal.session.exception.InvalidSessionRequestException;
import com.supportsignal.session.exception.SessionExpiredException;
import com.supportsignal.session.exception.SessionLimitExceededException;
import com.supportsignal.session.exception.SessionNotFoundException;
import com.supportsignal.session.repository.ImpersonationSessionRepository;
import com.supportsignal.session.repository.UserRepository;
import com.supportsignal.session.repository.jooq.ImpersonationJooqRepository;
import com.supportsignal.session.repository.jooq.ImpersonationJooqRepository.ActiveImpersonationDTO;
import com.supportsignal.session.repository.jooq.ImpersonationJooqRepository.UserSearchDTO;
import com.supportsignal.session.service.SessionResolverService.ResolvedIdentity;
import com.supportsignal.session.service.SessionService.UserInfo;
import com.supportsignal.session.util.SessionAuditLogger;
import com.supportsignal.session.util.TokenGenerator;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Admin impersonation overlays.
 *
 * An overlay is a second, short-lived token that resolves to the target user
 * while the admin's own session stays untouched. Rules:
 * - only system admins, presenting their own regular session token, may
 *   start overlays or use the admin read helpers
 * - a reason is mandatory and audit logged
 * - at most N live overlays per admin; exceeding the cap fails, nothing is evicted
 * - nobody impersonates themselves; system admins can only be impersonated
 *   by the configured owner account
 * - the overlay TTL is fixed at creation and never extended
 *
 * All terminations (end, sweep, emergency) go through the conditional update
 * in {@link ImpersonationSessionRepository}, so each record is deactivated
 * exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImpersonationService {

    static final int MAX_SEARCH_LIMIT = 100;
    private static final int MAX_TOKEN_ATTEMPTS = 5;

    private final ImpersonationSessionRepository impersonationSessionRepository;
    private final ImpersonationJooqRepository impersonationJooqRepository;
    private final UserRepository userRepository;
    private final SessionResolverService sessionResolverService;
    private final TokenGenerator tokenGenerator;
    private final SessionAuditLogger auditLogger;
    private final SessionPolicyProperties properties;
    private final Clock clock;

    /**
     * Starts an overlay for the admin behind {@code adminToken}.
     *
     * Every precondition is checked before the insert; failed attempts are
     * audit logged and rethrown.
     *
     * @param adminToken the admin's regular session token
     * @param targetUserEmail email of the user to impersonate
     * @param reason mandatory justification
     * @return overlay token and expiry
     * @throws ImpersonationForbiddenException if the caller may not impersonate the target
     * @throws SessionLimitExceededException if the admin already holds the maximum overlays
     * @throws SessionNotFoundException if the target does not exist
     * @throws InvalidSessionRequestException if the reason is blank
     */
    @Transactional
    @WithSpan("impersonation.start")
    public StartResult startImpersonation(String adminToken, String targetUserEmail, String reason) {
        String correlationId = tokenGenerator.newCorrelationId();
        Span.current().setAttribute("impersonation.correlation_id", correlationId);

        try {
            User admin = requireSystemAdmin(adminToken);

            if (reason == null || reason.isBlank()) {
                throw new InvalidSessionRequestException("Impersonation reason is required");
            }

            Instant now = clock.instant();

            int maxConcurrent = properties.getImpersonation().getMaxConcurrentPerAdmin();
            if (impersonationSessionRepository.countLiveByAdminUserId(admin.getId(), now) >= maxConcurrent) {
                throw new SessionLimitExceededException(
                    String.format("Maximum concurrent impersonation sessions reached (%d)", maxConcurrent));
            }

            User target = Optional.ofNullable(targetUserEmail)
                .flatMap(email -> userRepository.findByEmail(email.trim()))
                .orElseThrow(() -> new SessionNotFoundException("Target user not found"));

            if (admin.getId().equals(target.getId())) {
                throw new ImpersonationForbiddenException("Cannot impersonate yourself");
            }
            if (target.getRole() == UserRole.SYSTEM_ADMIN && !isOwner(admin)) {
                throw new ImpersonationForbiddenException("Cannot impersonate other system administrators");
            }

            ImpersonationSession overlay = ImpersonationSession.builder()
                .adminUserId(admin.getId())
                .targetUserId(target.getId())
                .sessionToken(uniqueImpersonationToken())
                .originalSessionToken(adminToken)
                .reason(reason.trim())
                .expiresAt(now.plus(properties.getImpersonation().getTtl()))
                .active(true)
                .createdAt(now)
                .correlationId(correlationId)
                .build();

            overlay = impersonationSessionRepository.save(overlay);

            auditLogger.event("impersonation_start", correlationId)
                .with("adminUserId", admin.getId())
                .with("targetUserId", target.getId())
                .with("targetEmail", target.getEmail())
                .with("impersonationId", overlay.getId())
                .with("token", TokenGenerator.mask(overlay.getSessionToken()))
                .with("reason", overlay.getReason())
                .with("expires", overlay.getExpiresAt())
                .success();

            return new StartResult(
                true,
                overlay.getSessionToken(),
                overlay.getExpiresAt().toEpochMilli(),
                UserInfo.from(target),
                correlationId
            );

        } catch (RuntimeException e) {
            auditLogger.event("impersonation_start_failed", correlationId)
                .with("targetEmail", targetUserEmail)
                .with("reason", reason)
                .failure(e.getMessage());
            throw e;
        }
    }

    /**
     * Ends a live overlay and hands back the admin's original token.
     *
     * Unlike regular invalidation this is not idempotent: ending an overlay
     * that is already inactive or expired fails.
     *
     * @param impersonationToken overlay token
     * @return the admin's original session token
     * @throws SessionNotFoundException if the token is unknown
     * @throws InvalidSessionRequestException if the overlay was already terminated
     * @throws SessionExpiredException if the overlay has expired
     */
    @Transactional
    @WithSpan("impersonation.end")
    public EndResult endImpersonation(String impersonationToken) {
        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        ImpersonationSession overlay = impersonationSessionRepository
            .findBySessionToken(TokenGenerator.normalize(impersonationToken))
            .orElseThrow(() -> new SessionNotFoundException("Impersonation session not found"));

        if (!overlay.isActive()) {
            throw new InvalidSessionRequestException("Impersonation session already terminated");
        }
        if (overlay.isExpiredAt(now)) {
            throw new SessionExpiredException("Impersonation session expired");
        }

        if (impersonationSessionRepository.terminate(overlay.getId(), TerminationType.MANUAL, now) == 0) {
            // lost the race against the sweep or an emergency termination
            throw new InvalidSessionRequestException("Impersonation session already terminated");
        }

        auditLogger.event("impersonation_end", correlationId)
            .with("impersonationId", overlay.getId())
            .with("impersonationCorrelationId", overlay.getCorrelationId())
            .with("adminUserId", overlay.getAdminUserId())
            .with("targetUserId", overlay.getTargetUserId())
            .with("durationMs", Duration.between(overlay.getCreatedAt(), now).toMillis())
            .with("terminationType", TerminationType.MANUAL)
            .success();

        return new EndResult(true, overlay.getOriginalSessionToken(), correlationId);
    }

    /**
     * Reports whether a token is a live overlay. Never throws for malformed
     * input.
     *
     * @param token raw token
     * @return status, with admin and target details when impersonating
     */
    @Transactional(readOnly = true)
    @WithSpan("impersonation.status")
    public StatusResult getImpersonationStatus(String token) {
        Instant now = clock.instant();

        Optional<ImpersonationSession> overlay =
            impersonationSessionRepository.findLiveBySessionToken(TokenGenerator.normalize(token), now);

        if (overlay.isEmpty()) {
            return StatusResult.notImpersonating(tokenGenerator.newCorrelationId());
        }

        ImpersonationSession live = overlay.get();
        Optional<User> admin = userRepository.findById(live.getAdminUserId());
        Optional<User> target = userRepository.findById(live.getTargetUserId());

        if (admin.isEmpty() || target.isEmpty()) {
            return StatusResult.notImpersonating(tokenGenerator.newCorrelationId());
        }

        return new StatusResult(
            true,
            UserInfo.from(admin.get()),
            UserInfo.from(target.get()),
            live.timeRemaining(now).toMillis(),
            live.getExpiresAt().toEpochMilli(),
            live.getReason(),
            live.getCorrelationId()
        );
    }

    /**
     * Searches impersonation candidates. System admins are hidden unless the
     * caller is the owner account.
     *
     * @param adminToken the admin's regular session token
     * @param searchTerm optional name or email fragment
     * @param limit maximum results, clamped to 1..100; null uses the configured default
     * @return matching users
     * @throws ImpersonationForbiddenException if the caller is not a system admin
     */
    @Transactional(readOnly = true)
    @WithSpan("impersonation.search_users")
    public UserSearchResult searchUsersForImpersonation(String adminToken, String searchTerm, Integer limit) {
        String correlationId = tokenGenerator.newCorrelationId();
        User admin = requireSystemAdmin(adminToken);

        int effectiveLimit = limit == null || limit <= 0
            ? properties.getImpersonation().getSearchLimit()
            : Math.min(limit, MAX_SEARCH_LIMIT);

        String excludedRole = isOwner(admin) ? null : UserRole.SYSTEM_ADMIN.name();
        List<UserSearchDTO> users = impersonationJooqRepository.searchUsers(searchTerm, excludedRole, effectiveLimit);

        return new UserSearchResult(users, users.size(), correlationId);
    }

    /**
     * Lists every live overlay system-wide for the admin dashboard.
     *
     * @param adminToken the admin's regular session token
     * @return live overlays, newest first
     */
    @Transactional(readOnly = true)
    @WithSpan("impersonation.list_active")
    public ActiveImpersonationsResult getActiveImpersonationSessions(String adminToken) {
        String correlationId = tokenGenerator.newCorrelationId();
        requireSystemAdmin(adminToken);

        List<ActiveImpersonationDTO> sessions = impersonationJooqRepository.findLiveSessionsWithUsers(clock.instant());
        return new ActiveImpersonationsResult(sessions, sessions.size(), correlationId);
    }

    /**
     * Break-glass: deactivates every active overlay, whoever started it.
     * Idempotent; a repeated call terminates nothing and reports 0.
     *
     * @param adminToken the admin's regular session token
     * @return number of overlays terminated by this call
     */
    @Transactional
    @WithSpan("impersonation.emergency_terminate")
    public EmergencyTerminationResult emergencyTerminateAllSessions(String adminToken) {
        String correlationId = tokenGenerator.newCorrelationId();
        User admin = requireSystemAdmin(adminToken);

        int terminated = impersonationSessionRepository.terminateAllActive(TerminationType.EMERGENCY, clock.instant());

        auditLogger.event("impersonation_emergency_terminate", correlationId)
            .with("adminUserId", admin.getId())
            .with("sessionsTerminated", terminated)
            .success();

        if (terminated > 0) {
            log.warn("Emergency termination by admin {} deactivated {} impersonation session(s)",
                admin.getId(), terminated);
        }

        return new EmergencyTerminationResult(true, terminated, correlationId);
    }

    private User requireSystemAdmin(String adminToken) {
        ResolvedIdentity identity = sessionResolverService.resolve(adminToken)
            .orElseThrow(() -> new ImpersonationForbiddenException("Authentication required"));

        if (identity.impersonating()) {
            throw new ImpersonationForbiddenException("Impersonation tokens cannot perform administrative operations");
        }
        if (!identity.user().getRole().isSystemAdmin()) {
            throw new ImpersonationForbiddenException("Insufficient permissions: System administrator role required");
        }
        return identity.user();
    }

    private boolean isOwner(User admin) {
        String ownerEmail = properties.getImpersonation().getOwnerEmail();
        return ownerEmail != null && !ownerEmail.isBlank() && ownerEmail.equalsIgnoreCase(admin.getEmail());
    }

    private String uniqueImpersonationToken() {
        for (int attempt = 0; attempt < MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = tokenGenerator.newImpersonationToken();
            if (!impersonationSessionRepository.existsBySessionToken(token)) {
                return token;
            }
            log.warn("Impersonation token collision, regenerating (attempt {})", attempt + 1);
        }
        throw new IllegalStateException("Could not generate a unique impersonation token");
    }

    // =========================================================================
    // Result Records
    // =========================================================================

    public record StartResult(
        boolean success,
        String impersonationToken,
        long expires,
        UserInfo targetUser,
        String correlationId
    ) {}

    public record EndResult(
        boolean success,
        String originalSessionToken,
        String correlationId
    ) {}

    public record StatusResult(
        boolean isImpersonating,
        UserInfo adminUser,
        UserInfo targetUser,
        Long timeRemaining,
        Long expires,
        String reason,
        String correlationId
    ) {
        static StatusResult notImpersonating(String correlationId) {
            return new StatusResult(false, null, null, null, null, null, correlationId);
        }
    }

    public record UserSearchResult(
        List<UserSearchDTO> users,
        int total,
        String correlationId
    ) {}

    public record ActiveImpersonationsResult(
        List<ActiveImpersonationDTO> sessions,
        int total,
        String correlationId
    ) {}

    public record EmergencyTerminationResult(
        boolean success,
        int terminatedCount,
        String correlationId
    ) {}
}
