package com.supportsignal.session.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.supportsignal.session.config.SessionPolicyProperties;
import com.supportsignal.session.domain.DeviceInfo;
import com.supportsignal.session.domain.Session;
import com.supportsignal.session.domain.User;
import com.supportsignal.session.domain.UserRole;
import com.supportsignal.session.domain.WorkflowType;
import com.supportsignal.session.exception.ImpersonationForbiddenException;
import com.supportsignal.session.exception.InvalidSessionRequestException;
import com.supportsignal.session.exception.SessionExpiredException;
import com.supportsignal.session.exception.SessionNotFoundException;
import com.supportsignal.session.repository.SessionRepository;
import com.supportsignal.session.repository.UserRepository;
import com.supportsignal.session.util.SessionAuditLogger;
import com.supportsignal.session.util.TokenGenerator;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Regular session lifecycle: create, validate, refresh, invalidate, list,
 * and workflow-state persistence.
 *
 * Lookups (validate, workflow recovery) report absence as data and never
 * throw for absent, expired or malformed tokens. Commands (refresh, list,
 * invalidate-others, workflow update) throw typed
 * {@link com.supportsignal.session.exception.SessionLifecycleException}s.
 * Invalidation is idempotent.
 *
 * The per-user cap is a soft limit: count, evict oldest, insert. Two
 * concurrent logins for the same user may both pass the count and overshoot
 * the cap until the next eviction.
 *
 * Every call mints its own correlation id, returned in the result and
 * written to the audit log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    static final String REASON_NOT_FOUND = "Session not found";
    static final String REASON_EXPIRED = "Session expired";
    static final String REASON_USER_NOT_FOUND = "User not found";
    static final String REASON_ALREADY_INVALID = "Session not found (already invalid)";
    static final String DEFAULT_LOGOUT_REASON = "User logout";

    static final String LAST_ACTIVITY_KEY = "lastActivity";

    private static final int MAX_TOKEN_ATTEMPTS = 5;

    private final SessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final TokenGenerator tokenGenerator;
    private final SessionAuditLogger auditLogger;
    private final SessionPolicyProperties properties;
    private final Clock clock;

    public CreateSessionResult createSession(Long userId, boolean rememberMe) {
        return createSession(userId, rememberMe, null, null, null);
    }

    /**
     * Creates a session for an existing user.
     *
     * When the user already holds the maximum number of live sessions, the
     * oldest ones are deleted first so the new login always succeeds.
     *
     * @param userId owning user
     * @param rememberMe selects the long lifetime
     * @param deviceInfo optional client details
     * @param workflowType optional workflow to seed the snapshot with
     * @param workflowData data for {@code workflowType}
     * @return token, expiry, id and correlation id
     * @throws SessionNotFoundException if the user does not exist
     */
    @Transactional
    @WithSpan("session.create")
    public CreateSessionResult createSession(
            Long userId,
            boolean rememberMe,
            DeviceInfo deviceInfo,
            WorkflowType workflowType,
            Map<String, Object> workflowData) {

        String correlationId = tokenGenerator.newCorrelationId();
        Span.current().setAttribute("session.correlation_id", correlationId);

        User user = userRepository.findById(userId)
            .orElseThrow(() -> new SessionNotFoundException(REASON_USER_NOT_FOUND));

        Instant now = clock.instant();
        evictOldestSessions(user.getId(), now, correlationId);

        Map<String, Object> workflowState = new HashMap<>();
        if (workflowType != null) {
            workflowState.put(workflowType.key(), stampActivity(Map.of(), workflowData, now));
        }

        Session session = Session.builder()
            .userId(user.getId())
            .sessionToken(uniqueSessionToken())
            .expiresAt(now.plus(properties.ttlFor(rememberMe)))
            .rememberMe(rememberMe)
            .createdAt(now)
            .deviceInfo(deviceInfo)
            .workflowState(workflowState)
            .build();

        session = sessionRepository.save(session);

        auditLogger.event("session_created", correlationId)
            .with("userId", user.getId())
            .with("sessionId", session.getId())
            .with("token", TokenGenerator.mask(session.getSessionToken()))
            .with("rememberMe", rememberMe)
            .with("deviceType", deviceInfo != null ? deviceInfo.getDeviceType() : null)
            .success();

        return new CreateSessionResult(
            session.getSessionToken(),
            session.getExpiresAt().toEpochMilli(),
            session.getId(),
            correlationId
        );
    }

    /**
     * Validates a token.
     *
     * A session found inside the refresh threshold is flagged with
     * shouldRefresh and, when auto-refresh is enabled, extended in place.
     *
     * @param token raw token, possibly malformed
     * @param includeWorkflowState whether to return the workflow snapshot
     * @return validation result, never null
     */
    @Transactional
    @WithSpan("session.validate")
    public ValidationResult validateSession(String token, boolean includeWorkflowState) {
        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        Optional<Session> found = sessionRepository.findBySessionToken(TokenGenerator.normalize(token));
        if (found.isEmpty()) {
            return ValidationResult.invalid(REASON_NOT_FOUND, correlationId);
        }

        Session session = found.get();
        if (session.isExpiredAt(now)) {
            return ValidationResult.invalid(REASON_EXPIRED, correlationId);
        }

        Optional<User> user = userRepository.findById(session.getUserId());
        if (user.isEmpty()) {
            return ValidationResult.invalid(REASON_USER_NOT_FOUND, correlationId);
        }

        boolean shouldRefresh = session.timeRemaining(now).compareTo(properties.getRefreshThreshold()) < 0;
        boolean refreshed = false;
        Instant expiresAt = session.getExpiresAt();
        SessionInfo sessionInfo = SessionInfo.from(session, now);
        Map<String, Object> workflowState = includeWorkflowState ? copyOf(session.getWorkflowState()) : null;

        if (shouldRefresh && properties.isAutoRefreshOnValidate()) {
            expiresAt = extend(session, now);
            refreshed = true;
            sessionInfo = sessionInfo.withExpires(expiresAt, now);

            auditLogger.event("session_refreshed", correlationId)
                .with("sessionId", session.getId())
                .with("trigger", "validate")
                .with("expires", expiresAt)
                .success();
        }

        auditLogger.event("session_validated", correlationId)
            .with("sessionId", session.getId())
            .with("userId", session.getUserId())
            .with("shouldRefresh", shouldRefresh)
            .success();

        return new ValidationResult(
            true,
            UserInfo.from(user.get()),
            sessionInfo,
            workflowState,
            null,
            shouldRefresh && !refreshed,
            refreshed,
            correlationId
        );
    }

    /**
     * Refreshes a live session.
     *
     * The new expiry is computed from the session's own remember-me flag.
     * Expiry never moves backward: if a concurrent refresh already stored a
     * later value, that value is returned.
     *
     * @param token session token
     * @param extendExpiry extend even when outside the refresh threshold
     * @return resulting expiry
     * @throws SessionNotFoundException if the token is unknown
     * @throws SessionExpiredException if the session is expired
     */
    @Transactional
    @WithSpan("session.refresh")
    public RefreshResult refreshSession(String token, boolean extendExpiry) {
        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        Session session = requireLiveSession(token, now);

        boolean withinThreshold = session.timeRemaining(now).compareTo(properties.getRefreshThreshold()) < 0;
        if (!extendExpiry && !withinThreshold) {
            return new RefreshResult(true, session.getExpiresAt().toEpochMilli(), false, correlationId);
        }

        Instant expiresAt = extend(session, now);

        auditLogger.event("session_refreshed", correlationId)
            .with("sessionId", session.getId())
            .with("trigger", extendExpiry ? "explicit" : "threshold")
            .with("expires", expiresAt)
            .success();

        return new RefreshResult(true, expiresAt.toEpochMilli(), true, correlationId);
    }

    /**
     * Deletes a session. Idempotent: an unknown token is reported as success.
     *
     * @param token session token
     * @param reason optional reason for the audit log
     * @return always successful unless the store fails
     */
    @Transactional
    @WithSpan("session.invalidate")
    public InvalidateResult invalidateSession(String token, String reason) {
        String correlationId = tokenGenerator.newCorrelationId();

        Optional<Session> found = sessionRepository.findBySessionToken(TokenGenerator.normalize(token));
        if (found.isEmpty()) {
            log.debug("Invalidate requested for unknown token {}", TokenGenerator.mask(token));
            return new InvalidateResult(true, REASON_ALREADY_INVALID, correlationId);
        }

        Session session = found.get();
        sessionRepository.delete(session);

        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_LOGOUT_REASON : reason;
        auditLogger.event("session_invalidated", correlationId)
            .with("sessionId", session.getId())
            .with("userId", session.getUserId())
            .with("reason", effectiveReason)
            .success();

        return new InvalidateResult(true, effectiveReason, correlationId);
    }

    /**
     * Lists live sessions of the requestor, or of another user the requestor
     * may oversee.
     *
     * @param requestorToken the caller's regular session token
     * @param targetUserId user to list, null for the requestor
     * @return live sessions, oldest first
     * @throws ImpersonationForbiddenException if the requestor may not view the target
     */
    @Transactional(readOnly = true)
    @WithSpan("session.list_active")
    public ActiveSessionsResult getUserActiveSessions(String requestorToken, Long targetUserId) {
        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        Session requestorSession = requireLiveSession(requestorToken, now);
        User requestor = userRepository.findById(requestorSession.getUserId())
            .orElseThrow(() -> new SessionNotFoundException("Requestor not found"));

        Long effectiveTarget = targetUserId != null ? targetUserId : requestor.getId();

        if (!effectiveTarget.equals(requestor.getId())) {
            User target = userRepository.findById(effectiveTarget)
                .orElseThrow(() -> new SessionNotFoundException(REASON_USER_NOT_FOUND));

            if (!mayViewSessionsOf(requestor, target)) {
                log.warn("User {} ({}) denied listing sessions of user {}",
                    requestor.getId(), requestor.getRole(), target.getId());
                throw new ImpersonationForbiddenException("Insufficient permissions to view other user sessions");
            }
        }

        List<ActiveSessionInfo> sessions = sessionRepository.findActiveSessionsByUserId(effectiveTarget, now)
            .stream()
            .map(s -> ActiveSessionInfo.from(s, requestorSession.getId()))
            .toList();

        return new ActiveSessionsResult(sessions, sessions.size(), correlationId);
    }

    /**
     * Logs the owner out everywhere except the session identified by token.
     *
     * @param token the session to keep
     * @return number of other sessions deleted
     */
    @Transactional
    @WithSpan("session.invalidate_others")
    public InvalidateOthersResult invalidateAllOtherSessions(String token) {
        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        Session keep = requireLiveSession(token, now);
        int deleted = sessionRepository.deleteOtherActiveSessions(keep.getUserId(), keep.getId(), now);

        auditLogger.event("all_other_sessions_invalidated", correlationId)
            .with("userId", keep.getUserId())
            .with("keptSessionId", keep.getId())
            .with("invalidatedCount", deleted)
            .success();

        return new InvalidateOthersResult(true, deleted, correlationId);
    }

    /**
     * Merges workflow data into the session snapshot under the workflow's key
     * and stamps lastActivity.
     *
     * @param token session token
     * @param workflowType workflow being saved
     * @param workflowData fields to merge
     * @return stored activity timestamp
     */
    @Transactional
    @WithSpan("session.workflow.update")
    public WorkflowUpdateResult updateWorkflowState(String token, WorkflowType workflowType, Map<String, Object> workflowData) {
        if (workflowType == null) {
            throw new InvalidSessionRequestException("workflowType is required");
        }

        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        Session session = requireLiveSession(token, now);
        if (!userRepository.existsById(session.getUserId())) {
            throw new SessionNotFoundException(REASON_USER_NOT_FOUND);
        }

        Map<String, Object> state = copyOf(session.getWorkflowState());
        Object existing = state.get(workflowType.key());
        Map<String, Object> previous = existing instanceof Map<?, ?> map ? stringKeyed(map) : Map.of();

        state.put(workflowType.key(), stampActivity(previous, workflowData, now));
        session.setWorkflowState(state);
        sessionRepository.save(session);

        auditLogger.event("workflow_state_updated", correlationId)
            .with("sessionId", session.getId())
            .with("workflowType", workflowType.key())
            .with("fields", workflowData != null ? workflowData.keySet() : null)
            .success();

        return new WorkflowUpdateResult(true, workflowType.key(), now.toEpochMilli(), correlationId);
    }

    /**
     * Returns the workflow snapshot of a live session, optionally narrowed to
     * one workflow. Empty for any invalid token.
     *
     * @param token session token, possibly malformed
     * @param workflowType optional filter
     * @return recovered snapshot
     */
    @Transactional(readOnly = true)
    @WithSpan("session.workflow.recover")
    public WorkflowRecoveryResult recoverWorkflowState(String token, WorkflowType workflowType) {
        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        Optional<Session> session = sessionRepository.findActiveBySessionToken(TokenGenerator.normalize(token), now);
        if (session.isEmpty()) {
            return new WorkflowRecoveryResult(false, Map.of(), correlationId);
        }

        Map<String, Object> state = copyOf(session.get().getWorkflowState());
        if (workflowType != null) {
            Object entry = state.get(workflowType.key());
            state = entry == null ? Map.of() : Map.of(workflowType.key(), entry);
        }

        return new WorkflowRecoveryResult(!state.isEmpty(), state, correlationId);
    }

    static boolean mayViewSessionsOf(User requestor, User target) {
        UserRole role = requestor.getRole();
        if (!role.canViewOtherUsersSessions()) {
            return false;
        }
        return role.isSystemAdmin() || requestor.belongsToSameCompanyAs(target);
    }

    private Session requireLiveSession(String token, Instant now) {
        Session session = sessionRepository.findBySessionToken(TokenGenerator.normalize(token))
            .orElseThrow(() -> new SessionNotFoundException(REASON_NOT_FOUND));

        if (session.isExpiredAt(now)) {
            throw new SessionExpiredException(REASON_EXPIRED);
        }
        return session;
    }

    private void evictOldestSessions(Long userId, Instant now, String correlationId) {
        List<Session> active = sessionRepository.findActiveSessionsByUserId(userId, now);
        int limit = properties.getMaxSessionsPerUser();

        if (active.size() < limit) {
            return;
        }

        List<Session> toEvict = active.subList(0, active.size() - limit + 1);
        sessionRepository.deleteAll(toEvict);

        for (Session evicted : toEvict) {
            auditLogger.event("session_evicted", correlationId)
                .with("userId", userId)
                .with("sessionId", evicted.getId())
                .with("limit", limit)
                .success();
        }
        log.info("Evicted {} oldest session(s) for user {} (limit {})", toEvict.size(), userId, limit);
    }

    private Instant extend(Session session, Instant now) {
        Instant proposed = now.plus(properties.ttlFor(session.isRememberMe()));
        int updated = sessionRepository.extendExpiry(session.getId(), proposed, now);

        if (updated == 1) {
            return proposed;
        }
        // a concurrent refresh stored a later expiry
        return sessionRepository.findById(session.getId())
            .map(Session::getExpiresAt)
            .orElse(proposed);
    }

    private String uniqueSessionToken() {
        for (int attempt = 0; attempt < MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = tokenGenerator.newSessionToken();
            if (!sessionRepository.existsBySessionToken(token)) {
                return token;
            }
            log.warn("Session token collision, regenerating (attempt {})", attempt + 1);
        }
        throw new IllegalStateException("Could not generate a unique session token");
    }

    private static Map<String, Object> stampActivity(Map<String, Object> previous, Map<String, Object> data, Instant now) {
        Map<String, Object> merged = new LinkedHashMap<>(previous);
        if (data != null) {
            merged.putAll(data);
        }
        merged.put(LAST_ACTIVITY_KEY, now.toEpochMilli());
        return merged;
    }

    private static Map<String, Object> copyOf(Map<String, Object> state) {
        return state == null ? new HashMap<>() : new HashMap<>(state);
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    // =========================================================================
    // Result Records
    // =========================================================================

    public record CreateSessionResult(
        String sessionToken,
        long expires,
        Long sessionId,
        String correlationId
    ) {}

    public record ValidationResult(
        boolean valid,
        UserInfo user,
        SessionInfo session,
        Map<String, Object> workflowState,
        String reason,
        boolean shouldRefresh,
        boolean refreshed,
        String correlationId
    ) {
        static ValidationResult invalid(String reason, String correlationId) {
            return new ValidationResult(false, null, null, null, reason, false, false, correlationId);
        }
    }

    public record RefreshResult(
        boolean success,
        long expires,
        boolean extended,
        String correlationId
    ) {}

    public record InvalidateResult(
        boolean success,
        String reason,
        String correlationId
    ) {}

    public record InvalidateOthersResult(
        boolean success,
        int invalidatedCount,
        String correlationId
    ) {}

    public record ActiveSessionsResult(
        List<ActiveSessionInfo> sessions,
        int totalActiveSessions,
        String correlationId
    ) {}

    public record WorkflowUpdateResult(
        boolean success,
        String workflowType,
        long lastActivity,
        String correlationId
    ) {}

    public record WorkflowRecoveryResult(
        boolean found,
        Map<String, Object> workflowState,
        String correlationId
    ) {}

    /**
     * Public view of a user, safe to return to clients.
     */
    public record UserInfo(
        Long id,
        String name,
        String email,
        String role,
        Long companyId
    ) {
        public static UserInfo from(User user) {
            return new UserInfo(user.getId(), user.getName(), user.getEmail(),
                user.getRole().name(), user.getCompanyId());
        }
    }

    /**
     * Session details without the token.
     */
    public record SessionInfo(
        Long sessionId,
        Long userId,
        long created,
        long expires,
        boolean rememberMe,
        long timeRemaining
    ) {
        static SessionInfo from(Session session, Instant now) {
            return new SessionInfo(
                session.getId(),
                session.getUserId(),
                session.getCreatedAt().toEpochMilli(),
                session.getExpiresAt().toEpochMilli(),
                session.isRememberMe(),
                session.timeRemaining(now).toMillis()
            );
        }

        SessionInfo withExpires(Instant expiresAt, Instant now) {
            Duration remaining = Duration.between(now, expiresAt);
            return new SessionInfo(sessionId, userId, created, expiresAt.toEpochMilli(), rememberMe,
                remaining.isNegative() ? 0L : remaining.toMillis());
        }
    }

    public record ActiveSessionInfo(
        Long sessionId,
        long created,
        long expires,
        Long lastRefreshed,
        boolean rememberMe,
        String userAgent,
        String ipAddress,
        String deviceType,
        boolean isCurrentSession
    ) {
        static ActiveSessionInfo from(Session session, Long currentSessionId) {
            DeviceInfo device = session.getDeviceInfo();
            return new ActiveSessionInfo(
                session.getId(),
                session.getCreatedAt().toEpochMilli(),
                session.getExpiresAt().toEpochMilli(),
                session.getLastRefreshedAt() != null ? session.getLastRefreshedAt().toEpochMilli() : null,
                session.isRememberMe(),
                device != null ? device.getUserAgent() : null,
                device != null ? device.getIpAddress() : null,
                device != null ? device.getDeviceType() : null,
                session.getId().equals(currentSessionId)
            );
        }
    }
}
