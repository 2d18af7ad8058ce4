package com.supportsignal.session.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.supportsignal.session.domain.ImpersonationSession;
import com.supportsignal.session.domain.TerminationType;
import com.supportsignal.session.repository.ImpersonationSessionRepository;
import com.supportsignal.session.repository.SessionRepository;
import com.supportsignal.session.util.MetricsHelper;
import com.supportsignal.session.util.SessionAuditLogger;
import com.supportsignal.session.util.TokenGenerator;

import io.opentelemetry.instrumentation.annotations.WithSpan;
import lombok.RequiredArgsConstructor;

/**
 * Periodic expiry sweeps.
 *
 * Both sweeps are single conditional statements evaluated at execution time,
 * so they are safe against live traffic: a session refreshed just before the
 * sweep no longer matches and survives, and an overlay ended concurrently is
 * not terminated twice.
 *
 * The periodic run lives in {@link ScheduledCleanupService}, which calls
 * these methods through the transactional proxy.
 */
@Service
@RequiredArgsConstructor
public class SessionCleanupService {

    private final SessionRepository sessionRepository;
    private final ImpersonationSessionRepository impersonationSessionRepository;
    private final TokenGenerator tokenGenerator;
    private final SessionAuditLogger auditLogger;
    private final MetricsHelper metricsHelper;
    private final Clock clock;

    /**
     * Deletes every regular session with expires <= now.
     *
     * @return deleted count and sweep time
     */
    @Transactional
    @WithSpan("session.cleanup")
    public CleanupResult cleanupExpiredSessions() {
        String correlationId = tokenGenerator.newCorrelationId();
        Instant now = clock.instant();

        int deleted = sessionRepository.deleteExpiredSessions(now);
        metricsHelper.recordCleanup("sessions", deleted);

        auditLogger.event("sessions_cleaned", correlationId)
            .with("cleanedCount", deleted)
            .success();

        return new CleanupResult(deleted, now.toEpochMilli(), correlationId);
    }

    /**
     * Deactivates active overlays past their expiry, recording TIMEOUT.
     *
     * @return number of overlays deactivated by this sweep
     */
    @Transactional
    @WithSpan("impersonation.expire")
    public int expireImpersonationSessions() {
        Instant now = clock.instant();
        List<ImpersonationSession> expired = impersonationSessionRepository.findActiveButExpired(now);

        int count = 0;
        for (ImpersonationSession overlay : expired) {
            if (impersonationSessionRepository.terminate(overlay.getId(), TerminationType.TIMEOUT, now) == 0) {
                continue;
            }
            count++;

            auditLogger.event("impersonation_timeout", overlay.getCorrelationId())
                .with("impersonationId", overlay.getId())
                .with("adminUserId", overlay.getAdminUserId())
                .with("targetUserId", overlay.getTargetUserId())
                .with("terminationType", TerminationType.TIMEOUT)
                .success();
        }

        metricsHelper.recordCleanup("impersonations", count);
        return count;
    }

    public record CleanupResult(
        int cleanedCount,
        long timestamp,
        String correlationId
    ) {}
}
