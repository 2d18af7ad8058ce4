package com.supportsignal.session.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-delay trigger for the expiry sweeps.
 *
 * Each sweep runs in its own transaction on {@link SessionCleanupService}.
 *
 * Scheduling is enabled by {@link com.supportsignal.session.config.SchedulingConfig}
 * and can be switched off with session.cleanup.enabled=false.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledCleanupService {

    private final SessionCleanupService sessionCleanupService;

    @Scheduled(
        fixedDelayString = "${session.cleanup.interval-ms:300000}",
        initialDelayString = "${session.cleanup.interval-ms:300000}"
    )
    public void runScheduledCleanup() {
        int sessionsDeleted = sessionCleanupService.cleanupExpiredSessions().cleanedCount();
        int overlaysExpired = sessionCleanupService.expireImpersonationSessions();

        log.info("Scheduled cleanup finished: sessionsDeleted={}, impersonationsExpired={}",
            sessionsDeleted, overlaysExpired);
    }
}
