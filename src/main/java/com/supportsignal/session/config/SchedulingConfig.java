package com.supportsignal.session.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic expiry sweeps.
 *
 * Disabled with session.cleanup.enabled=false (tests drive the sweeps directly).
 *
 * @see com.supportsignal.session.service.ScheduledCleanupService
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "session.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
