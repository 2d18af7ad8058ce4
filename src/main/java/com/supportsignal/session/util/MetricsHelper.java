package com.supportsignal.session.util;

import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

/**
 * Helper for session subsystem metrics.
 *
 * Metrics exposed via Prometheus at /actuator/prometheus:
 * - session.lifecycle.events (counter): lifecycle events by event and outcome
 * - session.resolver.lookups (counter): token resolutions by result
 * - session.resolver.duration (timer): token resolution latency
 * - session.cleanup.removed (counter): rows removed or deactivated by sweeps
 *
 * Tags are low-cardinality by construction: never user ids, tokens or
 * correlation ids.
 *
 * @see com.supportsignal.session.config.ObservabilityConfig
 */
@Component
@RequiredArgsConstructor
public class MetricsHelper {

    private final MeterRegistry meterRegistry;

    private static final String LIFECYCLE_PREFIX = "session.lifecycle";
    private static final String RESOLVER_PREFIX = "session.resolver";

    /**
     * Records a lifecycle event.
     *
     * @param event audit event name (session_created, impersonation_start, ...)
     * @param success whether the operation succeeded
     */
    public void recordLifecycleEvent(String event, boolean success) {
        Counter.builder(LIFECYCLE_PREFIX + ".events")
            .tag("event", event)
            .tag("outcome", success ? "success" : "failure")
            .description("Session and impersonation lifecycle events")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Records one token resolution.
     *
     * @param result impersonation, session or unauthenticated
     * @param durationNanos time spent in both store lookups
     */
    public void recordResolution(String result, long durationNanos) {
        Counter.builder(RESOLVER_PREFIX + ".lookups")
            .tag("result", result)
            .description("Token resolutions by outcome")
            .register(meterRegistry)
            .increment();

        Timer.builder(RESOLVER_PREFIX + ".duration")
            .description("Token resolution latency")
            .register(meterRegistry)
            .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records rows touched by a periodic sweep.
     *
     * @param sweep sessions or impersonations
     * @param count rows deleted or deactivated
     */
    public void recordCleanup(String sweep, int count) {
        Counter.builder("session.cleanup.removed")
            .tag("sweep", sweep)
            .description("Rows removed or deactivated by expiry sweeps")
            .register(meterRegistry)
            .increment(count);
    }
}
