package com.supportsignal.session.config;

import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Observability configuration.
 *
 * Key metrics exposed at /actuator/prometheus:
 * - session.lifecycle.events: lifecycle and impersonation events by outcome
 * - session.resolver.lookups / session.resolver.duration: token resolution
 * - session.store.pool.*: connection pool pressure
 * - HTTP server request metrics
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ObservabilityConfig {

    private final Environment environment;

    /**
     * Adds application and environment tags to every meter.
     *
     * @return MeterRegistry customizer
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        String appName = environment.getProperty("spring.application.name", "session-lifecycle");
        String env = environment.getProperty("ENVIRONMENT", "dev");

        log.info("Configuring metrics with tags: application={}, environment={}", appName, env);

        return registry -> registry.config()
            .commonTags(
                "application", appName,
                "environment", env
            )
            .meterFilter(MeterFilter.maximumAllowableMetrics(10000));
    }

    /**
     * Enables @Timed annotation support on controllers.
     *
     * @param registry MeterRegistry for metric recording
     * @return TimedAspect for AOP-based timing
     */
    @Bean
    public TimedAspect timedAspect(MeterRegistry registry) {
        return new TimedAspect(registry);
    }

    /**
     * Caps the number of distinct URI tags on http.server.requests.
     *
     * @return MeterFilter for cardinality control
     */
    @Bean
    public MeterFilter uriCardinalityFilter() {
        return MeterFilter.maximumAllowableTags(
            "http.server.requests",
            "uri",
            100,
            MeterFilter.deny()
        );
    }
}
