package com.supportsignal.session.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

/**
 * Registers the session policy and the clock every component reads "now" from.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SessionPolicyProperties.class)
public class SessionPolicyConfig {

    /**
     * System UTC clock. Tests replace it to move time without sleeping.
     *
     * @param properties bound policy, logged once at startup
     * @return UTC clock
     */
    @Bean
    public Clock clock(SessionPolicyProperties properties) {
        log.info("Session policy: regularTtl={}, rememberMeTtl={}, refreshThreshold={}, maxSessionsPerUser={}, "
                + "impersonationTtl={}, maxImpersonationsPerAdmin={}",
            properties.getRegularTtl(),
            properties.getRememberMeTtl(),
            properties.getRefreshThreshold(),
            properties.getMaxSessionsPerUser(),
            properties.getImpersonation().getTtl(),
            properties.getImpersonation().getMaxConcurrentPerAdmin());

        return Clock.systemUTC();
    }
}
