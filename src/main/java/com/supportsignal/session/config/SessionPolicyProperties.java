package com.supportsignal.session.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import lombok.Getter;
import lombok.Setter;

/**
 * Session and impersonation policy values, bound from application.yml
 * under the {@code session} prefix.
 *
 * The limits are product policy: the per-user cap, the per-admin cap and the
 * fixed overlay TTL are what matter, the numbers are tunable.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionPolicyProperties {

    /**
     * Lifetime of a regular session.
     */
    @NotNull
    private Duration regularTtl = Duration.ofHours(24);

    /**
     * Lifetime of a remember-me session.
     */
    @NotNull
    private Duration rememberMeTtl = Duration.ofDays(30);

    /**
     * Sessions closer than this to expiry are flagged (and optionally extended) on validation.
     */
    @NotNull
    private Duration refreshThreshold = Duration.ofHours(2);

    @Min(1)
    private int maxSessionsPerUser = 5;

    /**
     * Extend sessions found inside the refresh threshold during validation.
     */
    private boolean autoRefreshOnValidate = true;

    @Valid
    private Impersonation impersonation = new Impersonation();

    @Valid
    private Cleanup cleanup = new Cleanup();

    public Duration ttlFor(boolean rememberMe) {
        return rememberMe ? rememberMeTtl : regularTtl;
    }

    @Getter
    @Setter
    public static class Impersonation {

        /**
         * Fixed overlay lifetime, never extended.
         */
        @NotNull
        private Duration ttl = Duration.ofMinutes(30);

        @Min(1)
        private int maxConcurrentPerAdmin = 3;

        /**
         * Reserved prefix that marks impersonation tokens.
         */
        @NotBlank
        private String tokenPrefix = "imp_";

        /**
         * Platform owner account, the only admin allowed to impersonate other system admins.
         */
        private String ownerEmail;

        @Min(1)
        @Max(100)
        private int searchLimit = 20;
    }

    @Getter
    @Setter
    public static class Cleanup {

        private boolean enabled = true;

        @Min(1000)
        private long intervalMs = 300_000L;
    }
}
