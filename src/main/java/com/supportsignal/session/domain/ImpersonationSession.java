package com.supportsignal.session.domain;

import java.time.Duration;
import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Bounded admin-as-user overlay on top of the admin's regular session.
 *
 * Invariants:
 * - expiresAt is fixed at creation and never extended
 * - active goes true to false exactly once (end, timeout or emergency) and never back
 * - rows are kept after termination for the audit trail
 *
 * The admin's own session token is kept in originalSessionToken so the caller
 * can restore the admin context when the overlay ends.
 *
 * @see com.supportsignal.session.repository.ImpersonationSessionRepository
 */
@Entity
@Table(name = "impersonation_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"sessionToken", "originalSessionToken"})
public class ImpersonationSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, name = "admin_user_id")
    private Long adminUserId;

    @Column(nullable = false, name = "target_user_id")
    private Long targetUserId;

    /**
     * Overlay token, carries the reserved impersonation prefix.
     */
    @Column(nullable = false, unique = true, name = "session_token", length = 128)
    private String sessionToken;

    @Column(nullable = false, name = "original_session_token", length = 128)
    private String originalSessionToken;

    @Column(nullable = false, columnDefinition = "text")
    private String reason;

    @Column(nullable = false, updatable = false, name = "expires_at")
    private Instant expiresAt;

    @Column(nullable = false, name = "is_active")
    private boolean active;

    @Column(nullable = false, updatable = false, name = "created_at")
    private Instant createdAt;

    @Column(name = "terminated_at")
    private Instant terminatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "termination_type", length = 16)
    private TerminationType terminationType;

    @Column(nullable = false, updatable = false, name = "correlation_id", length = 64)
    private String correlationId;

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public Duration timeRemaining(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
