package com.supportsignal.session.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
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
 * One authenticated browser/client context.
 *
 * Lifecycle:
 * - Created on successful login
 * - Mutated only by refresh (extends expiresAt) or workflow-state updates
 * - Deleted on invalidation, eviction, or by the cleanup sweep once expired
 *
 * "Expired" is a passive state: a row with expiresAt <= now stays in the table
 * until the sweep deletes it, but every read treats it as invalid.
 *
 * Indexes used:
 * - uk_sessions_session_token: lookup by token
 * - idx_sessions_user_expires: per-user listing and limit enforcement
 * - idx_sessions_expires_at: cleanup sweep
 *
 * @see com.supportsignal.session.repository.SessionRepository
 */
@Entity
@Table(name = "sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"sessionToken", "workflowState"})
public class Session {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Owning user. Plain reference: users belong to the identity subsystem.
     */
    @Column(nullable = false, name = "user_id")
    private Long userId;

    /**
     * Opaque, globally unique session token.
     */
    @Column(nullable = false, unique = true, name = "session_token", length = 128)
    private String sessionToken;

    @Column(nullable = false, name = "expires_at")
    private Instant expiresAt;

    /**
     * Selects the long (remember-me) lifetime on creation and on every refresh.
     */
    @Column(nullable = false, name = "remember_me")
    private boolean rememberMe;

    @Column(nullable = false, updatable = false, name = "created_at")
    private Instant createdAt;

    @Column(name = "last_refreshed_at")
    private Instant lastRefreshedAt;

    @Embedded
    private DeviceInfo deviceInfo;

    /**
     * Workflow snapshot keyed by {@link WorkflowType#key()}.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "workflow_state", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> workflowState = new HashMap<>();

    /**
     * Checks if the session is expired at the given instant.
     *
     * @param now the reference time
     * @return true if expiresAt is at or before now
     */
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public Duration timeRemaining(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
