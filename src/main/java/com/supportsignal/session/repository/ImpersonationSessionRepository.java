package com.supportsignal.session.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.supportsignal.session.domain.ImpersonationSession;
import com.supportsignal.session.domain.TerminationType;

/**
 * Repository for impersonation overlay sessions.
 *
 * Rows are never deleted here. Every termination path is a conditional
 * UPDATE guarded by is_active = true, so the true to false transition
 * happens exactly once even when end, sweep and emergency race.
 *
 * Indexes used:
 * - uk_impersonation_session_token: lookup by token
 * - idx_impersonation_admin_active: per-admin concurrency limit
 * - idx_impersonation_active_expires: sweeps and emergency termination
 */
@Repository
public interface ImpersonationSessionRepository extends JpaRepository<ImpersonationSession, Long> {

    Optional<ImpersonationSession> findBySessionToken(String sessionToken);

    boolean existsBySessionToken(String sessionToken);

    /**
     * Find an active, unexpired overlay by token.
     *
     * @param sessionToken the impersonation token
     * @param now current timestamp
     * @return Optional containing the live overlay
     */
    @Query("SELECT i FROM ImpersonationSession i "
         + "WHERE i.sessionToken = :token AND i.active = true AND i.expiresAt > :now")
    Optional<ImpersonationSession> findLiveBySessionToken(@Param("token") String sessionToken, @Param("now") Instant now);

    @Query("SELECT COUNT(i) FROM ImpersonationSession i "
         + "WHERE i.adminUserId = :adminUserId AND i.active = true AND i.expiresAt > :now")
    long countLiveByAdminUserId(@Param("adminUserId") Long adminUserId, @Param("now") Instant now);

    @Query("SELECT i FROM ImpersonationSession i WHERE i.active = true AND i.expiresAt <= :now")
    List<ImpersonationSession> findActiveButExpired(@Param("now") Instant now);

    /**
     * Terminates a single overlay if it is still active.
     *
     * @return 1 if this call performed the transition, 0 if it was already inactive
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImpersonationSession i SET i.active = false, i.terminatedAt = :now, i.terminationType = :type "
         + "WHERE i.id = :id AND i.active = true")
    int terminate(@Param("id") Long id, @Param("type") TerminationType type, @Param("now") Instant now);

    /**
     * Terminates every active overlay system-wide.
     *
     * @return number of overlays terminated by this call
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ImpersonationSession i SET i.active = false, i.terminatedAt = :now, i.terminationType = :type "
         + "WHERE i.active = true")
    int terminateAllActive(@Param("type") TerminationType type, @Param("now") Instant now);
}
