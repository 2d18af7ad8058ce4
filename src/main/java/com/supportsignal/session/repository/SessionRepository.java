package com.supportsignal.session.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.supportsignal.session.domain.Session;

/**
 * Repository for regular sessions.
 *
 * Bulk writes are expressed as single conditional statements so they stay
 * correct under concurrent traffic without application-level locks:
 * - cleanup deletes rows still matching expires_at <= now at statement time
 * - expiry extension never moves expires_at backward
 *
 * Indexes used:
 * - uk_sessions_session_token: lookup by token
 * - idx_sessions_user_expires: per-user active sessions
 * - idx_sessions_expires_at: cleanup sweep
 */
@Repository
public interface SessionRepository extends JpaRepository<Session, Long> {

    /**
     * Find session by token, expired or not.
     *
     * @param sessionToken the opaque token
     * @return Optional containing the session if found
     */
    Optional<Session> findBySessionToken(String sessionToken);

    boolean existsBySessionToken(String sessionToken);

    /**
     * Find a session by token only if it is unexpired at the given instant.
     *
     * @param sessionToken the opaque token
     * @param now current timestamp
     * @return Optional containing the live session
     */
    @Query("SELECT s FROM Session s WHERE s.sessionToken = :token AND s.expiresAt > :now")
    Optional<Session> findActiveBySessionToken(@Param("token") String sessionToken, @Param("now") Instant now);

    /**
     * Active sessions for a user, oldest first (eviction order).
     *
     * @param userId the user ID
     * @param now current timestamp
     * @return list of active sessions ordered by creation
     */
    @Query("SELECT s FROM Session s WHERE s.userId = :userId AND s.expiresAt > :now "
         + "ORDER BY s.createdAt ASC, s.id ASC")
    List<Session> findActiveSessionsByUserId(@Param("userId") Long userId, @Param("now") Instant now);

    /**
     * Pushes expiry forward. Does nothing if a concurrent refresh already
     * stored a later value.
     *
     * @param id session id
     * @param newExpiresAt proposed expiry
     * @param now refresh timestamp
     * @return 1 if the row was extended, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Session s SET s.expiresAt = :newExpiresAt, s.lastRefreshedAt = :now "
         + "WHERE s.id = :id AND s.expiresAt < :newExpiresAt")
    int extendExpiry(@Param("id") Long id, @Param("newExpiresAt") Instant newExpiresAt, @Param("now") Instant now);

    /**
     * Deletes every other live session of the user ("log out everywhere else").
     *
     * @param userId owning user
     * @param keepId session to keep
     * @param now current timestamp
     * @return number of sessions deleted
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Session s WHERE s.userId = :userId AND s.id <> :keepId AND s.expiresAt > :now")
    int deleteOtherActiveSessions(@Param("userId") Long userId, @Param("keepId") Long keepId, @Param("now") Instant now);

    /**
     * Delete expired sessions in batch.
     *
     * Uses index: idx_sessions_expires_at
     *
     * @param now current timestamp
     * @return number of sessions deleted
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Session s WHERE s.expiresAt <= :now")
    int deleteExpiredSessions(@Param("now") Instant now);
}
