package com.supportsignal.session.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.supportsignal.session.domain.User;

/**
 * Read-only view of the identity subsystem's users.
 *
 * Not cached: a deleted user must stop resolving on the very next request.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find user by email.
     *
     * Uses unique index: uk_users_email
     *
     * @param email the email to search for
     * @return Optional containing the user if found
     */
    Optional<User> findByEmail(String email);
}
