package com.supportsignal.session.security;

import com.supportsignal.session.domain.UserRole;

/**
 * Effective identity of the current request, installed by
 * {@link SessionTokenAuthenticationFilter}.
 *
 * While impersonating, userId/email/role describe the target user and
 * impersonatorId names the admin behind the overlay.
 */
public record SessionPrincipal(
    Long userId,
    String email,
    UserRole role,
    Long impersonatorId,
    String impersonationCorrelationId
) {

    public boolean isImpersonating() {
        return impersonatorId != null;
    }
}
