package com.supportsignal.session.domain;

/**
 * Privilege levels known to the identity subsystem, highest first.
 */
public enum UserRole {
    SYSTEM_ADMIN,
    COMPANY_ADMIN,
    TEAM_LEAD,
    FRONTLINE_WORKER;

    public boolean isSystemAdmin() {
        return this == SYSTEM_ADMIN;
    }

    /**
     * Roles allowed to list another user's sessions.
     */
    public boolean canViewOtherUsersSessions() {
        return this == SYSTEM_ADMIN || this == COMPANY_ADMIN;
    }
}
