package com.supportsignal.session.domain;

/**
 * How an impersonation session reached its terminal state.
 */
public enum TerminationType {
    /** Ended by the admin. */
    MANUAL,
    /** Marked inactive by the expiry sweep. */
    TIMEOUT,
    /** Killed by the break-glass termination. */
    EMERGENCY
}
