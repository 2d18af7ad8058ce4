package com.supportsignal.session.exception;

/**
 * Failure classes surfaced by session and impersonation commands.
 */
public enum SessionErrorType {
    NOT_FOUND("NotFound"),
    EXPIRED("Expired"),
    LIMIT_EXCEEDED("LimitExceeded"),
    FORBIDDEN("Forbidden"),
    INVALID_REQUEST("InvalidRequest");

    private final String label;

    SessionErrorType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
