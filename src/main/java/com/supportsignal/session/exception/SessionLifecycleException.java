package com.supportsignal.session.exception;

/**
 * Base class for command failures in the session subsystem.
 *
 * Lookups never throw these; they report absence as data.
 */
public abstract class SessionLifecycleException extends RuntimeException {

    private final SessionErrorType errorType;

    protected SessionLifecycleException(SessionErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public SessionErrorType getErrorType() {
        return errorType;
    }
}
