package com.supportsignal.session.exception;

/**
 * A per-user or per-admin cap would be exceeded.
 */
public class SessionLimitExceededException extends SessionLifecycleException {

    public SessionLimitExceededException(String message) {
        super(SessionErrorType.LIMIT_EXCEEDED, message);
    }
}
