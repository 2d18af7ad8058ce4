package com.supportsignal.session.exception;

/**
 * Session, user or impersonation record absent.
 */
public class SessionNotFoundException extends SessionLifecycleException {

    public SessionNotFoundException(String message) {
        super(SessionErrorType.NOT_FOUND, message);
    }
}
