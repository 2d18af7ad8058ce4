package com.supportsignal.session.exception;

/**
 * The record exists but its expiry has passed.
 */
public class SessionExpiredException extends SessionLifecycleException {

    public SessionExpiredException(String message) {
        super(SessionErrorType.EXPIRED, message);
    }
}
