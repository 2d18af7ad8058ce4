package com.supportsignal.session.exception;

/**
 * Malformed or incomplete command arguments.
 */
public class InvalidSessionRequestException extends SessionLifecycleException {

    public InvalidSessionRequestException(String message) {
        super(SessionErrorType.INVALID_REQUEST, message);
    }
}
