package com.supportsignal.session.exception;

/**
 * Caller lacks the privilege for an admin-only operation.
 */
public class ImpersonationForbiddenException extends SessionLifecycleException {

    public ImpersonationForbiddenException(String message) {
        super(SessionErrorType.FORBIDDEN, message);
    }
}
