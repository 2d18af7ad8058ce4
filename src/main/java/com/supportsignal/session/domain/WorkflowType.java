package com.supportsignal.session.domain;

/**
 * Multi-step workflows whose progress can be parked on a session and
 * recovered after a reload or re-login.
 */
public enum WorkflowType {
    INCIDENT_CAPTURE,
    INCIDENT_ANALYSIS,
    USER_REGISTRATION,
    CHAT_SESSION;

    /**
     * Key under which the workflow is stored in the session snapshot.
     */
    public String key() {
        return name().toLowerCase();
    }
}
