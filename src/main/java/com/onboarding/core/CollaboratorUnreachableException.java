package com.onboarding.core;

/**
 * A collaborator (protocol store, assignment checker, worker) could not be
 * reached or did not answer. Carries the trace id of the calling mission.
 */
public class CollaboratorUnreachableException extends RuntimeException {

    private final String traceId;

    public CollaboratorUnreachableException(String message, String traceId) {
        super(message);
        this.traceId = traceId;
    }

    public CollaboratorUnreachableException(String message, String traceId, Throwable cause) {
        super(message, cause);
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }
}
