package com.onboarding.core.protocol;

/**
 * Another writer stored a new version of the protocol at the same time.
 */
public class ProtocolConflictException extends RuntimeException {

    private final String projectId;

    public ProtocolConflictException(String projectId, Throwable cause) {
        super("Protocol for " + projectId + " was replaced concurrently", cause);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
