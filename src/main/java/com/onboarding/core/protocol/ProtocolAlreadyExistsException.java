package com.onboarding.core.protocol;

/**
 * A protocol already exists for the project; raised to the loser of a concurrent creation.
 */
public class ProtocolAlreadyExistsException extends RuntimeException {

    private final String projectId;

    public ProtocolAlreadyExistsException(String projectId) {
        super("Protocol already exists for project " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
