package com.onboarding.core.protocol;

/**
 * A protocol definition was rejected before being stored.
 */
public class InvalidProtocolException extends IllegalArgumentException {

    private final String projectId;

    public InvalidProtocolException(String projectId, String message) {
        super("Invalid protocol for project " + projectId + ": " + message);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
