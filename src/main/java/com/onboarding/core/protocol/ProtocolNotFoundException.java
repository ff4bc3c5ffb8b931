package com.onboarding.core.protocol;

public class ProtocolNotFoundException extends RuntimeException {

    private final String projectId;

    public ProtocolNotFoundException(String projectId) {
        super("No protocol found for project " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
