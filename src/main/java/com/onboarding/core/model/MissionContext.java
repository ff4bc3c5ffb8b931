package com.onboarding.core.model;

import java.io.Serializable;
import java.util.UUID;

/**
 * Correlation data carried on every collaborator call made for a mission.
 */
public record MissionContext(
    String missionId,
    String traceId,
    String employeeId,
    String projectId
) implements Serializable {

    /**
     * Context for calls made outside a mission, such as seeding or an operator
     * replacing a protocol. Gets a fresh trace id so the call is still correlatable.
     */
    public static MissionContext administrative(String actor, String projectId) {
        return new MissionContext(null, UUID.randomUUID().toString(), actor, projectId);
    }
}
