package com.onboarding.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during mission execution, used for SSE streaming.
 *
 * @param eventType event type (e.g. "mission.created", "step.completed")
 * @param missionId the mission this event belongs to
 * @param traceId   correlation id of the mission
 * @param stepIndex the step this event relates to (null for mission-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record OnboardingEvent(
    String eventType,
    String missionId,
    String traceId,
    Integer stepIndex,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String MISSION_CREATED = "mission.created";
    public static final String MODE_CHANGED = "mission.mode_changed";
    public static final String PROTOCOL_CREATED = "protocol.created";
    public static final String PROTOCOL_RACE_RECOVERED = "protocol.race_recovered";
    public static final String ASSIGNMENT_CHECKED = "assignment.checked";
    public static final String STEP_COMPLETED = "step.completed";
    public static final String MISSION_COMPLETED = "mission.completed";
    public static final String MISSION_FAILED = "mission.failed";

    public static OnboardingEvent of(String eventType, String missionId, String traceId,
                                     Map<String, Object> payload) {
        return new OnboardingEvent(eventType, missionId, traceId, null, payload, Instant.now());
    }

    public static OnboardingEvent ofStep(String eventType, String missionId, String traceId,
                                         int stepIndex, Map<String, Object> payload) {
        return new OnboardingEvent(eventType, missionId, traceId, stepIndex, payload, Instant.now());
    }
}
