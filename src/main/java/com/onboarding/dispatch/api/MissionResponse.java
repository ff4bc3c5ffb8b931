package com.onboarding.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.ModeChange;
import com.onboarding.core.model.StepResult;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for mission endpoints.
 */
public record MissionResponse(
    @JsonProperty("mission_id") String missionId,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("employee_id") String employeeId,
    @JsonProperty("project_id") String projectId,
    String mode,
    AssignmentResponse assignment,
    @JsonProperty("protocol_version") Integer protocolVersion,
    @JsonProperty("step_count") int stepCount,
    @JsonProperty("step_results") List<StepResultResponse> stepResults,
    @JsonProperty("mode_history") List<ModeChangeResponse> modeHistory,
    @JsonProperty("failure_reason") String failureReason,
    List<String> errors,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("completed_at") String completedAt
) {

    public record AssignmentResponse(
        boolean authorized,
        String role,
        String message
    ) {}

    public record StepResultResponse(
        @JsonProperty("step_index") int stepIndex,
        String kind,
        String status,
        String detail,
        @JsonProperty("elapsed_ms") long elapsedMs
    ) {}

    public record ModeChangeResponse(
        String mode,
        String at
    ) {}

    public static MissionResponse from(Mission mission) {
        return new MissionResponse(
                mission.missionId(),
                mission.traceId(),
                mission.employeeId(),
                mission.projectId(),
                mission.mode().name(),
                toAssignment(mission.assignmentVerdict()),
                mission.protocolVersion(),
                mission.stepCount(),
                mission.stepResults().stream().map(MissionResponse::toStepResult).toList(),
                mission.modeHistory().stream().map(MissionResponse::toModeChange).toList(),
                mission.failureReason(),
                mission.errors(),
                format(mission.createdAt()),
                format(mission.completedAt()));
    }

    private static AssignmentResponse toAssignment(AssignmentVerdict verdict) {
        if (verdict == null) {
            return null;
        }
        return new AssignmentResponse(verdict.authorized(), verdict.role(), verdict.message());
    }

    private static StepResultResponse toStepResult(StepResult result) {
        return new StepResultResponse(result.stepIndex(), result.kind(), result.status().name(),
                result.detail(), result.elapsedMs());
    }

    private static ModeChangeResponse toModeChange(ModeChange change) {
        return new ModeChangeResponse(change.mode().name(), format(change.at()));
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
