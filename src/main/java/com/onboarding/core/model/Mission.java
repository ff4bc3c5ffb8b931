package com.onboarding.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one onboarding run for an (employee, project) pair.
 * <p>
 * Snapshots are produced by the mission state tracker; every mutation yields
 * a new instance so readers never observe a half-applied update.
 *
 * @param missionId         unique mission identifier (e.g. "ONBD-2026-0001")
 * @param traceId           correlation id threaded through every collaborator call
 * @param employeeId        the employee being onboarded
 * @param projectId         the project the employee joins
 * @param mode              current state-machine mode
 * @param assignmentVerdict authorization result; null until the checker was consulted
 * @param protocolVersion   version of the bound protocol; null until one is bound
 * @param stepCount         number of steps in the bound protocol
 * @param stepResults       one entry per attempted step, in step order
 * @param modeHistory       every mode entered, oldest first
 * @param failureReason     why the mission failed; null unless FAILED
 * @param errors            collaborator failures recorded during the run
 * @param createdAt         submission time
 * @param completedAt       time a terminal mode was reached; null while running
 */
public record Mission(
    String missionId,
    String traceId,
    String employeeId,
    String projectId,
    MissionMode mode,
    AssignmentVerdict assignmentVerdict,
    Integer protocolVersion,
    int stepCount,
    List<StepResult> stepResults,
    List<ModeChange> modeHistory,
    String failureReason,
    List<String> errors,
    Instant createdAt,
    Instant completedAt
) implements Serializable {

    public Mission {
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
        modeHistory = modeHistory == null ? List.of() : List.copyOf(modeHistory);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Creates a freshly submitted mission in {@link MissionMode#PENDING}.
     */
    public static Mission pending(String missionId, String traceId, String employeeId,
                                  String projectId, Instant createdAt) {
        return new Mission(missionId, traceId, employeeId, projectId, MissionMode.PENDING,
                null, null, 0, List.of(), List.of(new ModeChange(MissionMode.PENDING, createdAt)),
                null, List.of(), createdAt, null);
    }

    public MissionContext context() {
        return new MissionContext(missionId, traceId, employeeId, projectId);
    }

    public List<MissionMode> modes() {
        return modeHistory.stream().map(ModeChange::mode).toList();
    }

    public Mission withMode(MissionMode newMode, Instant at) {
        var history = new ArrayList<>(modeHistory);
        history.add(new ModeChange(newMode, at));
        return new Mission(missionId, traceId, employeeId, projectId, newMode,
                assignmentVerdict, protocolVersion, stepCount, stepResults, history,
                failureReason, errors, createdAt, newMode.isTerminal() ? at : completedAt);
    }

    public Mission withFailureReason(String reason) {
        return new Mission(missionId, traceId, employeeId, projectId, mode,
                assignmentVerdict, protocolVersion, stepCount, stepResults, modeHistory,
                reason, errors, createdAt, completedAt);
    }

    public Mission withVerdict(AssignmentVerdict verdict) {
        return new Mission(missionId, traceId, employeeId, projectId, mode,
                verdict, protocolVersion, stepCount, stepResults, modeHistory,
                failureReason, errors, createdAt, completedAt);
    }

    public Mission withProtocol(int version, int steps) {
        return new Mission(missionId, traceId, employeeId, projectId, mode,
                assignmentVerdict, version, steps, stepResults, modeHistory,
                failureReason, errors, createdAt, completedAt);
    }

    public Mission withStepResult(StepResult result) {
        var results = new ArrayList<>(stepResults);
        results.add(result);
        return new Mission(missionId, traceId, employeeId, projectId, mode,
                assignmentVerdict, protocolVersion, stepCount, results, modeHistory,
                failureReason, errors, createdAt, completedAt);
    }

    public Mission withError(String error) {
        var all = new ArrayList<>(errors);
        all.add(error);
        return new Mission(missionId, traceId, employeeId, projectId, mode,
                assignmentVerdict, protocolVersion, stepCount, stepResults, modeHistory,
                failureReason, all, createdAt, completedAt);
    }
}
