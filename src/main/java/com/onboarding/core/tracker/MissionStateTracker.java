package com.onboarding.core.tracker;

import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionMode;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.model.StepResult;

import java.time.Instant;
import java.util.List;

/**
 * Single writer and single source of truth for in-flight mission state.
 * <p>
 * Every mutation is atomic with respect to one mission and readers only ever
 * see complete {@link Mission} snapshots. All operations on an unknown id
 * throw {@link MissionNotFoundException}.
 */
public interface MissionStateTracker {

    /**
     * Registers a new mission and returns its id.
     *
     * @throws IllegalStateException if a mission with the same id already exists
     */
    String create(Mission mission);

    Mission get(String missionId);

    List<Mission> list();

    /**
     * Appends the result of the next step. Results must arrive in step order
     * and never exceed the step count of the bound protocol.
     */
    Mission appendStepResult(String missionId, StepResult result);

    /**
     * Forces the mode, bypassing the signal table. Still refuses to leave a terminal mode.
     */
    Mission setMode(String missionId, MissionMode mode);

    /**
     * Applies a state-machine signal atomically; a non-null reason is stored as the failure reason.
     */
    Mission transition(String missionId, MissionSignal signal, String reason);

    Mission recordVerdict(String missionId, AssignmentVerdict verdict);

    Mission bindProtocol(String missionId, int protocolVersion, int stepCount);

    Mission recordError(String missionId, String error);

    /**
     * Drops missions that reached a terminal mode before {@code cutoff}. Running
     * missions are never evicted.
     *
     * @return the number of missions removed
     */
    int evictFinishedBefore(Instant cutoff);
}
