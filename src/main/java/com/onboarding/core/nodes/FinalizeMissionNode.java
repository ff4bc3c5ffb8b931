package com.onboarding.core.nodes;

import com.onboarding.core.engine.MissionLifecycle;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.state.CoordinatorState;
import com.onboarding.core.tracker.MissionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that brings the mission to its terminal mode.
 */
@Component
public class FinalizeMissionNode {

    private static final Logger log = LoggerFactory.getLogger(FinalizeMissionNode.class);

    static final String UNAUTHORIZED = "unauthorized";

    private final MissionStateTracker tracker;
    private final MissionLifecycle lifecycle;

    public FinalizeMissionNode(MissionStateTracker tracker, MissionLifecycle lifecycle) {
        this.tracker = tracker;
        this.lifecycle = lifecycle;
    }

    public Map<String, Object> apply(CoordinatorState state) {
        String missionId = state.missionId();
        Mission mission = tracker.get(missionId);
        switch (mission.mode()) {
            case BLOCKED -> lifecycle.signal(missionId, MissionSignal.BLOCK_RECORDED, UNAUTHORIZED);
            case EXECUTION -> {
                if (mission.stepResults().size() < mission.stepCount()) {
                    lifecycle.abort(missionId, "only " + mission.stepResults().size() + " of "
                            + mission.stepCount() + " steps were attempted");
                } else {
                    lifecycle.signal(missionId, MissionSignal.STEPS_EXHAUSTED);
                }
            }
            case COMPLETED, FAILED -> log.debug("Mission {} already {}", missionId, mission.mode());
            default -> lifecycle.abort(missionId, "mission stalled in " + mission.mode());
        }
        return Map.of();
    }
}
