package com.onboarding.core.engine;

import com.onboarding.core.events.EventBus;
import com.onboarding.core.events.OnboardingEvent;
import com.onboarding.core.metrics.OnboardingMetrics;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionMode;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.tracker.MissionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Applies state-machine signals to missions and announces the resulting mode
 * changes. Reaching a terminal mode is counted and published exactly once,
 * here, whichever node caused it.
 */
@Component
public class MissionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MissionLifecycle.class);

    private final MissionStateTracker tracker;
    private final EventBus eventBus;
    private final OnboardingMetrics metrics;

    public MissionLifecycle(MissionStateTracker tracker, EventBus eventBus, OnboardingMetrics metrics) {
        this.tracker = tracker;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Mission signal(String missionId, MissionSignal signal) {
        return signal(missionId, signal, null);
    }

    /**
     * @param reason stored as the failure reason when not null
     * @throws IllegalModeTransitionException if the signal is not valid in the current mode
     */
    public Mission signal(String missionId, MissionSignal signal, String reason) {
        MissionMode from = tracker.get(missionId).mode();
        Mission updated = tracker.transition(missionId, signal, reason);
        log.info("Mission {} {} -> {} on {}", missionId, from, updated.mode(), signal);

        var payload = new HashMap<String, Object>();
        payload.put("from", from.name());
        payload.put("to", updated.mode().name());
        payload.put("signal", signal.name());
        if (reason != null) {
            payload.put("reason", reason);
        }
        eventBus.publish(OnboardingEvent.of(OnboardingEvent.MODE_CHANGED, missionId, updated.traceId(), payload));

        if (updated.mode().isTerminal()) {
            announceOutcome(updated);
        }
        return updated;
    }

    /**
     * Drives a mission to FAILED unless it already finished.
     *
     * @return true if this call failed the mission
     */
    public boolean abort(String missionId, String reason) {
        Mission current = tracker.get(missionId);
        if (current.mode().isTerminal()) {
            return false;
        }
        try {
            signal(missionId, MissionSignal.COLLABORATOR_FAILED, reason);
            return true;
        } catch (IllegalModeTransitionException e) {
            log.warn("Mission {} finished concurrently while aborting: {}", missionId, e.getMessage());
            return false;
        }
    }

    private void announceOutcome(Mission mission) {
        metrics.recordMissionResult(mission.mode());
        if (mission.mode() == MissionMode.COMPLETED) {
            log.info("Mission {} completed with {} step result(s)", mission.missionId(), mission.stepResults().size());
            eventBus.publish(OnboardingEvent.of(OnboardingEvent.MISSION_COMPLETED, mission.missionId(),
                    mission.traceId(), Map.of("steps", mission.stepResults().size())));
        } else {
            log.warn("Mission {} failed: {}", mission.missionId(), mission.failureReason());
            eventBus.publish(OnboardingEvent.of(OnboardingEvent.MISSION_FAILED, mission.missionId(),
                    mission.traceId(), Map.of("reason", String.valueOf(mission.failureReason()))));
        }
    }
}
