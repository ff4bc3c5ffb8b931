package com.onboarding.core.nodes;

import com.onboarding.core.CollaboratorUnreachableException;
import com.onboarding.core.assignment.AssignmentChecker;
import com.onboarding.core.engine.MissionLifecycle;
import com.onboarding.core.events.EventBus;
import com.onboarding.core.events.OnboardingEvent;
import com.onboarding.core.metrics.OnboardingMetrics;
import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.state.CoordinatorState;
import com.onboarding.core.tracker.MissionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that consults the assignment checker before any step is
 * delegated. A negative verdict blocks the mission.
 */
@Component
public class CheckAssignmentNode {

    private static final Logger log = LoggerFactory.getLogger(CheckAssignmentNode.class);

    private final AssignmentChecker assignmentChecker;
    private final MissionStateTracker tracker;
    private final MissionLifecycle lifecycle;
    private final EventBus eventBus;
    private final OnboardingMetrics metrics;

    public CheckAssignmentNode(AssignmentChecker assignmentChecker, MissionStateTracker tracker,
                               MissionLifecycle lifecycle, EventBus eventBus, OnboardingMetrics metrics) {
        this.assignmentChecker = assignmentChecker;
        this.tracker = tracker;
        this.lifecycle = lifecycle;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(CoordinatorState state) {
        String missionId = state.missionId();
        AssignmentVerdict verdict;
        try {
            verdict = assignmentChecker.checkAssignment(state.employeeId(), state.projectId(), state.context());
        } catch (CollaboratorUnreachableException e) {
            log.error("Assignment lookup for {} on {} failed: {}", state.employeeId(), state.projectId(), e.getMessage());
            tracker.recordError(missionId, "assignment lookup: " + e.getMessage());
            lifecycle.signal(missionId, MissionSignal.COLLABORATOR_FAILED, "assignment checker unreachable");
            return Map.of();
        }

        tracker.recordVerdict(missionId, verdict);
        metrics.recordAssignmentVerdict(verdict.authorized());
        eventBus.publish(OnboardingEvent.of(OnboardingEvent.ASSIGNMENT_CHECKED, missionId, state.traceId(),
                Map.of("authorized", verdict.authorized(), "role", String.valueOf(verdict.role()))));

        if (!verdict.authorized()) {
            log.warn("{} is not authorized for {}: {}", state.employeeId(), state.projectId(), verdict.message());
            lifecycle.signal(missionId, MissionSignal.ACCESS_DENIED);
        } else {
            log.info("{} authorized for {} as {}", state.employeeId(), state.projectId(), verdict.role());
        }
        return Map.of();
    }
}
