package com.onboarding.core.nodes;

import com.onboarding.core.CollaboratorUnreachableException;
import com.onboarding.core.engine.MissionLifecycle;
import com.onboarding.core.events.EventBus;
import com.onboarding.core.events.OnboardingEvent;
import com.onboarding.core.logging.MdcContext;
import com.onboarding.core.metrics.OnboardingMetrics;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.model.StepOutcome;
import com.onboarding.core.model.StepResult;
import com.onboarding.core.model.StepSpec;
import com.onboarding.core.provisioning.ProvisioningWorker;
import com.onboarding.core.provisioning.WorkerRegistry;
import com.onboarding.core.state.CoordinatorState;
import com.onboarding.core.tracker.MissionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LangGraph4j node that delegates the next protocol step to its worker.
 * <p>
 * The next step is the one after the last recorded result, so each step is
 * delegated at most once. Worker failures of any kind become a FAILURE
 * result on the step; the mission fails only when the step is fatal.
 */
@Component
public class DispatchStepNode {

    private static final Logger log = LoggerFactory.getLogger(DispatchStepNode.class);

    private final WorkerRegistry workerRegistry;
    private final MissionStateTracker tracker;
    private final MissionLifecycle lifecycle;
    private final EventBus eventBus;
    private final OnboardingMetrics metrics;

    public DispatchStepNode(WorkerRegistry workerRegistry, MissionStateTracker tracker,
                            MissionLifecycle lifecycle, EventBus eventBus, OnboardingMetrics metrics) {
        this.workerRegistry = workerRegistry;
        this.tracker = tracker;
        this.lifecycle = lifecycle;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(CoordinatorState state) {
        String missionId = state.missionId();
        Protocol protocol = state.protocol()
                .orElseThrow(() -> new IllegalStateException("Mission " + missionId + " has no bound protocol"));
        Mission mission = tracker.get(missionId);
        int index = mission.stepResults().size();
        StepSpec step = protocol.steps().get(index);

        MdcContext.setStep(missionId, state.traceId(), index, step.kind());
        try {
            log.info("Dispatching step {}/{} ({} on {})", index + 1, protocol.stepCount(),
                    step.kind(), step.targetSystem());
            long start = System.nanoTime();
            StepOutcome outcome = execute(step, state.employeeId(), state.context());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            var result = new StepResult(index, step.kind(), outcome.status(), outcome.detail(), elapsedMs);
            tracker.appendStepResult(missionId, result);
            metrics.recordStepExecution(step.kind(), outcome.status(), elapsedMs);
            publishStepCompleted(state, step, result);

            if (result.failed()) {
                log.warn("Step {} ({}) failed{}: {}", index, step.kind(),
                        step.fatalOnFailure() ? "" : " (non-fatal)", outcome.detail());
                if (step.fatalOnFailure()) {
                    lifecycle.signal(missionId, MissionSignal.FATAL_STEP_FAILED,
                            "step " + index + " failed: " + outcome.detail());
                }
            } else {
                log.info("Step {} ({}) {} in {}ms: {}", index, step.kind(), outcome.status(),
                        elapsedMs, outcome.detail());
            }
        } finally {
            MdcContext.clearStep();
        }
        return Map.of();
    }

    private StepOutcome execute(StepSpec step, String employeeId, MissionContext context) {
        Optional<ProvisioningWorker> worker = workerRegistry.find(step.kind());
        if (worker.isEmpty()) {
            return StepOutcome.failed("Unreachable: no worker serves capability '" + step.kind() + "'");
        }
        try {
            return worker.get().executeStep(step, employeeId, context);
        } catch (CollaboratorUnreachableException e) {
            return StepOutcome.failed("Unreachable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Worker for {} threw unexpectedly", step.kind(), e);
            return StepOutcome.failed("Worker error: " + e.getMessage());
        }
    }

    private void publishStepCompleted(CoordinatorState state, StepSpec step, StepResult result) {
        var payload = new HashMap<String, Object>();
        payload.put("kind", step.kind());
        payload.put("status", result.status().name());
        payload.put("detail", String.valueOf(result.detail()));
        payload.put("elapsedMs", result.elapsedMs());
        eventBus.publish(OnboardingEvent.ofStep(OnboardingEvent.STEP_COMPLETED, state.missionId(),
                state.traceId(), result.stepIndex(), payload));
    }
}
