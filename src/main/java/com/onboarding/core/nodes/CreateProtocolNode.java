package com.onboarding.core.nodes;

import com.onboarding.core.CollaboratorUnreachableException;
import com.onboarding.core.engine.MissionLifecycle;
import com.onboarding.core.events.EventBus;
import com.onboarding.core.events.OnboardingEvent;
import com.onboarding.core.metrics.OnboardingMetrics;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.protocol.DefaultProtocolFactory;
import com.onboarding.core.protocol.ProtocolAlreadyExistsException;
import com.onboarding.core.protocol.ProtocolStore;
import com.onboarding.core.state.CoordinatorState;
import com.onboarding.core.tracker.MissionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that writes the default protocol as version 1 for a
 * project that has none.
 * <p>
 * When another mission created the protocol first, the store reports
 * {@link ProtocolAlreadyExistsException}; the winner's protocol is re-read
 * and this mission continues with it.
 */
@Component
public class CreateProtocolNode {

    private static final Logger log = LoggerFactory.getLogger(CreateProtocolNode.class);

    private final ProtocolStore protocolStore;
    private final DefaultProtocolFactory protocolFactory;
    private final MissionStateTracker tracker;
    private final MissionLifecycle lifecycle;
    private final EventBus eventBus;
    private final OnboardingMetrics metrics;

    public CreateProtocolNode(ProtocolStore protocolStore, DefaultProtocolFactory protocolFactory,
                              MissionStateTracker tracker, MissionLifecycle lifecycle,
                              EventBus eventBus, OnboardingMetrics metrics) {
        this.protocolStore = protocolStore;
        this.protocolFactory = protocolFactory;
        this.tracker = tracker;
        this.lifecycle = lifecycle;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(CoordinatorState state) {
        String missionId = state.missionId();
        MissionContext context = state.context();
        Protocol protocol;
        try {
            protocol = createOrAdopt(state.projectId(), context);
        } catch (CollaboratorUnreachableException e) {
            log.error("Protocol creation for {} failed: {}", state.projectId(), e.getMessage());
            tracker.recordError(missionId, "protocol creation: " + e.getMessage());
            lifecycle.signal(missionId, MissionSignal.COLLABORATOR_FAILED, "protocol store unreachable");
            return Map.of();
        }

        tracker.bindProtocol(missionId, protocol.version(), protocol.stepCount());
        lifecycle.signal(missionId, MissionSignal.PROTOCOL_READY);
        return Map.of(CoordinatorState.PROTOCOL, protocol);
    }

    private Protocol createOrAdopt(String projectId, MissionContext context) {
        try {
            Protocol created = protocolStore.create(projectId, protocolFactory.defaultSteps(projectId), context);
            log.info("Created protocol v{} for {}", created.version(), projectId);
            metrics.recordProtocolCreation("created");
            eventBus.publish(OnboardingEvent.of(OnboardingEvent.PROTOCOL_CREATED, context.missionId(),
                    context.traceId(), Map.of("projectId", projectId, "version", created.version(),
                            "steps", created.stepCount())));
            return created;
        } catch (ProtocolAlreadyExistsException e) {
            Protocol winner = protocolStore.get(projectId, context)
                    .orElseThrow(() -> new IllegalStateException(
                            "Protocol for " + projectId + " reported as existing but could not be read", e));
            log.info("Protocol for {} was created by another mission, adopting v{}", projectId, winner.version());
            metrics.recordProtocolCreation("race_recovered");
            eventBus.publish(OnboardingEvent.of(OnboardingEvent.PROTOCOL_RACE_RECOVERED, context.missionId(),
                    context.traceId(), Map.of("projectId", projectId, "version", winner.version())));
            return winner;
        }
    }
}
