package com.onboarding.core.nodes;

import com.onboarding.core.CollaboratorUnreachableException;
import com.onboarding.core.engine.MissionLifecycle;
import com.onboarding.core.model.MissionSignal;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.protocol.ProtocolProperties;
import com.onboarding.core.protocol.ProtocolStore;
import com.onboarding.core.state.CoordinatorState;
import com.onboarding.core.tracker.MissionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * LangGraph4j node that looks up the project's protocol and classifies the
 * mission as execution (protocol found) or protocol creation (none stored).
 */
@Component
public class ResolveProtocolNode {

    private static final Logger log = LoggerFactory.getLogger(ResolveProtocolNode.class);

    private final ProtocolStore protocolStore;
    private final MissionStateTracker tracker;
    private final MissionLifecycle lifecycle;
    private final int maxSteps;

    public ResolveProtocolNode(ProtocolStore protocolStore, MissionStateTracker tracker,
                               MissionLifecycle lifecycle, ProtocolProperties protocolProperties) {
        this.protocolStore = protocolStore;
        this.tracker = tracker;
        this.lifecycle = lifecycle;
        this.maxSteps = protocolProperties.getMaxSteps();
    }

    public Map<String, Object> apply(CoordinatorState state) {
        String missionId = state.missionId();
        Optional<Protocol> found;
        try {
            found = protocolStore.get(state.projectId(), state.context());
        } catch (CollaboratorUnreachableException e) {
            log.error("Protocol lookup for {} failed: {}", state.projectId(), e.getMessage());
            tracker.recordError(missionId, "protocol lookup: " + e.getMessage());
            lifecycle.signal(missionId, MissionSignal.COLLABORATOR_FAILED, "protocol store unreachable");
            return Map.of();
        }

        if (found.isEmpty()) {
            log.info("No protocol stored for {}", state.projectId());
            lifecycle.signal(missionId, MissionSignal.PROTOCOL_MISSING);
            return Map.of();
        }

        Protocol protocol = found.get();
        if (protocol.stepCount() > maxSteps) {
            // stored under a higher limit; the graph cannot run it to the end
            log.error("Protocol v{} for {} has {} steps, limit is {}",
                    protocol.version(), protocol.projectId(), protocol.stepCount(), maxSteps);
            tracker.recordError(missionId, "protocol v" + protocol.version() + " has "
                    + protocol.stepCount() + " steps, limit is " + maxSteps);
            lifecycle.signal(missionId, MissionSignal.COLLABORATOR_FAILED, "protocol exceeds step limit");
            return Map.of();
        }
        log.info("Found protocol v{} for {} with {} step(s)",
                protocol.version(), protocol.projectId(), protocol.stepCount());
        tracker.bindProtocol(missionId, protocol.version(), protocol.stepCount());
        lifecycle.signal(missionId, MissionSignal.PROTOCOL_FOUND);
        return Map.of(CoordinatorState.PROTOCOL, protocol);
    }
}
