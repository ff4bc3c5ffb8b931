package com.onboarding.core.health;

import com.onboarding.core.CollaboratorUnreachableException;
import com.onboarding.core.assignment.AssignmentChecker;
import com.onboarding.core.graph.CoordinatorGraph;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.protocol.ProtocolStore;
import com.onboarding.core.provisioning.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String PROBE_PROJECT = "__health_probe__";

    private final CoordinatorGraph coordinatorGraph;
    private final ProtocolStore protocolStore;
    private final AssignmentChecker assignmentChecker;
    private final WorkerRegistry workerRegistry;

    public HealthCheckService(
            @Autowired(required = false) CoordinatorGraph coordinatorGraph,
            @Autowired(required = false) ProtocolStore protocolStore,
            @Autowired(required = false) AssignmentChecker assignmentChecker,
            @Autowired(required = false) WorkerRegistry workerRegistry) {
        this.coordinatorGraph = coordinatorGraph;
        this.protocolStore = protocolStore;
        this.assignmentChecker = assignmentChecker;
        this.workerRegistry = workerRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkProtocolStore());
        results.add(checkAssignmentChecker());
        results.add(checkWorkers());
        return results;
    }

    private HealthStatus checkGraph() {
        if (coordinatorGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkProtocolStore() {
        if (protocolStore == null) {
            return new HealthStatus("protocolStore", HealthStatus.Status.DOWN,
                    "No ProtocolStore configured", Map.of());
        }
        try {
            protocolStore.get(PROBE_PROJECT, MissionContext.administrative("health", PROBE_PROJECT));
            return new HealthStatus("protocolStore", HealthStatus.Status.UP,
                    "Protocol store reachable", Map.of("type", protocolStore.getClass().getSimpleName()));
        } catch (CollaboratorUnreachableException e) {
            log.warn("Protocol store health check failed: {}", e.getMessage());
            return new HealthStatus("protocolStore", HealthStatus.Status.DOWN,
                    "Protocol store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkAssignmentChecker() {
        if (assignmentChecker == null) {
            return new HealthStatus("assignmentChecker", HealthStatus.Status.DOWN,
                    "No AssignmentChecker configured", Map.of());
        }
        return new HealthStatus("assignmentChecker", HealthStatus.Status.UP,
                "AssignmentChecker available (" + assignmentChecker.getClass().getSimpleName() + ")", Map.of());
    }

    private HealthStatus checkWorkers() {
        if (workerRegistry == null || workerRegistry.capabilities().isEmpty()) {
            return new HealthStatus("workers", HealthStatus.Status.DEGRADED,
                    "No provisioning workers registered", Map.of());
        }
        return new HealthStatus("workers", HealthStatus.Status.UP,
                workerRegistry.capabilities().size() + " worker(s) registered",
                Map.of("capabilities", String.join(",", workerRegistry.capabilities())));
    }
}
