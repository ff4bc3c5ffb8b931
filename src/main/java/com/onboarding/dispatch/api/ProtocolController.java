package com.onboarding.dispatch.api;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.model.StepSpec;
import com.onboarding.core.protocol.InvalidProtocolException;
import com.onboarding.core.protocol.ProtocolConflictException;
import com.onboarding.core.protocol.ProtocolNotFoundException;
import com.onboarding.core.protocol.ProtocolStore;
import com.onboarding.core.protocol.ProtocolStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for reading and replacing project onboarding protocols.
 */
@RestController
@RequestMapping("/api/v1/protocols")
public class ProtocolController {

    private static final Logger log = LoggerFactory.getLogger(ProtocolController.class);

    private final ProtocolStore protocolStore;

    public ProtocolController(ProtocolStore protocolStore) {
        this.protocolStore = protocolStore;
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<?> getProtocol(@PathVariable String projectId) {
        try {
            return protocolStore.get(projectId, MissionContext.administrative("api", projectId))
                    .<ResponseEntity<?>>map(p -> ResponseEntity.ok(ProtocolResponse.from(p)))
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (ProtocolStoreUnavailableException e) {
            return ResponseEntity.status(503).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * PUT /api/v1/protocols/{projectId}: Store a new version of an existing protocol.
     * Missions already running keep the version they started with.
     */
    @PutMapping("/{projectId}")
    public ResponseEntity<?> replaceProtocol(@PathVariable String projectId,
                                             @RequestBody ProtocolRequest request) {
        if (request.steps() == null || request.steps().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one step is required"));
        }
        for (int i = 0; i < request.steps().size(); i++) {
            String problem = invalidStep(i, request.steps().get(i));
            if (problem != null) {
                return ResponseEntity.badRequest().body(Map.of("error", problem));
            }
        }

        String actor = request.updatedBy() != null && !request.updatedBy().isBlank() ? request.updatedBy() : "api";
        List<StepSpec> steps = request.steps().stream().map(StepRequest::toStepSpec).toList();
        try {
            Protocol replaced = protocolStore.replace(projectId, steps,
                    MissionContext.administrative(actor, projectId));
            log.info("Protocol for {} replaced by {} (now v{})", projectId, actor, replaced.version());
            return ResponseEntity.ok(ProtocolResponse.from(replaced));
        } catch (InvalidProtocolException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (ProtocolNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (ProtocolConflictException e) {
            log.warn("Protocol replacement for {} lost a race: {}", projectId, e.getMessage());
            return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
        } catch (ProtocolStoreUnavailableException e) {
            return ResponseEntity.status(503).body(Map.of("error", e.getMessage()));
        }
    }

    private static String invalidStep(int index, StepRequest step) {
        if (step == null) {
            return "Step " + index + " is null";
        }
        if (step.kind() == null || step.kind().isBlank()) {
            return "Every step needs a kind";
        }
        if (step.parameters() != null) {
            for (var entry : step.parameters().entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    return "Step " + index + " has a null parameter: " + entry.getKey();
                }
            }
        }
        return null;
    }
}
