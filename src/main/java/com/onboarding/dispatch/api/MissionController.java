package com.onboarding.dispatch.api;

import com.onboarding.core.engine.MissionEngine;
import com.onboarding.core.model.Mission;
import com.onboarding.core.tracker.MissionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for onboarding mission operations.
 */
@RestController
@RequestMapping("/api/v1/missions")
public class MissionController {

    private static final Logger log = LoggerFactory.getLogger(MissionController.class);

    private final MissionEngine missionEngine;
    private final SseStreamingService sseStreamingService;

    public MissionController(MissionEngine missionEngine, SseStreamingService sseStreamingService) {
        this.missionEngine = missionEngine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/missions: Submit an onboarding mission.
     * Runs asynchronously unless {@code wait=true}, in which case the final mission is returned.
     */
    @PostMapping
    public ResponseEntity<?> submitMission(@RequestBody MissionRequest request,
                                           @RequestParam(name = "wait", defaultValue = "false") boolean wait) {
        if (request.employeeId() == null || request.employeeId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "employee_id is required"));
        }
        if (request.projectId() == null || request.projectId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "project_id is required"));
        }

        if (wait) {
            Mission mission = missionEngine.runMission(request.employeeId(), request.projectId());
            log.info("Mission {} finished synchronously in mode {}", mission.missionId(), mission.mode());
            return ResponseEntity.ok(MissionResponse.from(mission));
        }

        String missionId = missionEngine.submit(request.employeeId(), request.projectId());
        Mission mission = missionEngine.status(missionId);
        log.info("Accepted mission {} for {} on {}", missionId, mission.employeeId(), mission.projectId());
        return ResponseEntity.accepted().body(Map.of(
                "mission_id", missionId,
                "trace_id", mission.traceId(),
                "mode", mission.mode().name()));
    }

    /**
     * GET /api/v1/missions: List all tracked missions, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<MissionResponse>> listMissions() {
        return ResponseEntity.ok(missionEngine.missions().stream()
                .map(MissionResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MissionResponse> getMission(@PathVariable String id) {
        try {
            return ResponseEntity.ok(MissionResponse.from(missionEngine.status(id)));
        } catch (MissionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * GET /api/v1/missions/{id}/events: Stream mission events over SSE.
     * A mission that already finished gets one snapshot event and the stream closes.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        Mission mission;
        try {
            mission = missionEngine.status(id);
        } catch (MissionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        if (mission.mode().isTerminal()) {
            return ResponseEntity.ok(sseStreamingService.createFinishedEmitter(mission));
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id, () -> missionEngine.status(id)));
    }
}
