package com.onboarding.core.engine;

import com.onboarding.core.events.EventBus;
import com.onboarding.core.events.OnboardingEvent;
import com.onboarding.core.graph.CoordinatorGraph;
import com.onboarding.core.logging.MdcAwareExecutor;
import com.onboarding.core.logging.MdcContext;
import com.onboarding.core.model.Mission;
import com.onboarding.core.state.CoordinatorState;
import com.onboarding.core.tracker.MissionStateTracker;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The Coordinator: registers onboarding missions and runs them through the
 * LangGraph4j state machine.
 * <p>
 * Every mission ends in COMPLETED or FAILED. An unexpected error escaping the
 * graph is recorded on the mission and fails it.
 */
@Service
public class MissionEngine {

    private static final Logger log = LoggerFactory.getLogger(MissionEngine.class);

    private final AtomicInteger missionCounter = new AtomicInteger(0);

    private final CoordinatorGraph coordinatorGraph;
    private final MissionStateTracker tracker;
    private final MissionLifecycle lifecycle;
    private final EventBus eventBus;
    private final MdcAwareExecutor executor;
    private final CoordinatorProperties properties;
    private final Clock clock;

    @Autowired
    public MissionEngine(CoordinatorGraph coordinatorGraph, MissionStateTracker tracker,
                         MissionLifecycle lifecycle, EventBus eventBus, MdcAwareExecutor executor,
                         CoordinatorProperties properties) {
        this(coordinatorGraph, tracker, lifecycle, eventBus, executor, properties, Clock.systemUTC());
    }

    MissionEngine(CoordinatorGraph coordinatorGraph, MissionStateTracker tracker,
                  MissionLifecycle lifecycle, EventBus eventBus, MdcAwareExecutor executor,
                  CoordinatorProperties properties, Clock clock) {
        this.coordinatorGraph = coordinatorGraph;
        this.tracker = tracker;
        this.lifecycle = lifecycle;
        this.eventBus = eventBus;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Registers a mission and runs it on the mission executor.
     *
     * @return the new mission id; the mission is observable through {@link #status(String)}
     */
    public String submit(String employeeId, String projectId) {
        Mission mission = register(employeeId, projectId);
        executor.submit(() -> execute(mission));
        return mission.missionId();
    }

    /**
     * Registers a mission and runs it on the calling thread.
     *
     * @return the mission in its terminal mode
     */
    public Mission runMission(String employeeId, String projectId) {
        Mission mission = register(employeeId, projectId);
        execute(mission);
        return tracker.get(mission.missionId());
    }

    public Mission status(String missionId) {
        return tracker.get(missionId);
    }

    public List<Mission> missions() {
        return tracker.list();
    }

    /**
     * Generates a unique mission ID in the format ONBD-YYYY-NNNN.
     */
    public String generateMissionId() {
        int count = missionCounter.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("%s-%d-%04d", properties.getMissionIdPrefix(), year, count);
    }

    private Mission register(String employeeId, String projectId) {
        requireText(employeeId, "employeeId");
        requireText(projectId, "projectId");
        evictExpired();
        Mission mission = Mission.pending(generateMissionId(), UUID.randomUUID().toString(),
                employeeId.trim(), projectId.trim(), clock.instant());
        tracker.create(mission);
        log.info("Mission {} registered for {} on {} (trace {})",
                mission.missionId(), mission.employeeId(), mission.projectId(), mission.traceId());
        eventBus.publish(OnboardingEvent.of(OnboardingEvent.MISSION_CREATED, mission.missionId(),
                mission.traceId(), Map.of("employeeId", mission.employeeId(), "projectId", mission.projectId())));
        return mission;
    }

    private void evictExpired() {
        Duration retention = properties.getMissionRetention();
        if (retention == null || retention.isZero() || retention.isNegative()) {
            return;
        }
        int evicted = tracker.evictFinishedBefore(clock.instant().minus(retention));
        if (evicted > 0) {
            log.info("Evicted {} finished mission(s) older than {}", evicted, retention);
        }
    }

    private void execute(Mission mission) {
        String missionId = mission.missionId();
        MdcContext.setMission(missionId, mission.traceId());
        try {
            log.info("Starting mission {}", missionId);
            var config = RunnableConfig.builder()
                    .threadId(missionId)
                    .build();
            coordinatorGraph.getCompiledGraph()
                    .invoke(CoordinatorState.initial(mission.context()), config);

            if (lifecycle.abort(missionId, "coordinator stopped before a terminal mode")) {
                log.error("Mission {} left the graph without finishing", missionId);
            }
        } catch (RuntimeException e) {
            log.error("Mission {} aborted by unexpected error", missionId, e);
            tracker.recordError(missionId, "unexpected: " + e.getMessage());
            lifecycle.abort(missionId, "internal error: " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
