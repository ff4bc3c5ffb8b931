package com.onboarding.dispatch.api;

import com.onboarding.core.events.EventBus;
import com.onboarding.core.events.OnboardingEvent;
import com.onboarding.core.model.Mission;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each emitter is subscribed to one mission and completes itself after the
 * mission's terminal event. Heartbeat comments keep idle connections open
 * through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 10 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final String SNAPSHOT_EVENT = "mission.snapshot";

    private static final Set<String> TERMINAL_EVENTS =
            Set.of(OnboardingEvent.MISSION_COMPLETED, OnboardingEvent.MISSION_FAILED);

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for mission {}: {}", registration.missionId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given mission until it finishes.
     * <p>
     * The subscription is registered before {@code currentState} is read, so a
     * terminal event published in between is either delivered or visible in the
     * snapshot. Whichever path sees the terminal mode first closes the stream.
     */
    public SseEmitter createEmitter(String missionId, Supplier<Mission> currentState) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AtomicBoolean closed = new AtomicBoolean(false);
        AtomicReference<EmitterRegistration> registrationRef = new AtomicReference<>();

        EventBus.Subscription subscription = eventBus.subscribe(missionId, event -> {
            if (closed.get()) {
                return;
            }
            sendEvent(emitter, event);
            if (TERMINAL_EVENTS.contains(event.eventType()) && closed.compareAndSet(false, true)) {
                finish(emitter, registrationRef.get());
            }
        });

        var registration = new EmitterRegistration(missionId, emitter, subscription);
        registrationRef.set(registration);
        activeRegistrations.add(registration);
        if (closed.get()) {
            // terminal event arrived before the registration was stored
            cleanup(registration);
            return emitter;
        }

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for mission {}", missionId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for mission {}: {}", missionId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send initial comment for mission {}: {}", missionId, e.getMessage());
        }

        Mission mission = currentState.get();
        if (mission.mode().isTerminal() && closed.compareAndSet(false, true)) {
            log.debug("Mission {} finished before the stream subscribed, sending snapshot", missionId);
            sendSnapshot(emitter, mission);
            finish(emitter, registration);
            return emitter;
        }

        log.info("SSE emitter created for mission {} (timeout={}ms)", missionId, timeoutMs);
        return emitter;
    }

    /**
     * Emitter for a mission that already reached a terminal mode: one snapshot event, then complete.
     */
    public SseEmitter createFinishedEmitter(Mission mission) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        sendSnapshot(emitter, mission);
        emitter.complete();
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, OnboardingEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("missionId", event.missionId());
            data.put("traceId", event.traceId());
            if (event.stepIndex() != null) {
                data.put("stepIndex", event.stepIndex());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for mission {}: {}",
                    event.eventType(), event.missionId(), e.getMessage());
        }
    }

    private void sendSnapshot(SseEmitter emitter, Mission mission) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("missionId", mission.missionId());
        data.put("traceId", mission.traceId());
        data.put("mode", mission.mode().name());
        data.put("steps", mission.stepResults().size());
        if (mission.failureReason() != null) {
            data.put("reason", mission.failureReason());
        }
        try {
            emitter.send(SseEmitter.event().name(SNAPSHOT_EVENT).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send snapshot for mission {}: {}", mission.missionId(), e.getMessage());
        }
    }

    private void finish(SseEmitter emitter, EmitterRegistration registration) {
        if (registration != null) {
            cleanup(registration);
        }
        emitter.complete();
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String missionId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
