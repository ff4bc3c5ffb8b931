package com.onboarding.core.metrics;

import com.onboarding.core.model.MissionMode;
import com.onboarding.core.model.StepStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for onboarding mission execution.
 */
@Service
public class OnboardingMetrics {

    private final MeterRegistry registry;

    public OnboardingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMissionResult(MissionMode mode) {
        Counter.builder("onboarding.missions.total")
                .tag("mode", mode.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordStepExecution(String kind, StepStatus status, long ms) {
        Timer.builder("onboarding.step.duration")
                .tag("kind", kind)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a protocol creation by a mission.
     *
     * @param outcome "created" when this mission wrote version 1,
     *                "race_recovered" when another mission won and its protocol was adopted
     */
    public void recordProtocolCreation(String outcome) {
        Counter.builder("onboarding.protocol.creations")
                .description("Protocols created on first onboarding to a project")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAssignmentVerdict(boolean authorized) {
        Counter.builder("onboarding.assignment.verdicts")
                .tag("result", authorized ? "authorized" : "denied")
                .register(registry)
                .increment();
    }

    public void recordWorkerRetry(String kind) {
        Counter.builder("onboarding.worker.retries")
                .description("Worker calls retried after an unreachable response")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
