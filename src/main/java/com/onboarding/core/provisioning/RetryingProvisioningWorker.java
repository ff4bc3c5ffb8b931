package com.onboarding.core.provisioning;

import com.onboarding.core.metrics.OnboardingMetrics;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.StepOutcome;
import com.onboarding.core.model.StepSpec;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link ProvisioningWorker} with exponential-backoff retries on
 * {@link WorkerUnreachableException}. Failed outcomes are returned as-is;
 * once attempts are exhausted the last exception propagates.
 */
public class RetryingProvisioningWorker implements ProvisioningWorker {

    private static final Logger log = LoggerFactory.getLogger(RetryingProvisioningWorker.class);

    private final ProvisioningWorker delegate;
    private final Retry retry;

    public RetryingProvisioningWorker(ProvisioningWorker delegate, RetryProperties properties,
                                      OnboardingMetrics metrics) {
        this.delegate = delegate;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getInitialDelay(), properties.getMultiplier()))
                .retryExceptions(WorkerUnreachableException.class)
                .build();
        this.retry = Retry.of("worker-" + delegate.kind(), config);
        this.retry.getEventPublisher().onRetry(event -> {
            log.warn("Retrying {} worker (attempt {}): {}", delegate.kind(),
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
            if (metrics != null) {
                metrics.recordWorkerRetry(delegate.kind());
            }
        });
    }

    @Override
    public String kind() {
        return delegate.kind();
    }

    @Override
    public StepOutcome executeStep(StepSpec step, String employeeId, MissionContext context) {
        return Retry.decorateSupplier(retry, () -> delegate.executeStep(step, employeeId, context)).get();
    }

    ProvisioningWorker delegate() {
        return delegate;
    }
}
