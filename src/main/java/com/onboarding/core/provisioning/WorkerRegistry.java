package com.onboarding.core.provisioning;

import com.onboarding.core.metrics.OnboardingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes protocol steps to the worker serving their kind.
 * <p>
 * Every registered worker is wrapped in a {@link RetryingProvisioningWorker}
 * unless retries are disabled.
 */
@Component
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<String, ProvisioningWorker> workers = new LinkedHashMap<>();

    @Autowired
    public WorkerRegistry(List<ProvisioningWorker> workers, RetryProperties retryProperties,
                          OnboardingMetrics metrics) {
        for (ProvisioningWorker worker : workers) {
            ProvisioningWorker effective = retryProperties.isEnabled()
                    ? new RetryingProvisioningWorker(worker, retryProperties, metrics)
                    : worker;
            ProvisioningWorker previous = this.workers.putIfAbsent(worker.kind(), effective);
            if (previous != null) {
                throw new IllegalStateException("Two workers registered for step kind " + worker.kind());
            }
        }
        log.info("Registered provisioning workers: {} (retries {})",
                this.workers.keySet(), retryProperties.isEnabled() ? "enabled" : "disabled");
    }

    public WorkerRegistry(List<ProvisioningWorker> workers) {
        this(workers, disabledRetries(), null);
    }

    public Optional<ProvisioningWorker> find(String kind) {
        return Optional.ofNullable(workers.get(kind));
    }

    public Set<String> capabilities() {
        return workers.keySet();
    }

    private static RetryProperties disabledRetries() {
        var properties = new RetryProperties();
        properties.setEnabled(false);
        return properties;
    }
}
