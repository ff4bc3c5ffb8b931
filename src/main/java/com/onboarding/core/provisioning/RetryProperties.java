package com.onboarding.core.provisioning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry policy applied by {@link RetryingProvisioningWorker} to unreachable workers.
 */
@Component
@ConfigurationProperties(prefix = "onboarding.retry")
public class RetryProperties {

    private boolean enabled = true;
    private int maxAttempts = 5;
    private Duration initialDelay = Duration.ofSeconds(1);
    private double multiplier = 7.0;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }
}
