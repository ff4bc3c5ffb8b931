package com.onboarding.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "onboarding.coordinator")
public class CoordinatorProperties {

    /** Prefix of generated mission ids, e.g. ONBD-2026-0001. */
    private String missionIdPrefix = "ONBD";

    /** Missions that may run concurrently. */
    private int executorThreads = 8;

    /** How long finished missions stay queryable; zero keeps them for the life of the process. */
    private Duration missionRetention = Duration.ofHours(24);

    public String getMissionIdPrefix() {
        return missionIdPrefix;
    }

    public void setMissionIdPrefix(String missionIdPrefix) {
        this.missionIdPrefix = missionIdPrefix;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public Duration getMissionRetention() {
        return missionRetention;
    }

    public void setMissionRetention(Duration missionRetention) {
        this.missionRetention = missionRetention;
    }
}
