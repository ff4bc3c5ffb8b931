package com.onboarding.core.engine;

import com.onboarding.core.logging.MdcAwareExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the bounded executor that runs submitted missions.
 */
@Configuration
public class MissionExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor missionExecutor(CoordinatorProperties properties) {
        return new MdcAwareExecutor(properties.getExecutorThreads(), "mission");
    }
}
