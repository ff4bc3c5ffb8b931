package com.onboarding.dispatch.cli;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default employee and project used by {@code onboarding onboard} when no options are given.
 */
@Component
@ConfigurationProperties(prefix = "onboarding.trigger")
public class TriggerProperties {

    private String employeeId = "";
    private String projectId = "";

    public String getEmployeeId() {
        return employeeId;
    }

    public void setEmployeeId(String employeeId) {
        this.employeeId = employeeId;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }
}
