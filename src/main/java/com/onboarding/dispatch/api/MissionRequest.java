package com.onboarding.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/missions.
 *
 * @param employeeId the employee to onboard (corporate email)
 * @param projectId  the project the employee joins
 */
public record MissionRequest(
    @JsonProperty("employee_id") String employeeId,
    @JsonProperty("project_id") String projectId
) {}
