package com.onboarding.core.assignment;

import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.MissionContext;

/**
 * Looks up an employee's assignment to a project in the enterprise allocation system.
 * <p>
 * A denied assignment is an ordinary verdict with {@code authorized=false};
 * only an unreachable backend raises {@link AssignmentUnreachableException}.
 */
public interface AssignmentChecker {

    AssignmentVerdict checkAssignment(String employeeId, String projectId, MissionContext context);
}
