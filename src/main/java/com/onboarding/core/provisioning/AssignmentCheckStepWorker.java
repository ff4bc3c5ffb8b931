package com.onboarding.core.provisioning;

import com.onboarding.core.assignment.AssignmentChecker;
import com.onboarding.core.assignment.AssignmentUnreachableException;
import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.StepKinds;
import com.onboarding.core.model.StepOutcome;
import com.onboarding.core.model.StepSpec;
import org.springframework.stereotype.Component;

/**
 * Serves {@code assignment-check} steps by re-verifying the employee's
 * assignment to the mission's project at the point the step runs.
 */
@Component
public class AssignmentCheckStepWorker implements ProvisioningWorker {

    private final AssignmentChecker assignmentChecker;

    public AssignmentCheckStepWorker(AssignmentChecker assignmentChecker) {
        this.assignmentChecker = assignmentChecker;
    }

    @Override
    public String kind() {
        return StepKinds.ASSIGNMENT_CHECK;
    }

    @Override
    public StepOutcome executeStep(StepSpec step, String employeeId, MissionContext context) {
        AssignmentVerdict verdict;
        try {
            verdict = assignmentChecker.checkAssignment(employeeId, context.projectId(), context);
        } catch (AssignmentUnreachableException e) {
            throw new WorkerUnreachableException(e.getMessage(), context.traceId(), e);
        }
        if (verdict.authorized()) {
            return StepOutcome.success("Assignment verified as " + verdict.role());
        }
        return StepOutcome.failed("Assignment not valid: " + verdict.message());
    }
}
