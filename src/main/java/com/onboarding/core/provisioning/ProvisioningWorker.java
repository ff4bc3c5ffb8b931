package com.onboarding.core.provisioning;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.StepOutcome;
import com.onboarding.core.model.StepSpec;

/**
 * Executes one idempotent provisioning action for a protocol step.
 * <p>
 * A worker serves exactly one step kind. Business failures are returned as
 * {@link StepOutcome#failed}; a downstream system that cannot be reached is
 * signalled with {@link WorkerUnreachableException}, which is the only
 * failure the retry decorator retries.
 */
public interface ProvisioningWorker {

    /**
     * The step kind this worker serves (see {@link com.onboarding.core.model.StepKinds}).
     */
    String kind();

    StepOutcome executeStep(StepSpec step, String employeeId, MissionContext context);
}
