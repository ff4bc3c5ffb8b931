package com.onboarding.core.model;

/**
 * What a provisioning worker reports back for one step.
 */
public record StepOutcome(StepStatus status, String detail) {

    public static StepOutcome success(String detail) {
        return new StepOutcome(StepStatus.SUCCESS, detail);
    }

    public static StepOutcome failed(String detail) {
        return new StepOutcome(StepStatus.FAILURE, detail);
    }

    public static StepOutcome skipped(String detail) {
        return new StepOutcome(StepStatus.SKIPPED, detail);
    }
}
