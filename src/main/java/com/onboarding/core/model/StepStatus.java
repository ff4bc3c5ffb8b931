package com.onboarding.core.model;

/**
 * Terminal status of one attempted protocol step.
 */
public enum StepStatus {
    SUCCESS,
    FAILURE,
    SKIPPED
}
