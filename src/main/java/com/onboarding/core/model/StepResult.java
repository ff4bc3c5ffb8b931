package com.onboarding.core.model;

import java.io.Serializable;

/**
 * Outcome recorded for one attempted protocol step.
 *
 * @param stepIndex zero-based position of the step in the bound protocol
 * @param kind      the step kind that was dispatched
 * @param status    terminal status of the attempt
 * @param detail    worker-supplied detail or failure reason
 * @param elapsedMs time spent in the worker call
 */
public record StepResult(
    int stepIndex,
    String kind,
    StepStatus status,
    String detail,
    long elapsedMs
) implements Serializable {

    public boolean failed() {
        return status == StepStatus.FAILURE;
    }
}
