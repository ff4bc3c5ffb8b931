package com.onboarding.core.protocol;

import com.onboarding.core.model.StepSpec;

import java.util.List;

/**
 * Checks a step list before a store accepts it.
 * <p>
 * The step limit also sizes the coordinator graph, which runs one node per
 * step; a stored protocol above the limit could not be executed to the end.
 */
public class ProtocolValidator {

    public static final int DEFAULT_MAX_STEPS = 200;

    private final int maxSteps;

    public ProtocolValidator() {
        this(DEFAULT_MAX_STEPS);
    }

    public ProtocolValidator(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, was " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    /**
     * @throws InvalidProtocolException if the list is missing, too long or contains a null step
     */
    public void validate(String projectId, List<StepSpec> steps) {
        if (steps == null) {
            throw new InvalidProtocolException(projectId, "steps are required");
        }
        if (steps.size() > maxSteps) {
            throw new InvalidProtocolException(projectId,
                    steps.size() + " steps exceed the limit of " + maxSteps);
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) == null) {
                throw new InvalidProtocolException(projectId, "step " + i + " is null");
            }
        }
    }
}
