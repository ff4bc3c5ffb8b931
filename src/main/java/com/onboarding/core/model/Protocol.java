package com.onboarding.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A versioned onboarding protocol for one project.
 * <p>
 * Never edited in place: a replacement is stored as a new version so missions
 * that already bound an older version keep a consistent step list.
 *
 * @param projectId the project this protocol belongs to
 * @param steps     ordered steps; execution follows list order
 * @param version   1 on creation, incremented by every replacement
 * @param createdBy employee id (or "system") that caused this version
 * @param createdAt when this version was written
 */
public record Protocol(
    String projectId,
    List<StepSpec> steps,
    int version,
    String createdBy,
    Instant createdAt
) implements Serializable {

    public Protocol {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public int stepCount() {
        return steps.size();
    }
}
