package com.onboarding.core.model;

import java.io.Serializable;

/**
 * Result of checking an employee's assignment to a project.
 *
 * @param authorized whether the employee may be onboarded to the project
 * @param role       the assigned role, or "Unassigned" when denied
 * @param message    human-readable explanation from the checker
 */
public record AssignmentVerdict(
    boolean authorized,
    String role,
    String message
) implements Serializable {

    public static AssignmentVerdict granted(String role, String message) {
        return new AssignmentVerdict(true, role, message);
    }

    public static AssignmentVerdict denied(String message) {
        return new AssignmentVerdict(false, "Unassigned", message);
    }
}
