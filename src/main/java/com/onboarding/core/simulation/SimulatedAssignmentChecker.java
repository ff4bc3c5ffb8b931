package com.onboarding.core.simulation;

import com.onboarding.core.assignment.AssignmentChecker;
import com.onboarding.core.assignment.AssignmentUnreachableException;
import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.MissionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * {@link AssignmentChecker} answering from configured project rosters.
 * Emails are compared case-insensitively; only active roster entries are authorized.
 */
@Component
@ConditionalOnProperty(name = "onboarding.simulation.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedAssignmentChecker implements AssignmentChecker {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAssignmentChecker.class);

    private final SimulationProperties properties;

    public SimulatedAssignmentChecker(SimulationProperties properties) {
        this.properties = properties;
    }

    @Override
    public AssignmentVerdict checkAssignment(String employeeId, String projectId, MissionContext context) {
        log.debug("[{}] Checking assignment of {} to {}", context.traceId(), employeeId, projectId);
        if (properties.getUnreachableProjects().contains(projectId)) {
            throw new AssignmentUnreachableException(
                    "Allocation platform unavailable for project " + projectId, context.traceId());
        }

        String email = employeeId.toLowerCase(Locale.ROOT);
        List<SimulationProperties.RosterEntry> roster =
                properties.getRosters().getOrDefault(projectId, List.of());
        var match = roster.stream()
                .filter(entry -> entry.getEmail() != null && entry.getEmail().toLowerCase(Locale.ROOT).equals(email))
                .findFirst();

        if (match.isEmpty()) {
            return AssignmentVerdict.denied("Employee is not currently assigned to project " + projectId);
        }
        var entry = match.get();
        if (!entry.isActive()) {
            return AssignmentVerdict.denied("Assignment to " + projectId + " is " + entry.getStatus());
        }
        return AssignmentVerdict.granted(entry.getRole(),
                "Assignment verified as " + entry.getRole() + " for " + projectId
                        + " (team of " + roster.size() + ")");
    }
}
