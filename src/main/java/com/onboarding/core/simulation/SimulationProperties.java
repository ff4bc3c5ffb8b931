package com.onboarding.core.simulation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for the simulated downstream systems used when no real
 * integrations are wired in.
 */
@Component
@ConfigurationProperties(prefix = "onboarding.simulation")
public class SimulationProperties {

    private boolean enabled = true;

    /** Service account the simulated chat backend accepts. */
    private String authorizedServiceAccountId = "";

    /** Project rosters, keyed by project id. */
    private Map<String, List<RosterEntry>> rosters = new LinkedHashMap<>();

    /** Projects whose allocation lookups behave as if the backend were down. */
    private List<String> unreachableProjects = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAuthorizedServiceAccountId() {
        return authorizedServiceAccountId;
    }

    public void setAuthorizedServiceAccountId(String authorizedServiceAccountId) {
        this.authorizedServiceAccountId = authorizedServiceAccountId;
    }

    public Map<String, List<RosterEntry>> getRosters() {
        return rosters;
    }

    public void setRosters(Map<String, List<RosterEntry>> rosters) {
        this.rosters = rosters;
    }

    public List<String> getUnreachableProjects() {
        return unreachableProjects;
    }

    public void setUnreachableProjects(List<String> unreachableProjects) {
        this.unreachableProjects = unreachableProjects;
    }

    public static class RosterEntry {
        private String email;
        private String role;
        private String status = "Active";

        public RosterEntry() {}

        public RosterEntry(String email, String role, String status) {
            this.email = email;
            this.role = role;
            this.status = status;
        }

        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }

        public boolean isActive() {
            return "Active".equalsIgnoreCase(status);
        }
    }
}
