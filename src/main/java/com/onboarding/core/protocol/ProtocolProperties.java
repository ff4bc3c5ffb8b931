package com.onboarding.core.protocol;

import com.onboarding.core.model.StepSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "onboarding.protocol")
public class ProtocolProperties {

    /** "memory" or "jdbc". */
    private String store = "memory";

    /** Chat space used by generated protocols; {project} is replaced by the project id. */
    private String defaultChatSpace = "spaces/{project}-GENERAL";

    private String chatTargetSystem = "google-chat";

    private String assignmentTargetSystem = "enterprise-allocation";

    /** Longest protocol a store accepts; also bounds graph iterations per mission. */
    private int maxSteps = ProtocolValidator.DEFAULT_MAX_STEPS;

    /** Protocols written at startup, keyed by project id. */
    private Map<String, List<SeedStep>> seeds = new LinkedHashMap<>();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getDefaultChatSpace() {
        return defaultChatSpace;
    }

    public void setDefaultChatSpace(String defaultChatSpace) {
        this.defaultChatSpace = defaultChatSpace;
    }

    public String getChatTargetSystem() {
        return chatTargetSystem;
    }

    public void setChatTargetSystem(String chatTargetSystem) {
        this.chatTargetSystem = chatTargetSystem;
    }

    public String getAssignmentTargetSystem() {
        return assignmentTargetSystem;
    }

    public void setAssignmentTargetSystem(String assignmentTargetSystem) {
        this.assignmentTargetSystem = assignmentTargetSystem;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public Map<String, List<SeedStep>> getSeeds() {
        return seeds;
    }

    public void setSeeds(Map<String, List<SeedStep>> seeds) {
        this.seeds = seeds;
    }

    public static class SeedStep {
        private String kind;
        private String targetSystem;
        private Map<String, String> parameters = new LinkedHashMap<>();
        private boolean fatalOnFailure;

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }
        public String getTargetSystem() { return targetSystem; }
        public void setTargetSystem(String targetSystem) { this.targetSystem = targetSystem; }
        public Map<String, String> getParameters() { return parameters; }
        public void setParameters(Map<String, String> parameters) { this.parameters = parameters; }
        public boolean isFatalOnFailure() { return fatalOnFailure; }
        public void setFatalOnFailure(boolean fatalOnFailure) { this.fatalOnFailure = fatalOnFailure; }

        public StepSpec toStepSpec() {
            return new StepSpec(kind, targetSystem, parameters, fatalOnFailure);
        }
    }

    static List<StepSpec> toStepSpecs(List<SeedStep> seedSteps) {
        var steps = new ArrayList<StepSpec>();
        for (SeedStep seed : seedSteps) {
            steps.add(seed.toStepSpec());
        }
        return steps;
    }
}
