package com.onboarding.core.provisioning;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.StepKinds;
import com.onboarding.core.model.StepOutcome;
import com.onboarding.core.model.StepSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Serves {@code chat-provision} steps: adds the employee to every space named
 * in the comma-separated {@code spaces} parameter, acting as the configured
 * service account.
 * <p>
 * Any rejected space fails the step. When the employee was already a member
 * of every space the step is reported as skipped.
 */
@Component
public class ChatSpaceProvisioningWorker implements ProvisioningWorker {

    private static final Logger log = LoggerFactory.getLogger(ChatSpaceProvisioningWorker.class);

    static final String SPACES_PARAMETER = "spaces";

    private final ChatSpaceClient chatSpaceClient;
    private final ChatProvisioningProperties properties;

    public ChatSpaceProvisioningWorker(ChatSpaceClient chatSpaceClient, ChatProvisioningProperties properties) {
        this.chatSpaceClient = chatSpaceClient;
        this.properties = properties;
    }

    @Override
    public String kind() {
        return StepKinds.CHAT_PROVISION;
    }

    @Override
    public StepOutcome executeStep(StepSpec step, String employeeId, MissionContext context) {
        List<String> spaces = parseSpaces(step.parameter(SPACES_PARAMETER));
        if (spaces.isEmpty()) {
            return StepOutcome.failed("No chat spaces configured for step");
        }

        int created = 0;
        List<String> rejected = new ArrayList<>();
        for (String space : spaces) {
            ChatMembership membership = chatSpaceClient.addMember(
                    space, employeeId, properties.getServiceAccountId(), context);
            switch (membership.outcome()) {
                case CREATED -> created++;
                case ALREADY_MEMBER -> log.debug("{} already a member of {}", employeeId, space);
                case REJECTED -> rejected.add(space + " (" + membership.message() + ")");
            }
        }

        if (!rejected.isEmpty()) {
            return StepOutcome.failed("Chat provisioning rejected for " + String.join(", ", rejected));
        }
        if (created == 0) {
            return StepOutcome.skipped("Already a member of " + spaces.size() + " space(s)");
        }
        return StepOutcome.success("Added to " + created + " of " + spaces.size() + " space(s)");
    }

    static List<String> parseSpaces(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
