package com.onboarding.core.protocol;

import com.onboarding.core.model.StepKinds;
import com.onboarding.core.model.StepSpec;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Synthesizes the minimal protocol written for a project that has none:
 * verify the assignment, then join the project's default chat space.
 * Both steps are fatal.
 */
@Component
public class DefaultProtocolFactory {

    private final ProtocolProperties properties;

    public DefaultProtocolFactory(ProtocolProperties properties) {
        this.properties = properties;
    }

    public List<StepSpec> defaultSteps(String projectId) {
        String space = properties.getDefaultChatSpace().replace("{project}", projectId);
        return List.of(
                new StepSpec(StepKinds.ASSIGNMENT_CHECK, properties.getAssignmentTargetSystem(),
                        Map.of(), true),
                new StepSpec(StepKinds.CHAT_PROVISION, properties.getChatTargetSystem(),
                        Map.of("spaces", space), true));
    }
}
