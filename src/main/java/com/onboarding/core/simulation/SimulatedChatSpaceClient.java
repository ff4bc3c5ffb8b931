package com.onboarding.core.simulation;

import com.onboarding.core.model.MissionContext;
import com.onboarding.core.provisioning.ChatMembership;
import com.onboarding.core.provisioning.ChatSpaceClient;
import com.onboarding.core.provisioning.WorkerUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ChatSpaceClient}.
 * <p>
 * Behaviour is driven by the space name: {@code spaces/FAIL_TRANSIENT*} is
 * unreachable, {@code spaces/FAIL_PERMANENT*} does not exist. Calls made as
 * any service account other than the authorized one are rejected. Repeated
 * adds of the same member report {@code ALREADY_MEMBER}.
 */
@Component
@ConditionalOnProperty(name = "onboarding.simulation.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedChatSpaceClient implements ChatSpaceClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedChatSpaceClient.class);

    static final String TRANSIENT_FAILURE_PREFIX = "spaces/FAIL_TRANSIENT";
    static final String PERMANENT_FAILURE_PREFIX = "spaces/FAIL_PERMANENT";

    private final SimulationProperties properties;
    private final Set<String> memberships = ConcurrentHashMap.newKeySet();

    public SimulatedChatSpaceClient(SimulationProperties properties) {
        this.properties = properties;
    }

    @Override
    public ChatMembership addMember(String space, String employeeId, String serviceAccountId,
                                    MissionContext context) {
        String authorized = properties.getAuthorizedServiceAccountId();
        if (!authorized.equals(serviceAccountId)) {
            log.warn("[{}] Rejected chat call as '{}' (expected '{}')", context.traceId(), serviceAccountId, authorized);
            return new ChatMembership(space, ChatMembership.Outcome.REJECTED, null,
                    "identity mismatch, must act as " + authorized);
        }
        if (space.startsWith(TRANSIENT_FAILURE_PREFIX)) {
            throw new WorkerUnreachableException("Chat service temporarily unavailable for " + space,
                    context.traceId());
        }
        if (space.startsWith(PERMANENT_FAILURE_PREFIX)) {
            return new ChatMembership(space, ChatMembership.Outcome.REJECTED, null, "space not found");
        }

        String member = employeeId.toLowerCase(Locale.ROOT);
        String resourceName = space + "/members/" + member;
        if (!memberships.add(resourceName)) {
            return new ChatMembership(space, ChatMembership.Outcome.ALREADY_MEMBER, resourceName,
                    "membership already exists");
        }
        log.info("[{}] Added {} to {}", context.traceId(), member, space);
        return new ChatMembership(space, ChatMembership.Outcome.CREATED, resourceName, "membership created");
    }

    public boolean isMember(String space, String employeeId) {
        return memberships.contains(space + "/members/" + employeeId.toLowerCase(Locale.ROOT));
    }
}
