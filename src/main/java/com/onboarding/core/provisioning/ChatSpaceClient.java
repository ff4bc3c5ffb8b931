package com.onboarding.core.provisioning;

import com.onboarding.core.model.MissionContext;

/**
 * Narrow contract to the chat platform's membership API.
 * <p>
 * Rejections (permission denied, unknown space) are returned as
 * {@link ChatMembership.Outcome#REJECTED}; transient unavailability is raised
 * as {@link WorkerUnreachableException}.
 */
public interface ChatSpaceClient {

    ChatMembership addMember(String space, String employeeId, String serviceAccountId, MissionContext context);
}
