package com.onboarding.core.provisioning;

/**
 * Result of adding one member to one chat space.
 *
 * @param space        the space resource name (e.g. "spaces/ALPHA-GENERAL")
 * @param outcome      what happened
 * @param resourceName the membership resource name, when one exists
 * @param message      detail from the chat backend
 */
public record ChatMembership(
    String space,
    Outcome outcome,
    String resourceName,
    String message
) {
    public enum Outcome { CREATED, ALREADY_MEMBER, REJECTED }
}
