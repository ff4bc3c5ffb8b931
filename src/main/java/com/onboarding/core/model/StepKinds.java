package com.onboarding.core.model;

/**
 * Well-known step kinds. Protocols may carry other kinds; those fail at
 * dispatch time when no worker serves them.
 */
public final class StepKinds {

    public static final String ASSIGNMENT_CHECK = "assignment-check";
    public static final String CHAT_PROVISION = "chat-provision";

    private StepKinds() {}
}
