package com.onboarding.core.model;

/**
 * Phase of an onboarding mission's state machine.
 */
public enum MissionMode {
    PENDING,
    PROTOCOL_CREATION,
    EXECUTION,
    BLOCKED,         // Assignment denied, about to be marked FAILED
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
