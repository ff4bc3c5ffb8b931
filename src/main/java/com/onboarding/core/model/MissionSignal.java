package com.onboarding.core.model;

/**
 * Observations the coordinator feeds into the mission state machine.
 */
public enum MissionSignal {
    PROTOCOL_FOUND,
    PROTOCOL_MISSING,
    PROTOCOL_READY,
    ACCESS_DENIED,
    BLOCK_RECORDED,
    FATAL_STEP_FAILED,
    STEPS_EXHAUSTED,
    COLLABORATOR_FAILED
}
