package com.onboarding.core.engine;

import com.onboarding.core.model.MissionMode;
import com.onboarding.core.model.MissionSignal;

/**
 * Transition table of the onboarding state machine.
 * <pre>
 *   PENDING           --PROTOCOL_FOUND-->      EXECUTION
 *   PENDING           --PROTOCOL_MISSING-->    PROTOCOL_CREATION
 *   PROTOCOL_CREATION --PROTOCOL_READY-->      EXECUTION
 *   EXECUTION         --ACCESS_DENIED-->       BLOCKED
 *   BLOCKED           --BLOCK_RECORDED-->      FAILED
 *   EXECUTION         --FATAL_STEP_FAILED-->   FAILED
 *   EXECUTION         --STEPS_EXHAUSTED-->     COMPLETED
 *   (any non-terminal) --COLLABORATOR_FAILED--> FAILED
 * </pre>
 * Terminal modes accept no signal.
 */
public final class MissionTransitions {

    private MissionTransitions() {}

    /**
     * Returns the mode reached by applying {@code signal} in mode {@code from}.
     *
     * @throws IllegalModeTransitionException if the signal is not valid in {@code from}
     */
    public static MissionMode next(MissionMode from, MissionSignal signal) {
        if (from.isTerminal()) {
            throw new IllegalModeTransitionException(from, signal);
        }
        if (signal == MissionSignal.COLLABORATOR_FAILED) {
            return MissionMode.FAILED;
        }
        MissionMode to = switch (from) {
            case PENDING -> switch (signal) {
                case PROTOCOL_FOUND -> MissionMode.EXECUTION;
                case PROTOCOL_MISSING -> MissionMode.PROTOCOL_CREATION;
                default -> null;
            };
            case PROTOCOL_CREATION -> signal == MissionSignal.PROTOCOL_READY ? MissionMode.EXECUTION : null;
            case EXECUTION -> switch (signal) {
                case ACCESS_DENIED -> MissionMode.BLOCKED;
                case FATAL_STEP_FAILED -> MissionMode.FAILED;
                case STEPS_EXHAUSTED -> MissionMode.COMPLETED;
                default -> null;
            };
            case BLOCKED -> signal == MissionSignal.BLOCK_RECORDED ? MissionMode.FAILED : null;
            default -> null;
        };
        if (to == null) {
            throw new IllegalModeTransitionException(from, signal);
        }
        return to;
    }

    public static boolean isAllowed(MissionMode from, MissionSignal signal) {
        try {
            next(from, signal);
            return true;
        } catch (IllegalModeTransitionException e) {
            return false;
        }
    }
}
