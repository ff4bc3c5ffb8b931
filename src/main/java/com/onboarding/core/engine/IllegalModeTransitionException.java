package com.onboarding.core.engine;

import com.onboarding.core.model.MissionMode;
import com.onboarding.core.model.MissionSignal;

/**
 * Thrown when a signal is not valid for the mission's current mode.
 */
public class IllegalModeTransitionException extends IllegalStateException {

    private final MissionMode from;
    private final MissionSignal signal;

    public IllegalModeTransitionException(MissionMode from, MissionSignal signal) {
        super("Signal " + signal + " is not valid in mode " + from);
        this.from = from;
        this.signal = signal;
    }

    public MissionMode getFrom() {
        return from;
    }

    public MissionSignal getSignal() {
        return signal;
    }
}
