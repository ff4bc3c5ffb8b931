package com.onboarding.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A mode the mission entered, with the time it entered it.
 */
public record ModeChange(MissionMode mode, Instant at) implements Serializable {}
