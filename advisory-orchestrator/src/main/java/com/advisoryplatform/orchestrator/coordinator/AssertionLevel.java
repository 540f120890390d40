package com.advisoryplatform.orchestrator.coordinator;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Strength attached to a recorded control intent.
 */
public enum AssertionLevel {
    COMMAND,
    SUGGESTION;

    /** Consensus strictly above this records a {@link #COMMAND}. */
    public static final double COMMAND_THRESHOLD = 0.7;

    public static AssertionLevel forConsensus(double consensusLevel) {
        return consensusLevel > COMMAND_THRESHOLD ? COMMAND : SUGGESTION;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
