package com.advisoryplatform.orchestrator.hub;

import com.advisoryplatform.common.support.Immutables;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Attributed record of an intended action. Storing it never dispatches anything.
 *
 * @param actionPayload the control packet as submitted, plus {@code timestamp} when it had none
 * @param timestamp     when the hub stored the entry
 */
public record ControlLogEntry(
    @JsonProperty("action_payload") Map<String, Object> actionPayload,
    @JsonProperty("timestamp")      Instant timestamp
) {
    public ControlLogEntry {
        actionPayload = Immutables.deepCopy(actionPayload);
    }
}
