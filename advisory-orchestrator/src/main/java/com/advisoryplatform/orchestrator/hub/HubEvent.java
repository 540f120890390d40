package com.advisoryplatform.orchestrator.hub;

import com.advisoryplatform.common.support.Immutables;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Attributed event as stored by {@link StateHub}. {@code payload} always carries a
 * {@code timestamp} field.
 */
public record HubEvent(
    @JsonProperty("recorded_at") Instant recordedAt,
    @JsonProperty("payload")     Map<String, Object> payload
) {
    public HubEvent {
        payload = Immutables.deepCopy(payload);
    }

    public String type() {
        Object type = payload.get("type");
        return type == null ? null : type.toString();
    }
}
