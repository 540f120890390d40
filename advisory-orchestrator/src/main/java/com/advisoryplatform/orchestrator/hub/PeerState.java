package com.advisoryplatform.orchestrator.hub;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Mutable per-peer record held inside {@link StateHub}. Only the hub mutates instances,
 * under its lock; everything handed out is a {@link #copy()}.
 *
 * <p>{@code lastAssertion} is always an unmodifiable map, so copies may share it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeerState {

    private String coreName;
    private PeerAvailability availability;
    private Map<String, Object> lastAssertion;
    private Instant lastSeen;

    public PeerState copy() {
        return new PeerState(coreName, availability, lastAssertion, lastSeen);
    }
}
