package com.advisoryplatform.orchestrator.hub;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the hub. Nothing in it is shared with the live hub state.
 *
 * @param updatedAt time of the last state change, or {@code null} when nothing was written yet
 * @param systems   merged status per downstream system
 */
public record HubSnapshot(
    Instant updatedAt,
    Map<String, PeerState> peers,
    List<HubEvent> events,
    boolean divergence,
    Map<String, Map<String, Object>> systems,
    HubControls controls
) {}
