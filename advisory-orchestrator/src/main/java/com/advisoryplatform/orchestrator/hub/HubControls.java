package com.advisoryplatform.orchestrator.hub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator-facing intake and routing switches held by {@link StateHub}.
 *
 * @param accepting   whether new work is accepted
 * @param routingMode routing per downstream system, e.g. {@code DALS -> via_dals}
 */
public record HubControls(boolean accepting, Map<String, String> routingMode) {

    public static final String DEFAULT_ROUTING = "via_dals";

    public HubControls {
        routingMode = Collections.unmodifiableMap(new LinkedHashMap<>(routingMode));
    }

    static HubControls defaults(List<String> systems) {
        Map<String, String> routing = new LinkedHashMap<>();
        systems.forEach(name -> routing.put(name, DEFAULT_ROUTING));
        return new HubControls(true, routing);
    }

    HubControls merge(Boolean newAccepting, Map<String, String> routingUpdate) {
        Map<String, String> routing = new LinkedHashMap<>(routingMode);
        if (routingUpdate != null) {
            routing.putAll(routingUpdate);
        }
        return new HubControls(newAccepting == null ? accepting : newAccepting, routing);
    }
}
