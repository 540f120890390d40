package com.advisoryplatform.common.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copy helpers for the loosely typed {@code Map<String, Object>} payloads that travel
 * through verdict metadata, audit derivation metadata and hub events.
 *
 * <p>Nested maps and collections are copied recursively into unmodifiable containers,
 * preserving insertion order. {@code null} values are kept (JSON payloads may carry them),
 * which is why {@link Map#copyOf} is not used here. Scalars are shared as-is.
 */
public final class Immutables {

    private Immutables() {}

    /**
     * @param source map to copy (may be null)
     * @return an unmodifiable deep copy; empty map for {@code null}
     */
    public static Map<String, Object> deepCopy(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, copyValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(copyValue(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
