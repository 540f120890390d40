package com.advisoryplatform.common.shape;

import com.advisoryplatform.common.support.Immutables;

import java.util.Map;

/**
 * Result of {@link ShapeGuide#observe}. {@code hints} holds identifying pass-through fields
 * ({@code core_name}, {@code assertion_id}, {@code timestamp}) for caller-side logging.
 */
public record ShapeObservation(
    boolean conforming,
    String reason,
    Map<String, Object> hints
) {
    public ShapeObservation {
        hints = Immutables.deepCopy(hints);
    }

    static ShapeObservation rejected(String reason, Map<String, Object> hints) {
        return new ShapeObservation(false, reason, hints);
    }

    static ShapeObservation accepted(Map<String, Object> hints) {
        return new ShapeObservation(true, ShapeGuide.CONFORMING, hints);
    }
}
