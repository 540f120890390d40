package com.advisoryplatform.common.shape;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guiderail over raw peer payloads: reports whether a payload carries the minimal
 * assertion contract, and why not when it does not.
 *
 * <p>Contract checked (presence only):
 * <ul>
 *   <li>assertion text at one of {@link PayloadFields#ASSERTION_PATHS}</li>
 *   <li>confidence number at one of {@link PayloadFields#CONFIDENCE_PATHS}</li>
 * </ul>
 *
 * <p>The payload is never mutated, coerced or defaulted. Callers decide whether to skip
 * ingestion; this class only makes the divergence observable.
 */
public final class ShapeGuide {

    public static final String CONFORMING          = "conforming assertion";
    public static final String NOT_AN_OBJECT       = "non_conforming assertion: not a JSON object";
    public static final String MISSING_BOTH        = "non_conforming assertion: missing assertion and confidence";
    public static final String MISSING_ASSERTION   = "non_conforming assertion: missing assertion";
    public static final String MISSING_CONFIDENCE  = "non_conforming assertion: missing confidence";

    private static final List<String> HINT_KEYS = List.of("core_name", "assertion_id", "timestamp");

    private ShapeGuide() {}

    public static ShapeObservation observe(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return ShapeObservation.rejected(NOT_AN_OBJECT, Map.of());
        }

        Map<String, Object> hints = new LinkedHashMap<>();
        for (String key : HINT_KEYS) {
            if (payload.has(key)) {
                hints.put(key, PayloadFields.toPlain(payload.get(key)));
            }
        }

        boolean assertionPresent  = PayloadFields.firstText(payload, PayloadFields.ASSERTION_PATHS).isPresent();
        boolean confidencePresent = PayloadFields.firstNumber(payload, PayloadFields.CONFIDENCE_PATHS).isPresent();

        if (!assertionPresent && !confidencePresent) {
            return ShapeObservation.rejected(MISSING_BOTH, hints);
        }
        if (!assertionPresent) {
            return ShapeObservation.rejected(MISSING_ASSERTION, hints);
        }
        if (!confidencePresent) {
            return ShapeObservation.rejected(MISSING_CONFIDENCE, hints);
        }
        return ShapeObservation.accepted(hints);
    }
}
