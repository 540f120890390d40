package com.advisoryplatform.common.model;

import com.advisoryplatform.common.support.Immutables;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A single peer's normalized assertion for one decision context.
 *
 * <p>Confidence is clamped to [0.0, 1.0] on construction; NaN is rejected because there is
 * no value it could be clamped to without inventing data. Metadata is an unmodifiable deep
 * copy of whatever the peer sent beyond the required fields.
 */
public record Verdict(
    @JsonProperty("core_name")  String coreName,
    @JsonProperty("verdict")    String verdict,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("metadata")   Map<String, Object> metadata
) {
    public Verdict {
        if (coreName == null || coreName.isBlank()) {
            throw new IllegalArgumentException("coreName must be a non-blank string");
        }
        if (verdict == null || verdict.isBlank()) {
            throw new IllegalArgumentException("verdict must be a non-blank string");
        }
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence cannot be NaN. core=" + coreName);
        }
        confidence = clamp(confidence);
        metadata   = Immutables.deepCopy(metadata);
    }

    public static Verdict of(String coreName, String verdict, double confidence) {
        return new Verdict(coreName, verdict, confidence, Map.of());
    }

    public static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
