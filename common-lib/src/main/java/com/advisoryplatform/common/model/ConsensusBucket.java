package com.advisoryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse banding of a consensus level, used when summarizing recorded advisories.
 *
 * <pre>
 *   consensus ≥ 0.90 → UNANIMOUS
 *   consensus ≥ 0.75 → STRONG
 *   consensus ≥ 0.60 → MODERATE
 *   consensus ≥ 0.40 → FRAGMENTED
 *   otherwise        → CONFLICTED
 * </pre>
 */
public enum ConsensusBucket {
    UNANIMOUS(0.90),
    STRONG(0.75),
    MODERATE(0.60),
    FRAGMENTED(0.40),
    CONFLICTED(0.0);

    private final double floor;

    ConsensusBucket(double floor) {
        this.floor = floor;
    }

    public double floor() {
        return floor;
    }

    public static ConsensusBucket of(double consensusLevel) {
        for (ConsensusBucket bucket : values()) {
            if (consensusLevel >= bucket.floor) {
                return bucket;
            }
        }
        return CONFLICTED;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
