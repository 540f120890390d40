package com.advisoryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cohesion of a verdict set: how far the peers agree on the verdict string and how tightly
 * their confidences sit together. Serialized in lower case.
 */
public enum ConfidenceClustering {
    UNANIMOUS,
    STRONG,
    MODERATE,
    FRAGMENTED,
    CONFLICTED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
