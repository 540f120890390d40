package com.advisoryplatform.orchestrator.coordinator;

import com.advisoryplatform.common.model.AdvisoryRecommendation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Suggested action derived from an advisory. Never executed by this service.
 *
 * @param targetPeer     peer inferred from the decision context, or {@code null}
 * @param assertionLevel level of the recorded control intent; {@code null} when no target was inferred
 */
public record ActionRecommendation(
    @JsonProperty("recommendation")       AdvisoryRecommendation recommendation,
    @JsonProperty("advisory_confidence")  double advisoryConfidence,
    @JsonProperty("context")              String context,
    @JsonProperty("action")               String action,
    @JsonProperty("action_justification") String justification,
    @JsonProperty("target_peer")          String targetPeer,
    @JsonProperty("assertion_level")      AssertionLevel assertionLevel
) {
    public Optional<String> target() {
        return Optional.ofNullable(targetPeer);
    }
}
