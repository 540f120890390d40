package com.advisoryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable output of a {@link com.advisoryplatform.common.consensus.ConsensusAdvisor} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code dominantVerdict}      : verdict of the highest-confidence peer; {@code null} when no input</li>
 *   <li>{@code softmaxProbabilities} : per-peer softmax weight, in input order</li>
 *   <li>{@code outlierDetected}      : core name flagged by the IQR test, or {@code null}</li>
 *   <li>{@code confidenceClustering} : cohesion class of the verdict set</li>
 *   <li>{@code consensusLevel}       : agreement strength in [0.0, 1.0], 4 decimals</li>
 *   <li>{@code recommendation}       : advisory action derived from consensus + outlier only</li>
 *   <li>{@code verdictDistribution}  : vote count per verdict string, first-seen order</li>
 *   <li>{@code effectiveEntropy}     : normalized entropy of verdict-level mass in [0.0, 1.0]</li>
 *   <li>{@code explanation}          : short human-readable summary</li>
 * </ul>
 *
 * <p>The signal carries no identity and no timestamp: equal inputs give equal signals.
 */
public record AdvisorySignal(
    @JsonProperty("dominant_verdict")      String dominantVerdict,
    @JsonProperty("softmax_probabilities") List<PeerProbability> softmaxProbabilities,
    @JsonProperty("outlier_detected")      String outlierDetected,
    @JsonProperty("confidence_clustering") ConfidenceClustering confidenceClustering,
    @JsonProperty("consensus_level")       double consensusLevel,
    @JsonProperty("recommendation")        AdvisoryRecommendation recommendation,
    @JsonProperty("verdict_distribution")  Map<String, Integer> verdictDistribution,
    @JsonProperty("effective_entropy")     double effectiveEntropy,
    @JsonProperty("explanation")           String explanation
) {
    public AdvisorySignal {
        if (consensusLevel < 0.0 || consensusLevel > 1.0 || Double.isNaN(consensusLevel)) {
            throw new IllegalArgumentException("consensusLevel must be in [0.0, 1.0], got " + consensusLevel);
        }
        softmaxProbabilities = softmaxProbabilities == null ? List.of() : List.copyOf(softmaxProbabilities);
        verdictDistribution  = verdictDistribution == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(verdictDistribution));
    }

    @JsonIgnore
    public Optional<String> outlier() {
        return Optional.ofNullable(outlierDetected);
    }

    @JsonIgnore
    public double probabilitySum() {
        return softmaxProbabilities.stream().mapToDouble(PeerProbability::probability).sum();
    }
}
