package com.advisoryplatform.orchestrator.acquirer;

import com.advisoryplatform.common.model.Verdict;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One collection cycle: an outcome per discovered endpoint, in discovery order.
 */
public record AcquisitionReport(List<PeerOutcome> outcomes) {

    public AcquisitionReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static AcquisitionReport empty() {
        return new AcquisitionReport(List.of());
    }

    /** Verdicts of responding peers, in discovery order. */
    public List<Verdict> verdicts() {
        return outcomes.stream()
            .map(PeerOutcome::verdictIfAny)
            .flatMap(Optional::stream)
            .toList();
    }

    public Map<PeerOutcome.Status, Integer> countsByStatus() {
        Map<PeerOutcome.Status, Integer> counts = new EnumMap<>(PeerOutcome.Status.class);
        for (PeerOutcome outcome : outcomes) {
            counts.merge(outcome.status(), 1, Integer::sum);
        }
        return counts;
    }
}
