package com.advisoryplatform.orchestrator.audit;

import com.advisoryplatform.common.model.AdvisoryRecommendation;
import com.advisoryplatform.common.model.ConsensusBucket;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts over the entries an {@link AuditMatrix} currently retains. Every bucket and every
 * recommendation appears, with zero where nothing was recorded.
 */
public record AuditSummary(
    int total,
    Map<ConsensusBucket, Integer> countsByConsensusBucket,
    Map<AdvisoryRecommendation, Integer> countsByRecommendation
) {
    public AuditSummary {
        countsByConsensusBucket = Collections.unmodifiableMap(new EnumMap<>(countsByConsensusBucket));
        countsByRecommendation  = Collections.unmodifiableMap(new EnumMap<>(countsByRecommendation));
    }
}
