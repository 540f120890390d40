package com.advisoryplatform.orchestrator.audit;

import com.advisoryplatform.common.model.AdvisorySignal;
import com.advisoryplatform.common.support.Immutables;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One recorded advisory. Created once by {@link AuditMatrix#record}, never edited.
 *
 * <p>{@code entryHash} is the SHA-256 of the entry content together with {@code previousHash},
 * so any change to a retained entry breaks {@link AuditMatrix#verifyChain()}.
 */
public record AuditEntry(
    @JsonProperty("sequence_number")     long sequenceNumber,
    @JsonProperty("timestamp")           Instant timestamp,
    @JsonProperty("decision_context")    String decisionContext,
    @JsonProperty("advisory")            AdvisorySignal advisory,
    @JsonProperty("verdict_sources")     List<String> verdictSources,
    @JsonProperty("derivation_metadata") Map<String, Object> derivationMetadata,
    @JsonProperty("previous_hash")       String previousHash,
    @JsonProperty("entry_hash")          String entryHash
) {
    public AuditEntry {
        verdictSources     = verdictSources == null ? List.of() : List.copyOf(verdictSources);
        derivationMetadata = Immutables.deepCopy(derivationMetadata);
    }
}
