package com.advisoryplatform.orchestrator.acquirer;

import com.advisoryplatform.common.model.Verdict;

import java.util.Optional;

/**
 * What happened when one peer was asked for its verdict.
 *
 * <p>Only {@link Status#RESPONDED} carries a verdict. The other statuses keep silence
 * (the peer answered with nothing usable) apart from unavailability (no answer at all)
 * for logging and hub bookkeeping; advisory callers see neither.
 */
public record PeerOutcome(
    String  coreName,
    String  url,
    Status  status,
    String  detail,
    Verdict verdict
) {

    public enum Status {
        /** Conforming payload; verdict extracted. */
        RESPONDED,
        /** 2xx with an empty body. */
        SILENT,
        /** 2xx with a body that is not JSON. */
        MALFORMED,
        /** Non-2xx status. */
        REJECTED,
        /** Connection failure or timeout. */
        UNREACHABLE,
        /** JSON payload refused by the shape guide or the extraction table. */
        NON_CONFORMING;

        /** The peer process answered, whatever the quality of the answer. */
        public boolean answered() {
            return this != UNREACHABLE;
        }
    }

    static PeerOutcome responded(PeerEndpoint endpoint, Verdict verdict, String rule) {
        return new PeerOutcome(verdict.coreName(), endpoint.url(), Status.RESPONDED, "rule=" + rule, verdict);
    }

    static PeerOutcome failed(PeerEndpoint endpoint, Status status, String detail) {
        return new PeerOutcome(endpoint.coreName(), endpoint.url(), status, detail, null);
    }

    public Optional<Verdict> verdictIfAny() {
        return Optional.ofNullable(verdict);
    }
}
