package com.advisoryplatform.orchestrator.audit;

/**
 * Result of re-deriving the hash chain over retained audit entries.
 *
 * @param brokenAtSequence sequence number of the first entry that failed, or -1 when intact
 */
public record ChainVerification(boolean intact, int checked, long brokenAtSequence, String reason) {

    static ChainVerification ok(int checked) {
        return new ChainVerification(true, checked, -1L, "intact");
    }

    static ChainVerification broken(int checked, long sequence, String reason) {
        return new ChainVerification(false, checked, sequence, reason);
    }
}
