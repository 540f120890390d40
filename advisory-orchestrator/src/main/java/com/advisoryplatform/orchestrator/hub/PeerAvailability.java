package com.advisoryplatform.orchestrator.hub;

/**
 * Last observed reachability of a peer.
 */
public enum PeerAvailability {
    /** Answered with a usable verdict. */
    AVAILABLE,
    /** Answered, but with nothing usable. */
    SILENT,
    /** Did not answer at all. */
    UNAVAILABLE
}
