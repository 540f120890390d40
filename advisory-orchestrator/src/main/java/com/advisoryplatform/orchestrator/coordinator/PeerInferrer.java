package com.advisoryplatform.orchestrator.coordinator;

import java.util.Optional;

/**
 * Names the peer a decision context is primarily about, if any.
 * Implementations must be side-effect free.
 */
@FunctionalInterface
public interface PeerInferrer {

    Optional<String> infer(String decisionContext);
}
