package com.advisoryplatform.common.consensus;

import com.advisoryplatform.common.model.AdvisorySignal;
import com.advisoryplatform.common.model.Verdict;

import java.util.List;

/**
 * Strategy contract for turning a set of peer verdicts into one advisory signal.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently from any thread</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no I/O</li>
 *   <li><b>Deterministic</b>: the same ordered input gives the same consensus level and recommendation</li>
 *   <li><b>Total</b>: an empty list is valid input and yields {@code ESCALATE_TO_REVIEW}</li>
 * </ul>
 *
 * <p>Current implementation: {@link SoftmaxConsensusAdvisor}. Register a different
 * implementation as a Spring {@code @Bean} in {@code OrchestratorConfig} to swap it.
 */
public interface ConsensusAdvisor {

    /**
     * @param verdicts non-null list of normalized verdicts, in acquisition order
     * @return a fresh {@link AdvisorySignal}; never {@code null}
     */
    AdvisorySignal process(List<Verdict> verdicts);
}
