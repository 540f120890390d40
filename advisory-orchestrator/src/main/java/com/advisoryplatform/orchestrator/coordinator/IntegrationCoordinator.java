package com.advisoryplatform.orchestrator.coordinator;

import com.advisoryplatform.common.consensus.ConsensusAdvisor;
import com.advisoryplatform.common.model.AdvisoryRecommendation;
import com.advisoryplatform.common.model.AdvisorySignal;
import com.advisoryplatform.common.model.ConfidenceClustering;
import com.advisoryplatform.common.model.Verdict;
import com.advisoryplatform.common.trace.TraceContextUtil;
import com.advisoryplatform.orchestrator.acquirer.AcquisitionReport;
import com.advisoryplatform.orchestrator.acquirer.PeerOutcome;
import com.advisoryplatform.orchestrator.acquirer.VerdictAcquirer;
import com.advisoryplatform.orchestrator.audit.AuditEntry;
import com.advisoryplatform.orchestrator.audit.AuditMatrix;
import com.advisoryplatform.orchestrator.audit.AuditSummary;
import com.advisoryplatform.orchestrator.hub.PeerAvailability;
import com.advisoryplatform.orchestrator.hub.StateHub;
import com.advisoryplatform.orchestrator.logger.AdvisoryFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one advisory cycle and translates advisories into suggested actions.
 *
 * <p>{@link #advise}: acquire verdicts → update peer availability in the hub → compute the
 * advisory → record it in the audit matrix → return it. {@link #interpret}: map the
 * recommendation to an action label and, when a target peer can be inferred from the
 * decision context, record an attributed control intent in the hub.
 *
 * <p>The advisory is never authoritative and nothing is dispatched from here.
 */
@Service
public class IntegrationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IntegrationCoordinator.class);

    static final String ADVISORY_SOURCE = "softmax_consensus";

    private final VerdictAcquirer    verdictAcquirer;
    private final ConsensusAdvisor   consensusAdvisor;
    private final AuditMatrix        auditMatrix;
    private final StateHub           stateHub;
    private final PeerInferrer       peerInferrer;
    private final AdvisoryFlowLogger flowLogger;
    private final Duration           peerTimeout;

    public IntegrationCoordinator(VerdictAcquirer verdictAcquirer,
                                  ConsensusAdvisor consensusAdvisor,
                                  AuditMatrix auditMatrix,
                                  StateHub stateHub,
                                  PeerInferrer peerInferrer,
                                  AdvisoryFlowLogger flowLogger,
                                  @Value("${advisory.peers.timeout-ms:5000}") long peerTimeoutMs) {
        this.verdictAcquirer  = verdictAcquirer;
        this.consensusAdvisor = consensusAdvisor;
        this.auditMatrix      = auditMatrix;
        this.stateHub         = stateHub;
        this.peerInferrer     = peerInferrer;
        this.flowLogger       = flowLogger;
        this.peerTimeout      = Duration.ofMillis(peerTimeoutMs);
    }

    /**
     * Computes and records an advisory for {@code decisionContext}. Never signals an error
     * for peer failures; an empty verdict set yields {@code ESCALATE_TO_REVIEW}.
     */
    public Mono<AdvisorySignal> advise(String decisionContext) {
        Objects.requireNonNull(decisionContext, "decisionContext");
        String advisoryId = TraceContextUtil.newAdvisoryId();
        flowLogger.logWithAdvisoryId(AdvisoryFlowLogger.ADVISORY_REQUESTED, advisoryId);

        Mono<AdvisorySignal> pipeline = verdictAcquirer.acquire(decisionContext, peerTimeout)
            .doOnEach(flowLogger.stage(AdvisoryFlowLogger.VERDICTS_COLLECTED))
            .map(report -> {
                updatePeerStates(report);

                List<Verdict> verdicts = report.verdicts();
                AdvisorySignal advisory = consensusAdvisor.process(verdicts);
                flowLogger.logAdvisory(advisory, advisoryId);

                AuditEntry entry = auditMatrix.record(decisionContext, advisory, verdicts,
                    derivationMetadata(report, advisoryId));
                flowLogger.logWithAdvisoryId(AdvisoryFlowLogger.AUDIT_RECORDED, advisoryId);

                publishToHub(advisory, entry, advisoryId);
                return advisory;
            });

        return TraceContextUtil.withAdvisoryId(pipeline, advisoryId);
    }

    /**
     * Maps {@code advisory} to a suggested action. When a target peer is inferred from
     * {@code decisionContext}, an attributed control intent is appended to the hub with
     * assertion level {@code command} (consensus &gt; 0.7) or {@code suggestion}.
     */
    public ActionRecommendation interpret(AdvisorySignal advisory, String decisionContext) {
        Objects.requireNonNull(advisory, "advisory");
        String context = decisionContext == null ? "" : decisionContext;

        String action        = actionFor(advisory.recommendation());
        String justification = justificationFor(advisory);

        Optional<String> target = peerInferrer.infer(context);
        AssertionLevel level = null;
        if (target.isPresent()) {
            level = AssertionLevel.forConsensus(advisory.consensusLevel());
            Map<String, Object> packet = new LinkedHashMap<>();
            packet.put("target",                  target.get());
            packet.put("command",                 action);
            packet.put("justification",           justification);
            packet.put("assertion_level",         level.label());
            packet.put("advisory_consensus",      advisory.consensusLevel());
            packet.put("advisory_recommendation", advisory.recommendation().name());
            packet.put("context",                 context);
            stateHub.recordControlAction(packet);
        }

        log.info("[Coordinator] stage={} recommendation={} action={} target={} level={}",
            AdvisoryFlowLogger.ACTION_INTERPRETED, advisory.recommendation(), action,
            target.orElse("none"), level == null ? "none" : level.label());
        return new ActionRecommendation(advisory.recommendation(), advisory.consensusLevel(), context,
            action, justification, target.orElse(null), level);
    }

    /** {@link #advise} followed by {@link #interpret} on the same context. */
    public Mono<ActionRecommendation> adviseAndInterpret(String decisionContext) {
        return advise(decisionContext).map(advisory -> interpret(advisory, decisionContext));
    }

    /** Consensus bands and recommendation counts over the retained audit trail. */
    public AuditSummary statistics() {
        return auditMatrix.summarize();
    }

    // ── mapping ──────────────────────────────────────────────────────────────

    static String actionFor(AdvisoryRecommendation recommendation) {
        return switch (recommendation) {
            case PROCEED               -> "execute_immediately";
            case PROCEED_CAUTIOUSLY    -> "execute_with_monitoring";
            case PAUSE_AND_VERIFY      -> "defer_and_validate";
            case ESCALATE_TO_REVIEW    -> "escalate_for_manual_review";
            case OUTLIER_INVESTIGATION -> "investigate_outlier";
        };
    }

    static String justificationFor(AdvisorySignal advisory) {
        return switch (advisory.recommendation()) {
            case PROCEED               -> "High consensus across peers";
            case PROCEED_CAUTIOUSLY    -> "Moderate consensus, proceed with increased observation";
            case PAUSE_AND_VERIFY      -> String.format(Locale.ROOT,
                "Weak consensus (%.2f), validate inputs", advisory.consensusLevel());
            case ESCALATE_TO_REVIEW    -> "Significant disagreement among peers";
            case OUTLIER_INVESTIGATION -> "Statistical outlier detected: " + advisory.outlier().orElse("unknown");
        };
    }

    // ── hub & audit bookkeeping ──────────────────────────────────────────────

    private void updatePeerStates(AcquisitionReport report) {
        for (PeerOutcome outcome : report.outcomes()) {
            if (outcome.status() == PeerOutcome.Status.RESPONDED) {
                Verdict verdict = outcome.verdict();
                Map<String, Object> assertion = new LinkedHashMap<>();
                assertion.put("verdict",    verdict.verdict());
                assertion.put("confidence", verdict.confidence());
                assertion.put("metadata",   verdict.metadata());
                stateHub.updatePeerAvailability(outcome.coreName(), PeerAvailability.AVAILABLE, assertion);
            } else if (outcome.status().answered()) {
                stateHub.updatePeerAvailability(outcome.coreName(), PeerAvailability.SILENT, null);
            } else {
                stateHub.updatePeerAvailability(outcome.coreName(), PeerAvailability.UNAVAILABLE, null);
            }
        }
    }

    private Map<String, Object> derivationMetadata(AcquisitionReport report, String advisoryId) {
        Map<String, Object> outcomes = new LinkedHashMap<>();
        report.countsByStatus().forEach((status, count) -> outcomes.put(status.name(), count));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("advisory_id",     advisoryId);
        metadata.put("advisory_source", ADVISORY_SOURCE);
        metadata.put("endpoints",       report.outcomes().size());
        metadata.put("peer_outcomes",   outcomes);
        return metadata;
    }

    private void publishToHub(AdvisorySignal advisory, AuditEntry entry, String advisoryId) {
        boolean diverged = advisory.dominantVerdict() != null
            && (advisory.confidenceClustering() == ConfidenceClustering.CONFLICTED || advisory.outlier().isPresent());
        stateHub.setDivergence(diverged);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type",            "advisory");
        event.put("advisory_id",     advisoryId);
        event.put("audit_sequence",  entry.sequenceNumber());
        event.put("consensus_level", advisory.consensusLevel());
        event.put("recommendation",  advisory.recommendation().name());
        stateHub.recordEvent(event);
    }
}
