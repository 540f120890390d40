package com.advisoryplatform.orchestrator.logger;

import com.advisoryplatform.common.model.AdvisorySignal;
import com.advisoryplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the advisory lifecycle. Pure side effects; no pipeline behaviour.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #ADVISORY_REQUESTED}: coordinator received a decision context</li>
 *   <li>{@link #VERDICTS_COLLECTED}: acquisition cycle finished</li>
 *   <li>{@link #ADVISORY_COMPUTED}: consensus advisor produced a signal</li>
 *   <li>{@link #AUDIT_RECORDED}: entry appended to the audit matrix</li>
 *   <li>{@link #ACTION_INTERPRETED}: advisory mapped to a suggested action</li>
 * </ol>
 *
 * <p>With {@code doOnEach} the advisory id comes from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(AdvisoryFlowLogger.VERDICTS_COLLECTED))
 * </pre>
 */
@Component
public class AdvisoryFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryFlowLogger.class);

    public static final String ADVISORY_REQUESTED = "ADVISORY_REQUESTED";
    public static final String VERDICTS_COLLECTED = "VERDICTS_COLLECTED";
    public static final String ADVISORY_COMPUTED  = "ADVISORY_COMPUTED";
    public static final String AUDIT_RECORDED     = "AUDIT_RECORDED";
    public static final String ACTION_INTERPRETED = "ACTION_INTERPRETED";

    /**
     * @return a consumer for {@code doOnEach}; fires on {@code onNext} only
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String advisoryId = TraceContextUtil.getAdvisoryId(signal.getContextView());
            logWithAdvisoryId(stageName, advisoryId);
        };
    }

    public void logWithAdvisoryId(String stageName, String advisoryId) {
        TraceContextUtil.withMdc(advisoryId, () ->
            log.info("[AdvisoryFlow] stage={} advisoryId={}", stageName, advisoryId)
        );
    }

    /**
     * Compact one-line summary of a computed advisory.
     */
    public void logAdvisory(AdvisorySignal advisory, String advisoryId) {
        TraceContextUtil.withMdc(advisoryId, () ->
            log.info("[AdvisoryFlow] stage={} dominant={} consensus={} clustering={} outlier={} "
                     + "recommendation={} advisoryId={}",
                     ADVISORY_COMPUTED,
                     advisory.dominantVerdict(), advisory.consensusLevel(),
                     advisory.confidenceClustering(),
                     advisory.outlier().orElse("none"),
                     advisory.recommendation(), advisoryId)
        );
    }
}
