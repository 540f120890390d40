package com.advisoryplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactive tracing helper for advisory cycles.
 *
 * <p>Every {@code advise} call gets an advisory id. The Reactor Context holds it for the
 * whole pipeline; MDC only ever sees it for the duration of a single log statement, so no
 * id leaks onto a pooled thread.
 *
 * <p>Usage when assembling a cycle:
 * <pre>
 *     return TraceContextUtil.withAdvisoryId(pipeline, advisoryId);
 * </pre>
 *
 * <p>Usage inside a pipeline stage:
 * <pre>
 *     Mono.deferContextual(ctx -> {
 *         String advisoryId = TraceContextUtil.getAdvisoryId(ctx);
 *         ...
 *     })
 * </pre>
 */
public final class TraceContextUtil {

    public static final String ADVISORY_ID_KEY = "advisoryId";

    private TraceContextUtil() {}

    /**
     * @return a fresh random UUID string, one per advisory cycle
     */
    public static String newAdvisoryId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores the advisory id in the Reactor Context of {@code mono}, where every operator
     * upstream of the write can read it through {@link #getAdvisoryId(ContextView)}.
     *
     * <p>{@code contextWrite} propagates upstream during subscription; call this at the end
     * of pipeline assembly.
     *
     * @param mono       the cycle pipeline
     * @param advisoryId id of the cycle
     * @param <T>        pipeline element type
     * @return the same pipeline with the id in its Reactor Context
     */
    public static <T> Mono<T> withAdvisoryId(Mono<T> mono, String advisoryId) {
        return mono.contextWrite(ctx -> ctx.put(ADVISORY_ID_KEY, advisoryId));
    }

    /**
     * Reads the advisory id from a Reactor {@link ContextView}.
     *
     * @param ctx context from {@code Mono.deferContextual} or {@code Signal.getContextView()}
     * @return the advisory id, or {@code "unknown"} when absent; never {@code null}
     */
    public static String getAdvisoryId(ContextView ctx) {
        return ctx.getOrDefault(ADVISORY_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code advisoryId} into MDC for the duration of {@code logAction}, then removes
     * the entry. Only wrap log statements with this.
     *
     * @param advisoryId id to expose to the log pattern
     * @param logAction  the log statement to run with MDC populated
     */
    public static void withMdc(String advisoryId, Runnable logAction) {
        MDC.put(ADVISORY_ID_KEY, advisoryId);
        try {
            logAction.run();
        } finally {
            MDC.remove(ADVISORY_ID_KEY);
        }
    }
}
