package com.advisoryplatform.orchestrator.acquirer;

import com.advisoryplatform.common.exception.PeerException;
import com.advisoryplatform.common.model.Verdict;
import com.advisoryplatform.common.shape.ShapeGuide;
import com.advisoryplatform.common.shape.ShapeObservation;
import com.advisoryplatform.common.shape.VerdictExtractor;
import com.advisoryplatform.common.trace.TraceContextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Collects peer verdicts for one decision context.
 *
 * <p>Every discovered endpoint is queried once, all concurrently, each call bounded by the
 * same timeout. Results keep discovery order. A parent deadline of {@code timeout + grace}
 * bounds the whole cycle; when it fires the cycle degrades to an empty report.
 *
 * <p>Nothing is ever synthesized for a failing peer. Unreachable and rejected peers are
 * logged at WARN; silent and non-conforming peers at INFO. Neither {@link #acquire} nor
 * {@link #collect} signals an error.
 */
public class VerdictAcquirer {

    private static final Logger log = LoggerFactory.getLogger(VerdictAcquirer.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration MIN_TIMEOUT     = Duration.ofMillis(100);

    private final WebClient         webClient;
    private final EndpointDiscovery discovery;
    private final ObjectMapper      objectMapper;
    private final Duration          deadlineGrace;

    public VerdictAcquirer(WebClient webClient,
                           EndpointDiscovery discovery,
                           ObjectMapper objectMapper,
                           Duration deadlineGrace) {
        this.webClient     = Objects.requireNonNull(webClient, "webClient");
        this.discovery     = Objects.requireNonNull(discovery, "discovery");
        this.objectMapper  = Objects.requireNonNull(objectMapper, "objectMapper");
        this.deadlineGrace = deadlineGrace == null || deadlineGrace.isNegative() ? Duration.ZERO : deadlineGrace;
    }

    /**
     * Verdicts from responding peers only, in discovery order. Empty when nobody answered.
     */
    public Mono<List<Verdict>> collect(String decisionContext, Duration timeout) {
        return acquire(decisionContext, timeout).map(AcquisitionReport::verdicts);
    }

    /**
     * Full cycle with one {@link PeerOutcome} per endpoint.
     *
     * @param decisionContext opaque context string forwarded to every peer
     * @param timeout         per-call timeout; {@code null} means {@link #DEFAULT_TIMEOUT},
     *                        values below {@link #MIN_TIMEOUT} are raised to it
     */
    public Mono<AcquisitionReport> acquire(String decisionContext, Duration timeout) {
        Objects.requireNonNull(decisionContext, "decisionContext");
        Duration perCall  = normalize(timeout);
        Duration deadline = perCall.plus(deadlineGrace);

        return Mono.deferContextual(ctx -> {
            String advisoryId = TraceContextUtil.getAdvisoryId(ctx);
            return Mono.fromCallable(discovery::discover)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(endpoints -> Flux.fromIterable(endpoints)
                    .flatMapSequential(ep -> Mono.defer(() -> query(ep, decisionContext, perCall, advisoryId))
                            .onErrorResume(e -> Mono.just(
                                PeerOutcome.failed(ep, PeerOutcome.Status.UNREACHABLE, describe(e)))),
                        Math.max(1, endpoints.size()))
                    .collectList())
                .map(AcquisitionReport::new)
                .timeout(deadline)
                .doOnNext(report -> TraceContextUtil.withMdc(advisoryId, () ->
                    log.info("[Acquirer] Cycle complete. endpoints={} verdicts={} outcomes={} advisoryId={}",
                        report.outcomes().size(), report.verdicts().size(), report.countsByStatus(), advisoryId)))
                .onErrorResume(e -> {
                    TraceContextUtil.withMdc(advisoryId, () ->
                        log.warn("[Acquirer] Cycle abandoned, no verdicts used. deadline={} reason={} advisoryId={}",
                            deadline, describe(e), advisoryId));
                    return Mono.just(AcquisitionReport.empty());
                });
        });
    }

    // ── single peer ──────────────────────────────────────────────────────────

    private Mono<PeerOutcome> query(PeerEndpoint endpoint, String decisionContext,
                                    Duration timeout, String advisoryId) {
        WebClient.RequestHeadersSpec<?> request;
        if (endpoint.isGet()) {
            URI uri = UriComponentsBuilder.fromUriString(endpoint.url())
                .queryParam(endpoint.payloadKey(), "{context}")
                .encode()
                .buildAndExpand(decisionContext)
                .toUri();
            request = webClient.get().uri(uri);
        } else {
            request = webClient.method(HttpMethod.valueOf(endpoint.method()))
                .uri(endpoint.url())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(endpoint.payloadKey(), decisionContext));
        }

        return request
            .accept(MediaType.APPLICATION_JSON)
            .exchangeToMono(response -> {
                if (!response.statusCode().is2xxSuccessful()) {
                    return response.releaseBody()
                        .then(Mono.<String>error(new PeerException(endpoint.coreName(),
                            response.statusCode().value(), "non-2xx response")));
                }
                return response.bodyToMono(String.class).defaultIfEmpty("");
            })
            .timeout(timeout)
            .map(body -> interpret(endpoint, body, advisoryId))
            .onErrorResume(PeerException.class, e -> {
                TraceContextUtil.withMdc(advisoryId, () ->
                    log.warn("[Acquirer] peer={} status=REJECTED httpStatus={} advisoryId={}",
                        endpoint.coreName(), e.getStatusCode(), advisoryId));
                return Mono.just(PeerOutcome.failed(endpoint, PeerOutcome.Status.REJECTED,
                    "HTTP " + e.getStatusCode()));
            })
            .onErrorResume(e -> {
                String reason = describe(e);
                TraceContextUtil.withMdc(advisoryId, () ->
                    log.warn("[Acquirer] peer={} status=UNREACHABLE url={} reason={} advisoryId={}",
                        endpoint.coreName(), endpoint.url(), reason, advisoryId));
                return Mono.just(PeerOutcome.failed(endpoint, PeerOutcome.Status.UNREACHABLE, reason));
            });
    }

    private PeerOutcome interpret(PeerEndpoint endpoint, String body, String advisoryId) {
        if (body.isBlank()) {
            TraceContextUtil.withMdc(advisoryId, () ->
                log.info("[Acquirer] peer={} status=SILENT reason=no usable payload advisoryId={}",
                    endpoint.coreName(), advisoryId));
            return PeerOutcome.failed(endpoint, PeerOutcome.Status.SILENT, "no usable payload");
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            TraceContextUtil.withMdc(advisoryId, () ->
                log.warn("[Acquirer] peer={} status=MALFORMED reason={} advisoryId={}",
                    endpoint.coreName(), e.getOriginalMessage(), advisoryId));
            return PeerOutcome.failed(endpoint, PeerOutcome.Status.MALFORMED, "invalid JSON body");
        }

        ShapeObservation shape = ShapeGuide.observe(payload);
        if (!shape.conforming()) {
            Object reportedName = shape.hints().getOrDefault("core_name", endpoint.coreName());
            TraceContextUtil.withMdc(advisoryId, () ->
                log.info("[Acquirer] Assertion skipped ({}) from {} advisoryId={}",
                    shape.reason(), reportedName, advisoryId));
            return PeerOutcome.failed(endpoint, PeerOutcome.Status.NON_CONFORMING, shape.reason());
        }

        VerdictExtractor.Extraction extraction = VerdictExtractor.extract(endpoint.coreName(), payload);
        if (!extraction.isPresent()) {
            TraceContextUtil.withMdc(advisoryId, () ->
                log.info("[Acquirer] peer={} status=NON_CONFORMING reason={} advisoryId={}",
                    endpoint.coreName(), extraction.reason(), advisoryId));
            return PeerOutcome.failed(endpoint, PeerOutcome.Status.NON_CONFORMING, extraction.reason());
        }

        Verdict verdict = extraction.verdict();
        log.debug("[Acquirer] peer={} status=RESPONDED verdict={} confidence={} rule={}",
            verdict.coreName(), verdict.verdict(), verdict.confidence(), extraction.rule());
        return PeerOutcome.responded(endpoint, verdict, extraction.rule());
    }

    static Duration normalize(Duration timeout) {
        if (timeout == null) {
            return DEFAULT_TIMEOUT;
        }
        return timeout.compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : timeout;
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
