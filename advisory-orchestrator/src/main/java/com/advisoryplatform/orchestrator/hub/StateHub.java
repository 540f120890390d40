package com.advisoryplatform.orchestrator.hub;

import com.advisoryplatform.common.support.Immutables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Shared, supervisory state: peer availability, a bounded event log, a bounded control log
 * and a divergence flag. No inference happens here.
 *
 * <p>One monitor guards all state. Readers receive copies. Both logs are FIFO-bounded and
 * never reject a write. Recorded events are also pushed to {@link #events()} for live
 * observers; an observer that fails or falls behind never affects the writer.
 *
 * <p>Live emission happens after the hub monitor is released. Stored events are queued in
 * store order and drained by one thread at a time, so observers see the same order as the log
 * and a reader calling {@link #snapshot()} never waits on an observer.
 *
 * <p>Besides peers the hub tracks operator-facing status per downstream system
 * ({@link #DEFAULT_SYSTEMS}) and the routing {@link HubControls}.
 */
public class StateHub {

    private static final Logger log = LoggerFactory.getLogger(StateHub.class);

    public static final int DEFAULT_EVENT_CAPACITY   = 500;
    public static final int DEFAULT_CONTROL_CAPACITY = 1000;

    static final String TIMESTAMP_FIELD = "timestamp";
    static final String TYPE_FIELD      = "type";
    static final String CONTROL_TYPE    = "control";

    /** Downstream systems known from the start, each with an empty status map. */
    public static final List<String> DEFAULT_SYSTEMS = List.of("DALS", "GOAT", "TrueMark", "CertSig");

    private final int   eventCapacity;
    private final int   controlCapacity;
    private final Clock clock;

    private final Map<String, PeerState>  peers      = new LinkedHashMap<>();
    private final Deque<HubEvent>         events     = new ArrayDeque<>();
    private final Deque<ControlLogEntry>  controlLog = new ArrayDeque<>();
    private final Map<String, Map<String, Object>> systems = new LinkedHashMap<>();
    private HubControls controls = HubControls.defaults(DEFAULT_SYSTEMS);
    private boolean divergence;
    private Instant updatedAt;

    private final Sinks.Many<HubEvent> eventSink =
        Sinks.many().multicast().onBackpressureBuffer(64, false);
    private final Queue<HubEvent> pendingEmits = new ConcurrentLinkedQueue<>();
    private final Object          emitMonitor  = new Object();

    public StateHub(int eventCapacity, int controlCapacity, Clock clock) {
        if (eventCapacity <= 0 || controlCapacity <= 0) {
            throw new IllegalArgumentException(
                "capacities must be > 0. events=" + eventCapacity + " control=" + controlCapacity);
        }
        this.eventCapacity   = eventCapacity;
        this.controlCapacity = controlCapacity;
        this.clock           = Objects.requireNonNull(clock, "clock");
        DEFAULT_SYSTEMS.forEach(name -> systems.put(name, new LinkedHashMap<>()));
    }

    // ── peers ────────────────────────────────────────────────────────────────

    /**
     * @param lastAssertion new assertion, or {@code null} to keep the previous one
     */
    public synchronized void updatePeerAvailability(String coreName, PeerAvailability availability,
                                                    Map<String, ?> lastAssertion) {
        Objects.requireNonNull(availability, "availability");
        PeerState state = peerFor(coreName);
        state.setAvailability(availability);
        if (lastAssertion != null) {
            state.setLastAssertion(Immutables.deepCopy(lastAssertion));
        }
        touch(state);
    }

    /** Stores the peer's latest assertion; availability becomes AVAILABLE if it was never set. */
    public synchronized void recordAssertion(String coreName, Map<String, ?> assertion) {
        PeerState state = peerFor(coreName);
        state.setLastAssertion(Immutables.deepCopy(assertion));
        if (state.getAvailability() == null) {
            state.setAvailability(PeerAvailability.AVAILABLE);
        }
        touch(state);
    }

    public synchronized Optional<PeerState> peerState(String coreName) {
        PeerState state = peers.get(coreName);
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    // ── events & control ─────────────────────────────────────────────────────

    /**
     * Appends an attributed event. A {@code timestamp} field is added to the stored copy
     * when the event has none.
     */
    public HubEvent recordEvent(Map<String, ?> event) {
        Objects.requireNonNull(event, "event");
        HubEvent stored;
        synchronized (this) {
            Instant now = clock.instant();
            stored = new HubEvent(now, withTimestamp(event, now));
            append(stored);
            updatedAt = now;
        }
        drainEmits();
        return stored;
    }

    /**
     * Stores an attributed control packet and mirrors it as a {@code control} event.
     * The caller's map is never modified. Nothing is dispatched.
     */
    public ControlLogEntry recordControlAction(Map<String, ?> packet) {
        Objects.requireNonNull(packet, "packet");
        Map<String, Object> stamped;
        ControlLogEntry     entry;
        synchronized (this) {
            Instant now = clock.instant();
            stamped = withTimestamp(packet, now);

            entry = new ControlLogEntry(stamped, now);
            controlLog.addLast(entry);
            while (controlLog.size() > controlCapacity) {
                controlLog.removeFirst();
            }

            Map<String, Object> mirrored = new LinkedHashMap<>();
            mirrored.put(TYPE_FIELD, CONTROL_TYPE);
            mirrored.putAll(stamped);
            append(new HubEvent(now, mirrored));
            updatedAt = now;
        }
        drainEmits();

        log.info("[StateHub] Control intent recorded. target={} command={}",
            stamped.get("target"), stamped.get("command"));
        return entry;
    }

    public synchronized void setDivergence(boolean diverged) {
        if (divergence != diverged) {
            log.info("[StateHub] Divergence changed. divergence={}", diverged);
        }
        divergence = diverged;
        updatedAt  = clock.instant();
    }

    // ── systems & controls ───────────────────────────────────────────────────

    /**
     * Merges {@code status} into the named system's status map. Unknown systems are added.
     *
     * @param systemName downstream system, e.g. {@code DALS}
     * @param status     fields to merge; later values replace earlier ones key by key
     */
    public synchronized void updateSystemStatus(String systemName, Map<String, ?> status) {
        if (systemName == null || systemName.isBlank()) {
            throw new IllegalArgumentException("systemName must be a non-blank string");
        }
        Objects.requireNonNull(status, "status");
        systems.computeIfAbsent(systemName, name -> new LinkedHashMap<>())
               .putAll(Immutables.deepCopy(status));
        updatedAt = clock.instant();
    }

    /**
     * @param accepting   new intake flag, or {@code null} to keep the current one
     * @param routingMode per-system routing to merge, or {@code null} to keep the current map
     */
    public synchronized HubControls setControls(Boolean accepting, Map<String, String> routingMode) {
        controls = controls.merge(accepting, routingMode);
        updatedAt = clock.instant();
        log.info("[StateHub] Controls changed. accepting={} routingMode={}",
            controls.accepting(), controls.routingMode());
        return controls;
    }

    public synchronized HubControls controls() {
        return controls;
    }

    // ── reads ────────────────────────────────────────────────────────────────

    public synchronized HubSnapshot snapshot() {
        Map<String, PeerState> peerCopies = new LinkedHashMap<>();
        peers.forEach((name, state) -> peerCopies.put(name, state.copy()));
        Map<String, Map<String, Object>> systemCopies = new LinkedHashMap<>();
        systems.forEach((name, status) -> systemCopies.put(name, Immutables.deepCopy(status)));
        return new HubSnapshot(updatedAt,
                               Collections.unmodifiableMap(peerCopies),
                               List.copyOf(events),
                               divergence,
                               Collections.unmodifiableMap(systemCopies),
                               controls);
    }

    /** Retained events recorded strictly after {@code since}, oldest first. */
    public synchronized List<HubEvent> eventsSince(Instant since) {
        Objects.requireNonNull(since, "since");
        return events.stream()
            .filter(e -> e.recordedAt().isAfter(since))
            .toList();
    }

    public synchronized List<ControlLogEntry> controlLog() {
        return List.copyOf(controlLog);
    }

    public synchronized boolean isDiverged() {
        return divergence;
    }

    /**
     * Live feed of recorded events. Until the first subscriber arrives the feed buffers up to
     * 64 events; after that each subscriber sees events recorded while it is subscribed.
     * Subscribers are called on a {@link Schedulers#boundedElastic()} worker, never on the
     * recording thread.
     */
    public Flux<HubEvent> events() {
        return eventSink.asFlux().publishOn(Schedulers.boundedElastic());
    }

    // ── internals ────────────────────────────────────────────────────────────

    private PeerState peerFor(String coreName) {
        if (coreName == null || coreName.isBlank()) {
            throw new IllegalArgumentException("coreName must be a non-blank string");
        }
        return peers.computeIfAbsent(coreName, name -> {
            PeerState state = new PeerState();
            state.setCoreName(name);
            return state;
        });
    }

    private void touch(PeerState state) {
        Instant now = clock.instant();
        // lastSeen never moves backwards, even if the clock does
        if (state.getLastSeen() == null || now.isAfter(state.getLastSeen())) {
            state.setLastSeen(now);
        }
        updatedAt = now;
    }

    private void append(HubEvent event) {
        events.addLast(event);
        while (events.size() > eventCapacity) {
            events.removeFirst();
        }
        pendingEmits.add(event);
    }

    /** Called without the hub monitor held. */
    private void drainEmits() {
        synchronized (emitMonitor) {
            HubEvent event;
            while ((event = pendingEmits.poll()) != null) {
                Sinks.EmitResult result = eventSink.tryEmitNext(event);
                if (result.isFailure()) {
                    log.debug("[StateHub] Live event not delivered. result={} type={}", result, event.type());
                }
            }
        }
    }

    private static Map<String, Object> withTimestamp(Map<String, ?> source, Instant now) {
        Map<String, Object> copy = new LinkedHashMap<>(source);
        copy.putIfAbsent(TIMESTAMP_FIELD, now.toString());
        return copy;
    }
}
