package com.advisoryplatform.orchestrator.audit;

import com.advisoryplatform.common.model.AdvisoryRecommendation;
import com.advisoryplatform.common.model.AdvisorySignal;
import com.advisoryplatform.common.model.ConsensusBucket;
import com.advisoryplatform.common.model.Verdict;
import com.advisoryplatform.common.support.Immutables;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only, capacity-bounded record of every advisory computed.
 *
 * <p>Writes are never rejected: past capacity the oldest entry is evicted. Each entry gets
 * the next sequence number and is chained to its predecessor by SHA-256, computed over a
 * key-sorted JSON rendering of the entry content. A single monitor guards every operation;
 * readers get immutable copies.
 */
public class AuditMatrix {

    private static final Logger log = LoggerFactory.getLogger(AuditMatrix.class);

    public static final int    DEFAULT_CAPACITY = 1000;
    public static final String GENESIS_HASH     = "";

    private final int          capacity;
    private final Clock        clock;
    private final ObjectWriter canonicalWriter;

    private final Deque<AuditEntry> entries = new ArrayDeque<>();
    private long   lastSequence = 0L;
    private String lastHash     = GENESIS_HASH;

    public AuditMatrix(int capacity, ObjectMapper objectMapper, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.capacity        = capacity;
        this.clock           = Objects.requireNonNull(clock, "clock");
        this.canonicalWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Appends one entry for {@code advisory}.
     *
     * @param derivationMetadata free-form context about how the advisory was produced; may be null
     */
    public synchronized AuditEntry record(String decisionContext,
                                          AdvisorySignal advisory,
                                          List<Verdict> verdicts,
                                          Map<String, ?> derivationMetadata) {
        Objects.requireNonNull(advisory, "advisory");
        List<String> sources = verdicts == null
            ? List.of()
            : verdicts.stream().map(Verdict::coreName).toList();

        long    sequence  = lastSequence + 1;
        Instant timestamp = clock.instant();
        Map<String, Object> metadata = Immutables.deepCopy(derivationMetadata);
        String  entryHash = hash(sequence, timestamp, decisionContext, advisory, sources, metadata, lastHash);

        AuditEntry entry = new AuditEntry(sequence, timestamp, decisionContext, advisory,
            sources, metadata, lastHash, entryHash);

        entries.addLast(entry);
        if (entries.size() > capacity) {
            AuditEntry evicted = entries.removeFirst();
            log.debug("[AuditMatrix] Evicted oldest entry. sequence={} capacity={}", evicted.sequenceNumber(), capacity);
        }
        lastSequence = sequence;
        lastHash     = entryHash;

        log.info("[AuditMatrix] Recorded. sequence={} consensus={} recommendation={} sources={}",
            sequence, advisory.consensusLevel(), advisory.recommendation(), sources.size());
        return entry;
    }

    /** Retained entries, oldest first. */
    public synchronized List<AuditEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized AuditSummary summarize() {
        Map<ConsensusBucket, Integer>        byBucket         = new EnumMap<>(ConsensusBucket.class);
        Map<AdvisoryRecommendation, Integer> byRecommendation = new EnumMap<>(AdvisoryRecommendation.class);
        for (ConsensusBucket bucket : ConsensusBucket.values()) {
            byBucket.put(bucket, 0);
        }
        for (AdvisoryRecommendation recommendation : AdvisoryRecommendation.values()) {
            byRecommendation.put(recommendation, 0);
        }
        for (AuditEntry entry : entries) {
            byBucket.merge(ConsensusBucket.of(entry.advisory().consensusLevel()), 1, Integer::sum);
            byRecommendation.merge(entry.advisory().recommendation(), 1, Integer::sum);
        }
        return new AuditSummary(entries.size(), byBucket, byRecommendation);
    }

    /**
     * Recomputes every retained hash and checks the links between neighbours. The oldest
     * retained entry's {@code previousHash} is taken as given, since its predecessor may
     * have been evicted.
     */
    public synchronized ChainVerification verifyChain() {
        return verify(List.copyOf(entries));
    }

    ChainVerification verify(List<AuditEntry> chain) {
        AuditEntry previous = null;
        int checked = 0;
        for (AuditEntry entry : chain) {
            if (previous != null) {
                if (entry.sequenceNumber() != previous.sequenceNumber() + 1) {
                    return ChainVerification.broken(checked, entry.sequenceNumber(), "sequence gap");
                }
                if (!Objects.equals(entry.previousHash(), previous.entryHash())) {
                    return ChainVerification.broken(checked, entry.sequenceNumber(), "previous hash mismatch");
                }
            }
            String recomputed = hash(entry.sequenceNumber(), entry.timestamp(), entry.decisionContext(),
                entry.advisory(), entry.verdictSources(), entry.derivationMetadata(), entry.previousHash());
            if (!recomputed.equals(entry.entryHash())) {
                return ChainVerification.broken(checked, entry.sequenceNumber(), "entry hash mismatch");
            }
            previous = entry;
            checked++;
        }
        return ChainVerification.ok(checked);
    }

    private String hash(long sequence, Instant timestamp, String decisionContext, AdvisorySignal advisory,
                        List<String> sources, Map<String, Object> metadata, String previousHash) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("sequence_number",     sequence);
        content.put("timestamp",           timestamp.toString());
        content.put("decision_context",    decisionContext);
        content.put("advisory",            advisory);
        content.put("verdict_sources",     sources);
        content.put("derivation_metadata", metadata);
        content.put("previous_hash",       previousHash);
        try {
            byte[] canonical = canonicalWriter.writeValueAsBytes(content);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit entry could not be serialized. sequence=" + sequence, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
