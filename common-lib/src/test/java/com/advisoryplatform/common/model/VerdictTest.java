package com.advisoryplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerdictTest {

    @Test
    @DisplayName("confidence is clamped on construction")
    void clampsConfidence() {
        assertEquals(1.0, Verdict.of("a", "approve", 4.2).confidence());
        assertEquals(0.0, Verdict.of("a", "approve", -0.1).confidence());
        assertEquals(0.42, Verdict.of("a", "approve", 0.42).confidence());
    }

    @Test
    @DisplayName("NaN confidence and blank identity are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> Verdict.of("a", "approve", Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Verdict.of(" ", "approve", 0.5));
        assertThrows(IllegalArgumentException.class, () -> Verdict.of("a", "", 0.5));
    }

    @Test
    @DisplayName("metadata is a deep, unmodifiable copy")
    void metadataCopied() {
        List<Object> tags = new ArrayList<>(List.of("x"));
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("tags", tags);
        metadata.put("note", null);

        Verdict verdict = new Verdict("a", "approve", 0.5, metadata);
        tags.add("y");
        metadata.put("late", 1);

        assertEquals(List.of("x"), verdict.metadata().get("tags"));
        assertFalse(verdict.metadata().containsKey("late"));
        assertTrue(verdict.metadata().containsKey("note"));
        assertThrows(UnsupportedOperationException.class, () -> verdict.metadata().put("z", 1));
    }

    @Test
    @DisplayName("consensus bucket bands")
    void consensusBuckets() {
        assertEquals(ConsensusBucket.UNANIMOUS,  ConsensusBucket.of(0.90));
        assertEquals(ConsensusBucket.STRONG,     ConsensusBucket.of(0.8999));
        assertEquals(ConsensusBucket.MODERATE,   ConsensusBucket.of(0.60));
        assertEquals(ConsensusBucket.FRAGMENTED, ConsensusBucket.of(0.40));
        assertEquals(ConsensusBucket.CONFLICTED, ConsensusBucket.of(0.3999));
    }
}
