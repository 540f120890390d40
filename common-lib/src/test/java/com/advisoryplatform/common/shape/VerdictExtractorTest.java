package com.advisoryplatform.common.shape;

import com.advisoryplatform.common.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verification of {@link VerdictExtractor}: rule precedence, clamping, name override and
 * metadata pass-through.
 */
class VerdictExtractorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static VerdictExtractor.Extraction extract(String raw) throws Exception {
        return VerdictExtractor.extract("Endpoint_Core", MAPPER.readTree(raw));
    }

    @Test
    @DisplayName("rule table order is fixed")
    void ruleOrder() {
        assertEquals(List.of("flat-assertion", "final-verdict", "flat-verdict", "flat-status", "flat-response"),
            VerdictExtractor.RULES.stream().map(ExtractionRule::name).toList());
    }

    // ── precedence ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("rule precedence")
    class Precedence {

        @Test
        @DisplayName("flat assertion beats verdict and final_verdict")
        void flatAssertionFirst() throws Exception {
            VerdictExtractor.Extraction result = extract(
                "{\"assertion\": \"approve\", \"verdict\": \"reject\", \"confidence\": 0.7,"
                + " \"final_verdict\": {\"status\": \"hold\", \"confidence\": 0.1}}");

            assertEquals("flat-assertion", result.rule());
            assertEquals("approve", result.verdict().verdict());
            assertEquals(0.7, result.verdict().confidence());
            assertTrue(result.verdict().metadata().containsKey("verdict"));
            assertTrue(result.verdict().metadata().containsKey("final_verdict"));
        }

        @Test
        @DisplayName("final_verdict beats flat verdict")
        void finalVerdictBeforeFlatVerdict() throws Exception {
            VerdictExtractor.Extraction result = extract(
                "{\"verdict\": \"reject\", \"confidence\": 0.2,"
                + " \"final_verdict\": {\"verdict\": \"approve\", \"inevitability\": 0.93}}");

            assertEquals("final-verdict", result.rule());
            assertEquals("approve", result.verdict().verdict());
            assertEquals(0.93, result.verdict().confidence());
            @SuppressWarnings("unchecked")
            Map<String, Object> kept = (Map<String, Object>) result.verdict().metadata().get("final_verdict");
            assertEquals("approve", kept.get("verdict"));
        }

        @Test
        @DisplayName("final_verdict confidence falls back to meta.confidence")
        void finalVerdictMetaConfidence() throws Exception {
            VerdictExtractor.Extraction result = extract(
                "{\"final_verdict\": {\"decision\": \"hold\", \"meta\": {\"confidence\": 0.55}}}");

            assertEquals("hold", result.verdict().verdict());
            assertEquals(0.55, result.verdict().confidence());
        }

        @Test
        @DisplayName("status used when no verdict is present")
        void flatStatus() throws Exception {
            VerdictExtractor.Extraction result = extract("{\"status\": \"stable\", \"confidence\": \"0.6\"}");
            assertEquals("flat-status", result.rule());
            assertEquals(0.6, result.verdict().confidence());
        }

        @Test
        @DisplayName("response used last")
        void flatResponse() throws Exception {
            VerdictExtractor.Extraction result = extract("{\"response\": \"go\", \"confidence\": 0.6}");
            assertEquals("flat-response", result.rule());
        }
    }

    // ── normalization ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("normalization")
    class Normalization {

        @Test
        @DisplayName("confidence is clamped into [0, 1]")
        void clamping() throws Exception {
            assertEquals(1.0, extract("{\"assertion\": \"a\", \"confidence\": 1.7}").verdict().confidence());
            assertEquals(0.0, extract("{\"assertion\": \"a\", \"confidence\": -3}").verdict().confidence());
        }

        @Test
        @DisplayName("overflowing confidence is clamped, not dropped")
        void overflowClamped() throws Exception {
            assertEquals(1.0, extract("{\"assertion\": \"a\", \"confidence\": 1e400}").verdict().confidence());
            assertEquals(0.0, extract("{\"verdict\": \"a\", \"confidence\": -1e400}").verdict().confidence());
            assertEquals(1.0, extract("{\"status\": \"a\", \"confidence\": \"Infinity\"}").verdict().confidence());
            assertEquals(1.0, extract("{\"final_verdict\": {\"status\": \"a\", \"inevitability\": 1e400}}")
                .verdict().confidence());
        }

        @Test
        @DisplayName("payload core_name overrides endpoint name")
        void coreNameOverride() throws Exception {
            Verdict verdict = extract("{\"core_name\": \"KayGee_1.0\", \"assertion\": \"a\", \"confidence\": 0.5}").verdict();
            assertEquals("KayGee_1.0", verdict.coreName());
            assertFalse(verdict.metadata().containsKey("core_name"));
        }

        @Test
        @DisplayName("endpoint name used when payload has none")
        void endpointName() throws Exception {
            assertEquals("Endpoint_Core", extract("{\"assertion\": \"a\", \"confidence\": 0.5}").verdict().coreName());
        }

        @Test
        @DisplayName("identifying and unknown fields pass through to metadata")
        void passThrough() throws Exception {
            Verdict verdict = extract(
                "{\"assertion\": \"a\", \"confidence\": 0.5, \"assertion_id\": \"x-9\","
                + " \"timestamp\": \"t\", \"metadata\": {\"k\": [1, 2]}, \"custom\": null}").verdict();

            assertEquals("x-9", verdict.metadata().get("assertion_id"));
            assertEquals("t", verdict.metadata().get("timestamp"));
            assertEquals(Map.of("k", List.of(1, 2)), verdict.metadata().get("metadata"));
            assertTrue(verdict.metadata().containsKey("custom"));
            assertFalse(verdict.metadata().containsKey("assertion"));
            assertFalse(verdict.metadata().containsKey("confidence"));
        }
    }

    // ── no fabrication ────────────────────────────────────────────────────

    @Nested
    @DisplayName("no verdict is fabricated")
    class NoFabrication {

        @Test
        @DisplayName("assertion without confidence yields nothing")
        void assertionWithoutConfidence() throws Exception {
            VerdictExtractor.Extraction result = extract("{\"assertion\": \"approve\"}");
            assertFalse(result.isPresent());
            assertEquals("flat-assertion", result.rule());
        }

        @Test
        @DisplayName("verdict without numeric confidence matches no rule")
        void verdictWithoutConfidence() throws Exception {
            VerdictExtractor.Extraction result = extract("{\"verdict\": \"approve\", \"confidence\": \"sure\"}");
            assertFalse(result.isPresent());
            assertNull(result.rule());
        }

        @Test
        @DisplayName("non-object payload yields nothing")
        void notAnObject() throws Exception {
            assertTrue(extract("\"approve\"").asOptional().isEmpty());
        }
    }
}
