package com.advisoryplatform.common.consensus;

import com.advisoryplatform.common.model.AdvisoryRecommendation;
import com.advisoryplatform.common.model.AdvisorySignal;
import com.advisoryplatform.common.model.ConfidenceClustering;
import com.advisoryplatform.common.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SoftmaxConsensusAdvisor}.
 * Covers the empty case, the reference scenarios, clustering classes and temperature.
 */
class SoftmaxConsensusAdvisorTest {

    private final SoftmaxConsensusAdvisor advisor = new SoftmaxConsensusAdvisor();

    private static List<Verdict> split() {
        return List.of(
            Verdict.of("KayGee", "approve", 0.94),
            Verdict.of("ECM",    "approve", 0.78),
            Verdict.of("Caleon", "reject",  0.91));
    }

    // ── empty input ───────────────────────────────────────────────────────

    @Test
    @DisplayName("no verdicts: zero consensus, escalate, never throws")
    void emptyInput() {
        AdvisorySignal signal = assertDoesNotThrow(() -> advisor.process(List.of()));

        assertEquals(0.0, signal.consensusLevel());
        assertEquals(AdvisoryRecommendation.ESCALATE_TO_REVIEW, signal.recommendation());
        assertNull(signal.dominantVerdict());
        assertTrue(signal.outlier().isEmpty());
        assertTrue(signal.softmaxProbabilities().isEmpty());
        assertEquals(ConfidenceClustering.CONFLICTED, signal.confidenceClustering());
        assertEquals("No peer verdicts received", signal.explanation());
    }

    @Test
    @DisplayName("null list is a programming error")
    void nullInput_throws() {
        assertThrows(NullPointerException.class, () -> advisor.process(null));
    }

    // ── reference scenarios ───────────────────────────────────────────────

    @Nested
    @DisplayName("reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("split council: deterministic across runs")
        void splitCouncil_deterministic() {
            AdvisorySignal first = advisor.process(split());
            for (int i = 0; i < 100; i++) {
                AdvisorySignal again = new SoftmaxConsensusAdvisor().process(split());
                assertEquals(first.consensusLevel(), again.consensusLevel());
                assertEquals(first.outlierDetected(), again.outlierDetected());
                assertEquals(first.recommendation(), again.recommendation());
            }
            assertEquals(first, advisor.process(split()));
        }

        @Test
        @DisplayName("split council: conflicted and escalated")
        void splitCouncil_values() {
            AdvisorySignal signal = advisor.process(split());

            assertEquals("approve", signal.dominantVerdict());
            assertEquals(ConfidenceClustering.CONFLICTED, signal.confidenceClustering());
            assertEquals(0.5079, signal.consensusLevel(), 1e-4);
            assertEquals(AdvisoryRecommendation.ESCALATE_TO_REVIEW, signal.recommendation());
            assertTrue(signal.outlier().isEmpty());
            assertEquals(Map.of("approve", 2, "reject", 1), signal.verdictDistribution());
        }

        @Test
        @DisplayName("high consensus: four approvals proceed")
        void highConsensus_proceed() {
            AdvisorySignal signal = advisor.process(List.of(
                Verdict.of("a", "approve", 0.95),
                Verdict.of("b", "approve", 0.93),
                Verdict.of("c", "approve", 0.91),
                Verdict.of("d", "approve", 0.97)));

            assertTrue(signal.consensusLevel() > 0.90);
            assertEquals(AdvisoryRecommendation.PROCEED, signal.recommendation());
            assertEquals(ConfidenceClustering.UNANIMOUS, signal.confidenceClustering());
            assertTrue(signal.outlier().isEmpty());
        }

        @Test
        @DisplayName("unanimous approvals with a 0.01 spread proceed without an outlier")
        void nearIdenticalApprovals_proceed() {
            AdvisorySignal signal = advisor.process(List.of(
                Verdict.of("a", "approve", 0.90),
                Verdict.of("b", "approve", 0.90),
                Verdict.of("c", "approve", 0.90),
                Verdict.of("d", "approve", 0.91)));

            assertTrue(signal.outlier().isEmpty());
            assertEquals(1.0, signal.consensusLevel());
            assertEquals(AdvisoryRecommendation.PROCEED, signal.recommendation());
        }

        @Test
        @DisplayName("outlier: low-confidence approval is flagged but does not change the verdict")
        void outlier_flagged() {
            AdvisorySignal signal = advisor.process(List.of(
                Verdict.of("a",   "approve", 0.90),
                Verdict.of("b",   "approve", 0.91),
                Verdict.of("c",   "approve", 0.89),
                Verdict.of("odd", "approve", 0.12)));

            assertEquals("approve", signal.dominantVerdict());
            assertTrue(signal.consensusLevel() >= 0.8);
            assertEquals("odd", signal.outlierDetected());
            assertTrue(Set.of(AdvisoryRecommendation.PROCEED,
                              AdvisoryRecommendation.PROCEED_CAUTIOUSLY,
                              AdvisoryRecommendation.OUTLIER_INVESTIGATION)
                          .contains(signal.recommendation()));
            assertEquals(AdvisoryRecommendation.OUTLIER_INVESTIGATION, signal.recommendation());
            assertTrue(signal.explanation().contains("statistical outlier: odd"));
        }
    }

    // ── clustering ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("confidence clustering")
    class ClusteringTests {

        @Test
        @DisplayName("three of four agree with spread 0.2: STRONG")
        void strong() {
            AdvisorySignal signal = advisor.process(List.of(
                Verdict.of("a", "approve", 0.9),
                Verdict.of("b", "approve", 0.85),
                Verdict.of("c", "approve", 0.8),
                Verdict.of("d", "reject",  0.7)));

            assertEquals(ConfidenceClustering.STRONG, signal.confidenceClustering());
            assertEquals(0.6175, signal.consensusLevel(), 1e-4);
            assertEquals(AdvisoryRecommendation.PAUSE_AND_VERIFY, signal.recommendation());
        }

        @Test
        @DisplayName("full agreement with spread 0.3: MODERATE")
        void moderate() {
            AdvisorySignal signal = advisor.process(List.of(
                Verdict.of("a", "approve", 0.9),
                Verdict.of("b", "approve", 0.8),
                Verdict.of("c", "approve", 0.7),
                Verdict.of("d", "approve", 0.6)));

            assertEquals(ConfidenceClustering.MODERATE, signal.confidenceClustering());
            assertEquals(1.0, signal.consensusLevel());
            assertEquals(AdvisoryRecommendation.PROCEED, signal.recommendation());
        }

        @Test
        @DisplayName("full agreement with spread 0.6: FRAGMENTED")
        void fragmented() {
            AdvisorySignal signal = advisor.process(List.of(
                Verdict.of("a", "approve", 0.9),
                Verdict.of("b", "approve", 0.3)));

            assertEquals(ConfidenceClustering.FRAGMENTED, signal.confidenceClustering());
        }

        @Test
        @DisplayName("even split with equal confidence: first verdict dominates, CONFLICTED")
        void evenSplit() {
            AdvisorySignal signal = advisor.process(List.of(
                Verdict.of("a", "approve", 0.9),
                Verdict.of("b", "reject",  0.9)));

            assertEquals("approve", signal.dominantVerdict());
            assertEquals(ConfidenceClustering.CONFLICTED, signal.confidenceClustering());
            assertEquals(0.375, signal.consensusLevel(), 1e-4);
            assertEquals(1.0, signal.effectiveEntropy(), 1e-9);
            assertEquals(AdvisoryRecommendation.ESCALATE_TO_REVIEW, signal.recommendation());
        }

        @Test
        @DisplayName("single verdict is unanimous")
        void singleVerdict() {
            AdvisorySignal signal = advisor.process(List.of(Verdict.of("solo", "approve", 0.4)));

            assertEquals(ConfidenceClustering.UNANIMOUS, signal.confidenceClustering());
            assertEquals(1.0, signal.consensusLevel());
            assertEquals(1.0, signal.softmaxProbabilities().get(0).probability(), 1e-12);
        }
    }

    // ── probabilities & temperature ───────────────────────────────────────

    @Nested
    @DisplayName("softmax probabilities")
    class ProbabilityTests {

        @Test
        @DisplayName("probabilities sum to 1 and keep input order")
        void sumAndOrder() {
            List<Verdict> verdicts = new ArrayList<>();
            for (int i = 0; i < 9; i++) {
                verdicts.add(Verdict.of("core-" + i, i % 2 == 0 ? "approve" : "reject", i / 10.0));
            }
            AdvisorySignal signal = advisor.process(verdicts);

            assertEquals(1.0, signal.probabilitySum(), 1e-9);
            for (int i = 0; i < 9; i++) {
                assertEquals("core-" + i, signal.softmaxProbabilities().get(i).coreName());
            }
        }

        @Test
        @DisplayName("lower temperature sharpens the distribution")
        void temperatureSharpens() {
            List<Verdict> verdicts = split();
            double warm = advisor.process(verdicts).softmaxProbabilities().get(0).probability();
            double cold = new SoftmaxConsensusAdvisor(0.05).process(verdicts).softmaxProbabilities().get(0).probability();

            assertTrue(cold > warm);
        }

        @Test
        @DisplayName("non-positive temperature is rejected")
        void invalidTemperature() {
            assertThrows(IllegalArgumentException.class, () -> new SoftmaxConsensusAdvisor(0.0));
            assertThrows(IllegalArgumentException.class, () -> new SoftmaxConsensusAdvisor(-1.0));
            assertThrows(IllegalArgumentException.class, () -> new SoftmaxConsensusAdvisor(Double.NaN));
        }

        @Test
        @DisplayName("temperature below the floor is rejected, the floor itself stays finite")
        void temperatureFloor() {
            assertThrows(IllegalArgumentException.class, () -> new SoftmaxConsensusAdvisor(Double.MIN_VALUE));
            assertThrows(IllegalArgumentException.class,
                () -> new SoftmaxConsensusAdvisor(SoftmaxConsensusAdvisor.MIN_TEMPERATURE / 10));

            AdvisorySignal signal = new SoftmaxConsensusAdvisor(SoftmaxConsensusAdvisor.MIN_TEMPERATURE).process(List.of(
                Verdict.of("a", "approve", 1.0), Verdict.of("b", "reject", 0.0), Verdict.of("c", "approve", 0.9)));

            assertEquals(1.0, signal.probabilitySum(), 1e-9);
            assertEquals(1.0, signal.softmaxProbabilities().get(0).probability(), 1e-9);
        }

        @Test
        @DisplayName("consensus drops as verdict entropy rises")
        void consensusFallsWithEntropy() {
            double unanimous = advisor.process(List.of(
                Verdict.of("a", "x", 0.5), Verdict.of("b", "x", 0.5),
                Verdict.of("c", "x", 0.5), Verdict.of("d", "x", 0.5))).consensusLevel();
            double halved = advisor.process(List.of(
                Verdict.of("a", "x", 0.5), Verdict.of("b", "x", 0.5),
                Verdict.of("c", "y", 0.5), Verdict.of("d", "y", 0.5))).consensusLevel();
            double scattered = advisor.process(List.of(
                Verdict.of("a", "x", 0.5), Verdict.of("b", "y", 0.5),
                Verdict.of("c", "z", 0.5), Verdict.of("d", "w", 0.5))).consensusLevel();

            assertTrue(unanimous > halved);
            assertTrue(halved > scattered);
            assertEquals(0.1875, scattered, 1e-4);
        }
    }

    @Test
    @DisplayName("explanation stays within 300 characters")
    void explanationBounded() {
        List<Verdict> verdicts = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            verdicts.add(Verdict.of("core-with-a-long-name-" + i, "verdict-string-number-" + i, 0.5));
        }
        AdvisorySignal signal = advisor.process(verdicts);

        assertTrue(signal.explanation().length() <= 300);
        assertTrue(signal.explanation().contains("(+38 more)"));
    }
}
