package com.advisoryplatform.common.consensus;

import com.advisoryplatform.common.model.AdvisoryRecommendation;
import com.advisoryplatform.common.model.AdvisorySignal;
import com.advisoryplatform.common.model.ConfidenceClustering;
import com.advisoryplatform.common.model.PeerProbability;
import com.advisoryplatform.common.model.Verdict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Default {@link ConsensusAdvisor}: softmax weighting of peer confidences combined with
 * plain vote agreement, damped by verdict entropy.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Softmax over {@code confidence / T}, shifted by the maximum for numerical stability.</li>
 *   <li>Dominant verdict = verdict of the highest-confidence entry (first wins on ties).</li>
 *   <li>{@code mass} = probability on entries sharing the dominant verdict;
 *       {@code agreement} = share of entries sharing it.</li>
 *   <li>{@code H} = normalized Shannon entropy of the per-verdict probability mass
 *       (0 when only one verdict string is present).</li>
 *   <li>{@code consensus = clamp((0.5·mass + 0.5·agreement) · (1 − 0.25·H))},
 *       rounded to 4 decimals.</li>
 *   <li>Outlier via {@link OutlierDetector}; recommendation via {@link RecommendationPolicy}.</li>
 * </ol>
 *
 * <h3>Clustering (first match wins, spread = max − min confidence)</h3>
 * <pre>
 *   agreement = 1    AND spread ≤ 0.10                       → UNANIMOUS
 *   agreement < 0.75 AND best dissent within 0.10 of dominant → CONFLICTED
 *   agreement ≥ 0.75 AND spread ≤ 0.25                       → STRONG
 *   agreement ≥ 0.5  AND spread ≤ 0.50                       → MODERATE
 *   otherwise                                                 → FRAGMENTED
 * </pre>
 *
 * <p>This class is stateless and thread-safe. It does NOT modify {@link Verdict} instances.
 */
public class SoftmaxConsensusAdvisor implements ConsensusAdvisor {

    public static final double DEFAULT_TEMPERATURE = 1.0;
    /** Below this, {@code confidence / T} can overflow and the softmax turns into NaN. */
    public static final double MIN_TEMPERATURE     = 1e-6;

    static final String NO_VERDICTS_EXPLANATION = "No peer verdicts received";
    static final int    MAX_EXPLANATION_LENGTH  = 300;

    private static final double MASS_WEIGHT      = 0.5;
    private static final double AGREEMENT_WEIGHT = 0.5;
    private static final double ENTROPY_DAMPING  = 0.25;

    private static final double UNANIMOUS_SPREAD   = 0.10;
    private static final double CONFLICT_MARGIN    = 0.10;
    private static final double STRONG_AGREEMENT   = 0.75;
    private static final double STRONG_SPREAD      = 0.25;
    private static final double MODERATE_AGREEMENT = 0.5;
    private static final double MODERATE_SPREAD    = 0.50;

    private static final double EPSILON = 1e-9;

    private final double temperature;

    public SoftmaxConsensusAdvisor() {
        this(DEFAULT_TEMPERATURE);
    }

    public SoftmaxConsensusAdvisor(double temperature) {
        if (!(temperature >= MIN_TEMPERATURE) || Double.isInfinite(temperature)) {
            throw new IllegalArgumentException(
                "temperature must be finite and >= " + MIN_TEMPERATURE + ", got " + temperature);
        }
        this.temperature = temperature;
    }

    public double getTemperature() {
        return temperature;
    }

    @Override
    public AdvisorySignal process(List<Verdict> verdicts) {
        Objects.requireNonNull(verdicts, "verdicts");
        if (verdicts.isEmpty()) {
            return new AdvisorySignal(null, List.of(), null, ConfidenceClustering.CONFLICTED, 0.0,
                AdvisoryRecommendation.ESCALATE_TO_REVIEW, Map.of(), 0.0, NO_VERDICTS_EXPLANATION);
        }

        int n = verdicts.size();
        double[] confidences = new double[n];
        for (int i = 0; i < n; i++) {
            confidences[i] = verdicts.get(i).confidence();
        }

        double[] probabilities = softmax(confidences);
        List<PeerProbability> peerProbabilities = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            peerProbabilities.add(new PeerProbability(verdicts.get(i).coreName(), probabilities[i]));
        }

        int    dominantIndex = dominantIndex(confidences);
        String dominant      = verdicts.get(dominantIndex).verdict();

        Map<String, Integer> distribution = new LinkedHashMap<>();
        Map<String, Double>  verdictMass  = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            String v = verdicts.get(i).verdict();
            distribution.merge(v, 1, Integer::sum);
            verdictMass.merge(v, probabilities[i], Double::sum);
        }

        double mass      = verdictMass.get(dominant);
        double agreement = distribution.get(dominant) / (double) n;
        double entropy   = normalizedEntropy(verdictMass);

        double raw       = (MASS_WEIGHT * mass + AGREEMENT_WEIGHT * agreement) * (1.0 - ENTROPY_DAMPING * entropy);
        double consensus = round4(Math.max(0.0, Math.min(1.0, raw)));

        OptionalInt outlierIndex = OutlierDetector.detect(confidences);
        String outlier = outlierIndex.isPresent() ? verdicts.get(outlierIndex.getAsInt()).coreName() : null;

        ConfidenceClustering clustering = classify(verdicts, dominant, confidences[dominantIndex], agreement, spread(confidences));
        AdvisoryRecommendation recommendation = RecommendationPolicy.recommend(consensus, outlier != null);

        return new AdvisorySignal(
            dominant,
            peerProbabilities,
            outlier,
            clustering,
            consensus,
            recommendation,
            distribution,
            round4(entropy),
            explain(consensus, dominant, distribution, clustering, entropy, outlier));
    }

    // ── softmax & entropy ────────────────────────────────────────────────────

    private double[] softmax(double[] confidences) {
        double max = Double.NEGATIVE_INFINITY;
        for (double c : confidences) {
            max = Math.max(max, c / temperature);
        }
        double[] exps = new double[confidences.length];
        double   sum  = 0.0;
        for (int i = 0; i < confidences.length; i++) {
            exps[i] = Math.exp(confidences[i] / temperature - max);
            sum    += exps[i];
        }
        for (int i = 0; i < exps.length; i++) {
            exps[i] /= sum;
        }
        return exps;
    }

    private static double normalizedEntropy(Map<String, Double> verdictMass) {
        int k = verdictMass.size();
        if (k <= 1) {
            return 0.0;
        }
        double h = 0.0;
        for (double p : verdictMass.values()) {
            if (p > 0.0) {
                h -= p * log2(p);
            }
        }
        return Math.max(0.0, Math.min(1.0, h / log2(k)));
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }

    // ── classification ───────────────────────────────────────────────────────

    private static int dominantIndex(double[] confidences) {
        int best = 0;
        for (int i = 1; i < confidences.length; i++) {
            if (confidences[i] > confidences[best]) {
                best = i;
            }
        }
        return best;
    }

    private static double spread(double[] confidences) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double c : confidences) {
            min = Math.min(min, c);
            max = Math.max(max, c);
        }
        return max - min;
    }

    private static ConfidenceClustering classify(List<Verdict> verdicts, String dominant,
                                                 double dominantConfidence, double agreement, double spread) {
        if (agreement >= 1.0 - EPSILON && spread <= UNANIMOUS_SPREAD + EPSILON) {
            return ConfidenceClustering.UNANIMOUS;
        }
        if (agreement < STRONG_AGREEMENT - EPSILON) {
            double bestDissent = verdicts.stream()
                .filter(v -> !v.verdict().equals(dominant))
                .mapToDouble(Verdict::confidence)
                .max()
                .orElse(Double.NEGATIVE_INFINITY);
            if (dominantConfidence - bestDissent <= CONFLICT_MARGIN + EPSILON) {
                return ConfidenceClustering.CONFLICTED;
            }
        }
        if (agreement >= STRONG_AGREEMENT - EPSILON && spread <= STRONG_SPREAD + EPSILON) {
            return ConfidenceClustering.STRONG;
        }
        if (agreement >= MODERATE_AGREEMENT - EPSILON && spread <= MODERATE_SPREAD + EPSILON) {
            return ConfidenceClustering.MODERATE;
        }
        return ConfidenceClustering.FRAGMENTED;
    }

    // ── explanation ──────────────────────────────────────────────────────────

    private static String explain(double consensus, String dominant, Map<String, Integer> distribution,
                                  ConfidenceClustering clustering, double entropy, String outlier) {
        StringJoiner parts = new StringJoiner("; ");
        parts.add(strengthLabel(consensus));
        parts.add(String.format(Locale.ROOT, "dominant: %s (%.1f%%)", dominant, consensus * 100.0));
        parts.add("votes: " + votes(distribution));
        parts.add("confidence clustering: " + clustering.label());
        if (entropy < 0.2) {
            parts.add("low decision entropy");
        } else if (entropy > 0.7) {
            parts.add("high uncertainty (split council)");
        }
        if (outlier != null) {
            parts.add("statistical outlier: " + outlier);
        }
        String explanation = parts.toString();
        return explanation.length() <= MAX_EXPLANATION_LENGTH
            ? explanation
            : explanation.substring(0, MAX_EXPLANATION_LENGTH);
    }

    private static String strengthLabel(double consensus) {
        if (consensus >= 0.95) return "Near-unanimous agreement";
        if (consensus >= 0.80) return "Strong weighted consensus";
        if (consensus >= 0.60) return "Moderate consensus";
        if (consensus >= 0.40) return "Fragmented alignment";
        return "Deep disagreement detected";
    }

    private static String votes(Map<String, Integer> distribution) {
        if (distribution.size() <= 3) {
            return new TreeMap<>(distribution).entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(", "));
        }
        // stable sort keeps first-seen order among equal counts
        List<Map.Entry<String, Integer>> top = distribution.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
            .limit(2)
            .collect(Collectors.toList());
        return top.get(0).getKey() + ":" + top.get(0).getValue() + ", "
             + top.get(1).getKey() + ":" + top.get(1).getValue()
             + " (+" + (distribution.size() - 2) + " more)";
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
