package com.advisoryplatform.common.consensus;

import com.advisoryplatform.common.model.AdvisoryRecommendation;

/**
 * Maps a consensus level and an outlier flag to an {@link AdvisoryRecommendation}.
 * Nothing else feeds the decision.
 *
 * <pre>
 *   outlier AND consensus ≥ 0.80 → OUTLIER_INVESTIGATION
 *   consensus ≥ 0.90             → PROCEED
 *   consensus ≥ 0.75             → PROCEED_CAUTIOUSLY
 *   consensus ≥ 0.60             → PAUSE_AND_VERIFY
 *   otherwise                    → ESCALATE_TO_REVIEW
 * </pre>
 *
 * <p>An outlier below 0.80 consensus does not change the outcome; the weak consensus
 * already routes the decision to a slower path.
 */
public final class RecommendationPolicy {

    public static final double OUTLIER_FLOOR  = 0.80;
    public static final double PROCEED_FLOOR  = 0.90;
    public static final double CAUTIOUS_FLOOR = 0.75;
    public static final double VERIFY_FLOOR   = 0.60;

    private RecommendationPolicy() {}

    public static AdvisoryRecommendation recommend(double consensusLevel, boolean outlierDetected) {
        if (outlierDetected && consensusLevel >= OUTLIER_FLOOR) return AdvisoryRecommendation.OUTLIER_INVESTIGATION;
        if (consensusLevel >= PROCEED_FLOOR)                    return AdvisoryRecommendation.PROCEED;
        if (consensusLevel >= CAUTIOUS_FLOOR)                   return AdvisoryRecommendation.PROCEED_CAUTIOUSLY;
        if (consensusLevel >= VERIFY_FLOOR)                     return AdvisoryRecommendation.PAUSE_AND_VERIFY;
        return AdvisoryRecommendation.ESCALATE_TO_REVIEW;
    }
}
