package com.advisoryplatform.common.model;

/**
 * Fixed advisory vocabulary emitted by the consensus advisor.
 * Consumers treat these as suggestions; none of them triggers an action by itself.
 */
public enum AdvisoryRecommendation {
    PROCEED,
    PROCEED_CAUTIOUSLY,
    PAUSE_AND_VERIFY,
    ESCALATE_TO_REVIEW,
    OUTLIER_INVESTIGATION
}
