package com.tradingagents.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one risk-dimension sub-assessment.
 *
 * @param score      component risk score, clamped to [0,1]
 * @param confidence how much the component trusts its own score, clamped to [0,1]
 * @param factors    human-readable contributors; placeholder factors mark missing data
 * @param degraded   true when the sub-assessment failed and this is the neutral stand-in
 */
public record RiskComponentResult(
    @JsonProperty("score") double score,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("factors") List<String> factors,
    @JsonProperty("degraded") boolean degraded
) {

    public static final double NEUTRAL_SCORE = 0.5;
    private static final String FAILED_SUFFIX = "assessment failed";

    public RiskComponentResult {
        score      = RiskMath.clamp01(score);
        confidence = RiskMath.clamp01(confidence);
        factors    = factors != null ? List.copyOf(factors) : List.of();
    }

    /**
     * Successful result. Confidence grows with the number of informative factors:
     * 0.3 base, +0.15 per informative factor, capped at 0.9.
     */
    public static RiskComponentResult of(double score, List<String> factors) {
        long informative = factors == null ? 0 : factors.stream().filter(RiskComponentResult::isInformative).count();
        double confidence = Math.min(0.9, 0.3 + 0.15 * informative);
        return new RiskComponentResult(score, confidence, factors, false);
    }

    /** Degenerate neutral result that replaces a failed sub-assessment. */
    public static RiskComponentResult failed(RiskDimension dimension) {
        return new RiskComponentResult(NEUTRAL_SCORE, 0.0,
            List.of(capitalize(dimension.label()) + " risk " + FAILED_SUFFIX), true);
    }

    /** Placeholder text for a dimension whose input was missing. */
    public static String noDataFactor(String what) {
        return "No " + what + " available";
    }

    /**
     * False for "no data" placeholders and failure markers; these do not count toward
     * data completeness.
     */
    public static boolean isInformative(String factor) {
        if (factor == null || factor.isBlank()) return false;
        if (factor.startsWith("No ") && factor.endsWith("available")) return false;
        return !factor.endsWith(FAILED_SUFFIX);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
