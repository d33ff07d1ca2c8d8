package com.tradingagents.common.sizing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of {@link PositionSizingEngine}. All sizes are fractions of portfolio value.
 *
 * @param kellyFraction            raw Kelly fraction clamped to [0, 0.20]
 * @param kellySize                Kelly estimate as a tradable size (at least 0.01)
 * @param riskAdjustedSize         after the risk-score multiplier
 * @param volatilityAdjustedSize   after the volatility multiplier
 * @param portfolioConstrainedSize after the portfolio bounds [0.01, 0.25]
 * @param recommendedSize          min(0.5 · kellySize, every shrunk value), within [0.01, 0.25]
 * @param reasoning                factor breakdown for audit logs
 */
public record PositionSizing(
    @JsonProperty("kellyFraction") double kellyFraction,
    @JsonProperty("kellySize") double kellySize,
    @JsonProperty("riskAdjustedSize") double riskAdjustedSize,
    @JsonProperty("volatilityAdjustedSize") double volatilityAdjustedSize,
    @JsonProperty("portfolioConstrainedSize") double portfolioConstrainedSize,
    @JsonProperty("recommendedSize") double recommendedSize,
    @JsonProperty("reasoning") String reasoning
) {

    public static final double CONSERVATIVE_SIZE = 0.05;

    /** Flat 5% sizing used when the sizing pipeline itself cannot run. */
    public static PositionSizing conservativeDefault(String reason) {
        return new PositionSizing(CONSERVATIVE_SIZE, CONSERVATIVE_SIZE, CONSERVATIVE_SIZE,
            CONSERVATIVE_SIZE, CONSERVATIVE_SIZE, CONSERVATIVE_SIZE, "Conservative default: " + reason);
    }
}
