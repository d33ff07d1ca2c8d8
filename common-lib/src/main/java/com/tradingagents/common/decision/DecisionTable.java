package com.tradingagents.common.decision;

import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.risk.RiskLevel;

/**
 * Fixed mapping of (trader sentiment, risk) to an action and its justification.
 *
 * <pre>
 *   HIGH risk or score &gt; 0.8      → HOLD
 *   confidence &lt; 0.3             → HOLD
 *   BULLISH + LOW                  → BUY
 *   BULLISH + MEDIUM               → BUY_SMALL
 *   BEARISH + LOW                  → SELL
 *   BEARISH + MEDIUM               → SELL_SMALL
 *   anything else                  → HOLD
 * </pre>
 */
public final class DecisionTable {

    static final double FORCE_HOLD_SCORE = 0.8;
    static final double MIN_CONFIDENCE   = 0.3;

    private DecisionTable() {}

    public record Entry(DecisionAction action, String justification) {}

    public static Entry lookup(TraderSentiment sentiment, RiskAssessment risk) {
        // ── Gate: risk ceiling ──
        if (risk.overallRisk() == RiskLevel.HIGH || risk.overallScore() > FORCE_HOLD_SCORE) {
            return new Entry(DecisionAction.HOLD, "High risk detected, avoiding exposure until conditions improve");
        }
        // ── Gate: confidence floor ──
        if (risk.confidence() < MIN_CONFIDENCE) {
            return new Entry(DecisionAction.HOLD, "Insufficient confidence in analysis, requiring additional data");
        }

        if (sentiment == TraderSentiment.BULLISH && risk.overallRisk() == RiskLevel.LOW) {
            return new Entry(DecisionAction.BUY, "Strong bullish signal with acceptable risk profile");
        }
        if (sentiment == TraderSentiment.BULLISH && risk.overallRisk() == RiskLevel.MEDIUM) {
            return new Entry(DecisionAction.BUY_SMALL, "Bullish signal but reducing position size due to moderate risk");
        }
        if (sentiment == TraderSentiment.BEARISH && risk.overallRisk() == RiskLevel.LOW) {
            return new Entry(DecisionAction.SELL, "Bearish signal with low risk environment for short position");
        }
        if (sentiment == TraderSentiment.BEARISH && risk.overallRisk() == RiskLevel.MEDIUM) {
            return new Entry(DecisionAction.SELL_SMALL, "Bearish signal but reducing position size due to moderate risk");
        }
        return new Entry(DecisionAction.HOLD, "Mixed signals or insufficient conviction for directional trade");
    }
}
