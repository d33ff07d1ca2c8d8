package com.tradingagents.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingagents.common.sizing.PortfolioConstraints;
import com.tradingagents.common.sizing.PositionSizing;

/**
 * Output of {@link DecisionSynthesizer}.
 *
 * @param action          final action
 * @param sizing          position sizing the action was evaluated with
 * @param justification   non-empty audit text
 * @param sentiment       trader sentiment the table was keyed by
 * @param constraintCheck portfolio limits checked against the recommended size
 */
public record TradeDecision(
    @JsonProperty("action") DecisionAction action,
    @JsonProperty("sizing") PositionSizing sizing,
    @JsonProperty("justification") String justification,
    @JsonProperty("sentiment") TraderSentiment sentiment,
    @JsonProperty("constraintCheck") PortfolioConstraints.Check constraintCheck
) {

    /** {@code "<ACTION> - <justification>"}, the form stored as the run's final decision. */
    public String asDecisionString() {
        return action.name() + " - " + justification;
    }
}
