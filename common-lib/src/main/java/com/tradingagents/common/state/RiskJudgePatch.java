package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.sizing.PositionSizing;

/**
 * Risk judge output: the risk discussion verdict, the final decision string, and the risk
 * metrics and sizing it was based on.
 */
public record RiskJudgePatch(
    String verdict,
    String finalDecision,
    RiskAssessment riskMetrics,
    PositionSizing positionSizing
) implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return state
            .withRiskDebate(state.riskDebate().withJudgeDecision(verdict))
            .withFinalDecision(finalDecision, riskMetrics, positionSizing);
    }
}
