package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

/** Research manager verdict. Becomes both the debate's judge decision and the investment plan. */
public record InvestmentJudgePatch(String verdict) implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return state
            .withInvestDebate(state.investDebate().withJudgeDecision(verdict))
            .withInvestmentPlan(verdict);
    }
}
