package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.RiskStance;

/** One risky, safe or neutral argument, appended to the risk discussion. */
public record RiskDebatePatch(RiskStance stance, String argument) implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withRiskDebate(state.riskDebate().append(stance, argument));
    }
}
