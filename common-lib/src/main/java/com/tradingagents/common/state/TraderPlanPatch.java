package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

public record TraderPlanPatch(String plan) implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withTraderPlan(plan);
    }
}
