package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.InvestStance;

/** One bull or bear argument, appended to the investment debate. */
public record InvestDebatePatch(InvestStance stance, String argument) implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withInvestDebate(state.investDebate().append(stance, argument));
    }
}
