package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.DebateKind;

/** Marks the end of one debate round. Owned by the scheduler, not by any stage. */
public record DebateRoundPatch(DebateKind kind) implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return switch (kind) {
            case INVESTMENT -> state.withInvestDebate(state.investDebate().nextRound());
            case RISK       -> state.withRiskDebate(state.riskDebate().nextRound());
        };
    }
}
