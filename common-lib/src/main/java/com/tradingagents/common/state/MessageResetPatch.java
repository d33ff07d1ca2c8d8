package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

import java.util.List;

/**
 * Explicit reset marker for the message transcript. Applied after the analyst phase so the
 * transcript does not grow across phases.
 */
public record MessageResetPatch() implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withMessages(List.of());
    }
}
