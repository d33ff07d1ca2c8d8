package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

/** Records a successfully merged stage in {@code agentsExecuted}. Owned by the scheduler. */
public record StageExecutedPatch(String stageName) implements StatePatch {

    @Override
    public AgentState applyTo(AgentState state) {
        return state.appendExecuted(stageName);
    }
}
