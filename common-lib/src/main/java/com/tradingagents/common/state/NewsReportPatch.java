package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

import java.util.List;

/** Output of the news analyst: its report plus the transcript lines it produced. */
public record NewsReportPatch(String report, List<String> messages) implements StatePatch {

    public NewsReportPatch {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withNewsReport(report).appendMessages(messages);
    }
}
