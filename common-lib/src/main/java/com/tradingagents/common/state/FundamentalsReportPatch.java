package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

import java.util.List;

/** Output of the fundamentals analyst: its report plus the transcript lines it produced. */
public record FundamentalsReportPatch(String report, List<String> messages) implements StatePatch {

    public FundamentalsReportPatch {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withFundamentalsReport(report).appendMessages(messages);
    }
}
