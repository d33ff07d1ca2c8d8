package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

import java.util.List;

/** Output of the market analyst: its report plus the transcript lines it produced. */
public record MarketReportPatch(String report, List<String> messages) implements StatePatch {

    public MarketReportPatch {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withMarketReport(report).appendMessages(messages);
    }
}
