package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;

import java.util.List;

/** Output of the social sentiment analyst: its report plus the transcript lines it produced. */
public record SentimentReportPatch(String report, List<String> messages) implements StatePatch {

    public SentimentReportPatch {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    @Override
    public AgentState applyTo(AgentState state) {
        return state.withSentimentReport(report).appendMessages(messages);
    }
}
