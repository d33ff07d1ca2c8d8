package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.AnalystType;

import java.util.List;

/**
 * Partial update produced by exactly one kind of stage.
 *
 * <p>The set of patch types is closed. Each type touches only the fields its stage owns,
 * so two stages in the same phase can never write the same field. The only shared field is
 * the append-only {@code messages} transcript, which merges by concatenation.
 *
 * <p>{@link #applyTo(AgentState)} must return a new state and leave its argument untouched.
 */
public sealed interface StatePatch permits
        MarketReportPatch, SentimentReportPatch, NewsReportPatch, FundamentalsReportPatch,
        InvestDebatePatch, InvestmentJudgePatch, TraderPlanPatch,
        RiskDebatePatch, RiskJudgePatch,
        DebateRoundPatch, MessageResetPatch, StageExecutedPatch {

    AgentState applyTo(AgentState state);

    static StatePatch analystReport(AnalystType type, String report, List<String> messages) {
        return switch (type) {
            case MARKET       -> new MarketReportPatch(report, messages);
            case SOCIAL       -> new SentimentReportPatch(report, messages);
            case NEWS         -> new NewsReportPatch(report, messages);
            case FUNDAMENTALS -> new FundamentalsReportPatch(report, messages);
        };
    }
}
