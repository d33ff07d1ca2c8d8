package com.tradingagents.common.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.sizing.PositionSizing;

import java.time.LocalDate;
import java.util.List;

/**
 * Summary projection of an {@code AgentState} for run logs. Keeps reports and decisions;
 * drops the message transcript and per-speaker debate histories.
 */
public record LoggableState(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("tradeDate") LocalDate tradeDate,
    @JsonProperty("marketReport") String marketReport,
    @JsonProperty("sentimentReport") String sentimentReport,
    @JsonProperty("newsReport") String newsReport,
    @JsonProperty("fundamentalsReport") String fundamentalsReport,
    @JsonProperty("investDebate") DebateSummary investDebate,
    @JsonProperty("investmentPlan") String investmentPlan,
    @JsonProperty("traderPlan") String traderPlan,
    @JsonProperty("riskDebate") DebateSummary riskDebate,
    @JsonProperty("finalDecision") String finalDecision,
    @JsonProperty("riskMetrics") RiskAssessment riskMetrics,
    @JsonProperty("positionSizing") PositionSizing positionSizing,
    @JsonProperty("agentsExecuted") List<String> agentsExecuted
) {

    public record DebateSummary(
        @JsonProperty("rounds") int rounds,
        @JsonProperty("arguments") int arguments,
        @JsonProperty("judgeDecision") String judgeDecision
    ) {}
}
