package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.sizing.PositionSizing;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The shared record threaded through every workflow phase.
 *
 * <p>Immutable: every {@code with*} method returns a new instance and leaves the receiver
 * untouched, so earlier snapshots stay valid for logging and diffing. Stages never build
 * an {@code AgentState} directly; they return a {@link com.tradingagents.common.state.StatePatch}
 * which {@link com.tradingagents.common.state.StatePropagator} merges.
 *
 * <p>Report fields are empty strings until their owning analyst succeeds.
 * {@code riskMetrics} and {@code positionSizing} stay {@code null} until the risk judge runs.
 */
public record AgentState(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("tradeDate") LocalDate tradeDate,
    @JsonProperty("marketReport") String marketReport,
    @JsonProperty("sentimentReport") String sentimentReport,
    @JsonProperty("newsReport") String newsReport,
    @JsonProperty("fundamentalsReport") String fundamentalsReport,
    @JsonProperty("investDebate") InvestDebateState investDebate,
    @JsonProperty("investmentPlan") String investmentPlan,
    @JsonProperty("traderPlan") String traderPlan,
    @JsonProperty("riskDebate") RiskDebateState riskDebate,
    @JsonProperty("finalDecision") String finalDecision,
    @JsonProperty("riskMetrics") RiskAssessment riskMetrics,
    @JsonProperty("positionSizing") PositionSizing positionSizing,
    @JsonProperty("messages") List<String> messages,
    @JsonProperty("agentsExecuted") List<String> agentsExecuted
) {

    public AgentState {
        marketReport       = marketReport != null ? marketReport : "";
        sentimentReport    = sentimentReport != null ? sentimentReport : "";
        newsReport         = newsReport != null ? newsReport : "";
        fundamentalsReport = fundamentalsReport != null ? fundamentalsReport : "";
        investDebate       = investDebate != null ? investDebate : InvestDebateState.empty();
        investmentPlan     = investmentPlan != null ? investmentPlan : "";
        traderPlan         = traderPlan != null ? traderPlan : "";
        riskDebate         = riskDebate != null ? riskDebate : RiskDebateState.empty();
        finalDecision      = finalDecision != null ? finalDecision : "";
        messages           = messages != null ? List.copyOf(messages) : List.of();
        agentsExecuted     = agentsExecuted != null ? List.copyOf(agentsExecuted) : List.of();
    }

    /** Report text for the given analyst; empty string when that analyst has not contributed. */
    public String reportFor(AnalystType type) {
        return switch (type) {
            case MARKET       -> marketReport;
            case SOCIAL       -> sentimentReport;
            case NEWS         -> newsReport;
            case FUNDAMENTALS -> fundamentalsReport;
        };
    }

    public boolean hasReport(AnalystType type) {
        return !reportFor(type).isBlank();
    }

    // ── Copy-on-write withers ────────────────────────────────────────────────

    public AgentState withMarketReport(String report) {
        return new AgentState(ticker, tradeDate, report, sentimentReport, newsReport, fundamentalsReport,
            investDebate, investmentPlan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withSentimentReport(String report) {
        return new AgentState(ticker, tradeDate, marketReport, report, newsReport, fundamentalsReport,
            investDebate, investmentPlan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withNewsReport(String report) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, report, fundamentalsReport,
            investDebate, investmentPlan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withFundamentalsReport(String report) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, report,
            investDebate, investmentPlan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withInvestDebate(InvestDebateState debate) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, fundamentalsReport,
            debate, investmentPlan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withInvestmentPlan(String plan) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, fundamentalsReport,
            investDebate, plan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withTraderPlan(String plan) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, fundamentalsReport,
            investDebate, investmentPlan, plan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withRiskDebate(RiskDebateState debate) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, fundamentalsReport,
            investDebate, investmentPlan, traderPlan, debate, finalDecision, riskMetrics,
            positionSizing, messages, agentsExecuted);
    }

    public AgentState withFinalDecision(String decision, RiskAssessment metrics, PositionSizing sizing) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, fundamentalsReport,
            investDebate, investmentPlan, traderPlan, riskDebate, decision, metrics,
            sizing, messages, agentsExecuted);
    }

    public AgentState withMessages(List<String> newMessages) {
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, fundamentalsReport,
            investDebate, investmentPlan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, newMessages, agentsExecuted);
    }

    public AgentState appendMessages(List<String> more) {
        if (more == null || more.isEmpty()) return this;
        List<String> merged = new ArrayList<>(messages);
        merged.addAll(more);
        return withMessages(merged);
    }

    public AgentState appendExecuted(String stageName) {
        List<String> merged = new ArrayList<>(agentsExecuted);
        merged.add(stageName);
        return new AgentState(ticker, tradeDate, marketReport, sentimentReport, newsReport, fundamentalsReport,
            investDebate, investmentPlan, traderPlan, riskDebate, finalDecision, riskMetrics,
            positionSizing, messages, merged);
    }
}
