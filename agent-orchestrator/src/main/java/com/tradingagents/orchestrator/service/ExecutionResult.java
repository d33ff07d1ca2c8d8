package com.tradingagents.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.signal.TradeAction;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one {@code execute(ticker, tradeDate)} call.
 *
 * <p>{@code REJECTED} means the request itself was invalid and no stage ran. {@code FAILED}
 * means the orchestration broke after the run started; the signal is then HOLD and
 * {@code finalState} is the state the run started from. Stage, risk, decision and persistence
 * failures never reach this level; they degrade inside a {@code COMPLETED} run.
 */
public record ExecutionResult(
    @JsonProperty("status") Status status,
    @JsonProperty("ticker") String ticker,
    @JsonProperty("tradeDate") LocalDate tradeDate,
    @JsonProperty("runId") String runId,
    @JsonProperty("finalState") AgentState finalState,
    @JsonProperty("processedSignal") TradeAction processedSignal,
    @JsonProperty("agentsExecuted") List<String> agentsExecuted,
    @JsonProperty("executionTimeMs") long executionTimeMs,
    @JsonProperty("error") String error
) {

    public enum Status { COMPLETED, REJECTED, FAILED }

    public ExecutionResult {
        agentsExecuted = agentsExecuted != null ? List.copyOf(agentsExecuted) : List.of();
    }

    public static ExecutionResult success(String runId, AgentState finalState, TradeAction signal, long elapsedMs) {
        return new ExecutionResult(Status.COMPLETED, finalState.ticker(), finalState.tradeDate(), runId, finalState,
            signal, finalState.agentsExecuted(), elapsedMs, null);
    }

    public static ExecutionResult rejected(String ticker, LocalDate tradeDate, String runId, String error, long elapsedMs) {
        return new ExecutionResult(Status.REJECTED, ticker, tradeDate, runId, null, TradeAction.HOLD, List.of(),
            elapsedMs, error);
    }

    public static ExecutionResult failed(String runId, AgentState startState, String error, long elapsedMs) {
        return new ExecutionResult(Status.FAILED, startState.ticker(), startState.tradeDate(), runId, startState,
            TradeAction.HOLD, List.of(), elapsedMs, error);
    }

    public boolean hasError() {
        return status != Status.COMPLETED;
    }
}
