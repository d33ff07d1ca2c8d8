package com.tradingagents.common.state;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.InvestDebateState;
import com.tradingagents.common.model.RiskDebateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns creation, merging and projection of {@link AgentState}.
 *
 * <p>Merging is copy-on-write: {@link #updateState} returns a new state and never alters its
 * input. Merge never throws; a patch that fails to apply is logged and skipped.
 */
public final class StatePropagator {

    private static final Logger log = LoggerFactory.getLogger(StatePropagator.class);

    private StatePropagator() {}

    /**
     * Fresh state for a run: empty reports, zeroed debate counters, and a transcript seeded
     * with the ticker as the initial human message.
     */
    public static AgentState createInitialState(String ticker, LocalDate tradeDate) {
        return new AgentState(ticker, tradeDate, "", "", "", "",
            InvestDebateState.empty(), "", "", RiskDebateState.empty(), "", null, null,
            ticker != null ? List.of(ticker) : List.of(), List.of());
    }

    public static AgentState updateState(AgentState state, StatePatch patch) {
        if (patch == null) return state;
        try {
            AgentState next = patch.applyTo(state);
            return next != null ? next : state;
        } catch (RuntimeException e) {
            log.warn("[StatePropagator] Patch could not be applied, skipping. patch={} reason={}",
                patch.getClass().getSimpleName(), e.getMessage());
            return state;
        }
    }

    /** Applies {@code patches} left to right; the later patch wins on overlap. */
    public static AgentState mergeAll(AgentState state, List<? extends StatePatch> patches) {
        AgentState current = state;
        for (StatePatch patch : patches) {
            current = updateState(current, patch);
        }
        return current;
    }

    public static AgentState clearMessages(AgentState state) {
        return updateState(state, new MessageResetPatch());
    }

    /** @return human-readable problems; empty when the state is usable */
    public static List<String> validateState(AgentState state) {
        List<String> errors = new ArrayList<>();
        if (state == null) {
            errors.add("State is missing");
            return errors;
        }
        if (state.ticker() == null || state.ticker().isBlank()) errors.add("Company of interest is required");
        if (state.tradeDate() == null) errors.add("Trade date is required");
        return errors;
    }

    public static LoggableState extractLoggableState(AgentState state) {
        InvestDebateState invest = state.investDebate();
        RiskDebateState risk = state.riskDebate();
        return new LoggableState(
            state.ticker(),
            state.tradeDate(),
            state.marketReport(),
            state.sentimentReport(),
            state.newsReport(),
            state.fundamentalsReport(),
            new LoggableState.DebateSummary(invest.round(), invest.history().size(), invest.judgeDecision()),
            state.investmentPlan(),
            state.traderPlan(),
            new LoggableState.DebateSummary(risk.round(), risk.history().size(), risk.judgeDecision()),
            state.finalDecision(),
            state.riskMetrics(),
            state.positionSizing(),
            state.agentsExecuted());
    }
}
