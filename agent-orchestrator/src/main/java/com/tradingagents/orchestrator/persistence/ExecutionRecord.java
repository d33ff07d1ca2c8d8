package com.tradingagents.orchestrator.persistence;

import com.tradingagents.common.state.LoggableState;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loggable states of one ticker, keyed by trade date. Immutable; {@link #with} returns a copy
 * so a record handed to a sink is never changed underneath it.
 */
public record ExecutionRecord(String ticker, Map<LocalDate, LoggableState> runs) {

    public ExecutionRecord {
        runs = Collections.unmodifiableMap(new TreeMap<>(runs));
    }

    public static ExecutionRecord empty(String ticker) {
        return new ExecutionRecord(ticker, Map.of());
    }

    /** Adds or replaces the run for {@code tradeDate}. */
    public ExecutionRecord with(LocalDate tradeDate, LoggableState state) {
        Map<LocalDate, LoggableState> next = new TreeMap<>(runs);
        next.put(tradeDate, state);
        return new ExecutionRecord(ticker, next);
    }

    /** Like {@link #with(LocalDate, LoggableState)}, then drops the oldest dates beyond {@code maxRuns}. */
    public ExecutionRecord with(LocalDate tradeDate, LoggableState state, int maxRuns) {
        TreeMap<LocalDate, LoggableState> next = new TreeMap<>(runs);
        next.put(tradeDate, state);
        while (next.size() > maxRuns) {
            next.pollFirstEntry();
        }
        return new ExecutionRecord(ticker, next);
    }
}
