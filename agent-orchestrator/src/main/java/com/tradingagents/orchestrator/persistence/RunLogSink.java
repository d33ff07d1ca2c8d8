package com.tradingagents.orchestrator.persistence;

import com.tradingagents.common.exception.PersistenceFailureException;

import java.time.LocalDate;

/** Destination for completed run logs. */
public interface RunLogSink {

    /**
     * @param tradeDate the run that was just added to {@code record}
     * @throws PersistenceFailureException when the log cannot be written
     */
    void writeRunLog(String ticker, LocalDate tradeDate, ExecutionRecord record);
}
