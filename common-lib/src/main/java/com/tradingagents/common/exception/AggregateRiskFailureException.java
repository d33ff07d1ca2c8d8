package com.tradingagents.common.exception;

/** The risk engine could not produce an aggregate. Replaced by the fail-safe assessment. */
public class AggregateRiskFailureException extends WorkflowException {

    public AggregateRiskFailureException(String component, String message) {
        super(component, message);
    }

    public AggregateRiskFailureException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
