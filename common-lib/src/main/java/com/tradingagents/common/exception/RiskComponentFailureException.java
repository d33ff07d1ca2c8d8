package com.tradingagents.common.exception;

/** One risk sub-assessment failed. Replaced by the neutral degenerate result. */
public class RiskComponentFailureException extends WorkflowException {

    public RiskComponentFailureException(String component, String message) {
        super(component, message);
    }

    public RiskComponentFailureException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
