package com.tradingagents.common.exception;

/** Decision synthesis failed. Replaced by the conservative HOLD fallback. */
public class DecisionFailureException extends WorkflowException {

    public DecisionFailureException(String component, String message) {
        super(component, message);
    }

    public DecisionFailureException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
