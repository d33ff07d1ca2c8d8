package com.tradingagents.common.exception;

/** A stage threw or its publisher errored. Captured as a failed outcome and excluded from the merge. */
public class StageFailureException extends WorkflowException {

    public StageFailureException(String component, String message) {
        super(component, message);
    }

    public StageFailureException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
