package com.tradingagents.common.exception;

/** Writing the run log failed. Logged and swallowed; the run result is still returned. */
public class PersistenceFailureException extends WorkflowException {

    public PersistenceFailureException(String component, String message) {
        super(component, message);
    }

    public PersistenceFailureException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
