package com.tradingagents.common.exception;

/**
 * The initial state could not be built (invalid ticker or trade date). The only failure
 * that surfaces from a run as an explicit error.
 */
public class InvalidRunRequestException extends WorkflowException {

    public InvalidRunRequestException(String message) {
        super("workflow", message);
    }
}
