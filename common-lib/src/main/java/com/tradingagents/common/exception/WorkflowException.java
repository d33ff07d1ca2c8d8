package com.tradingagents.common.exception;

public class WorkflowException extends RuntimeException {
    private final String component;

    public WorkflowException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public WorkflowException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
