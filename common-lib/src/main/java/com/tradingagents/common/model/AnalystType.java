package com.tradingagents.common.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four Phase-1 analysts. {@code key} is the configuration name used in
 * {@code workflow.selected-analysts}; {@code stageName} identifies the stage in logs and
 * {@code agentsExecuted}.
 */
public enum AnalystType {
    MARKET("market", "Market Analyst"),
    SOCIAL("social", "Social Analyst"),
    NEWS("news", "News Analyst"),
    FUNDAMENTALS("fundamentals", "Fundamentals Analyst");

    private final String key;
    private final String stageName;

    AnalystType(String key, String stageName) {
        this.key = key;
        this.stageName = stageName;
    }

    public String key() { return key; }

    public String stageName() { return stageName; }

    public static Optional<AnalystType> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(t -> t.key.equals(normalized))
            .findFirst();
    }
}
