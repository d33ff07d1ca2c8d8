package com.tradingagents.common.model;

public enum RiskStance {
    RISKY("Risky Analyst"),
    SAFE("Safe Analyst"),
    NEUTRAL("Neutral Analyst");

    private final String speaker;

    RiskStance(String speaker) { this.speaker = speaker; }

    public String speaker() { return speaker; }
}
