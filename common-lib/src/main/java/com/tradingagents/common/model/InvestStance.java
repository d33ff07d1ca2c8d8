package com.tradingagents.common.model;

public enum InvestStance {
    BULL("Bull Analyst"),
    BEAR("Bear Analyst");

    private final String speaker;

    InvestStance(String speaker) { this.speaker = speaker; }

    public String speaker() { return speaker; }
}
