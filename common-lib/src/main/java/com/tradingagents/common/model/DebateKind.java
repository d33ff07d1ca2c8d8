package com.tradingagents.common.model;

/** The two independent debates a run holds. */
public enum DebateKind {
    INVESTMENT,
    RISK
}
