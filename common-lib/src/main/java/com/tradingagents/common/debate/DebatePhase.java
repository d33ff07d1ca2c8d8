package com.tradingagents.common.debate;

/** States of the bounded debate machine. {@code DONE} is terminal. */
public enum DebatePhase {
    DEBATING,
    JUDGING,
    DONE
}
