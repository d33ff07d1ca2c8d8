package com.tradingagents.common.signal;

/** Canonical action token extracted from free text. */
public enum TradeAction {
    BUY,
    SELL,
    HOLD
}
