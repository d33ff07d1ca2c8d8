package com.tradingagents.common.decision;

import com.tradingagents.common.signal.TradeAction;

/** Final action, including the reduced-size variants. */
public enum DecisionAction {
    BUY(TradeAction.BUY),
    BUY_SMALL(TradeAction.BUY),
    SELL(TradeAction.SELL),
    SELL_SMALL(TradeAction.SELL),
    HOLD(TradeAction.HOLD);

    private final TradeAction direction;

    DecisionAction(TradeAction direction) { this.direction = direction; }

    public TradeAction direction() { return direction; }
}
