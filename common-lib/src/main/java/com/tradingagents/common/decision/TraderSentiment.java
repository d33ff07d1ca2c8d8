package com.tradingagents.common.decision;

import java.util.Locale;

/** Directional stance of the trader's plan. */
public enum TraderSentiment {
    BULLISH,
    BEARISH,
    NEUTRAL;

    private static final String[] BULLISH_TERMS = {"buy", "long", "bullish"};
    private static final String[] BEARISH_TERMS = {"sell", "short", "bearish"};

    /**
     * Substring keyword presence, bullish terms first, so inflections such as "buying" or
     * "shorting" count. Like the signal classifier this ignores negation.
     */
    public static TraderSentiment classify(String plan) {
        if (plan == null || plan.isBlank()) return NEUTRAL;
        String lower = plan.toLowerCase(Locale.ROOT);
        if (containsAny(lower, BULLISH_TERMS)) return BULLISH;
        if (containsAny(lower, BEARISH_TERMS)) return BEARISH;
        return NEUTRAL;
    }

    private static boolean containsAny(String text, String[] terms) {
        for (String term : terms) {
            if (text.contains(term)) return true;
        }
        return false;
    }
}
