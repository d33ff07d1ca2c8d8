package com.tradingagents.orchestrator.risk;

import java.util.Locale;

/** Substring keyword checks over lower-cased report text. */
final class Keywords {

    private Keywords() {}

    static boolean containsAny(String lowerText, String... keywords) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) return true;
        }
        return false;
    }

    static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
