package com.tradingagents.common.decision;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies {@link TraderSentiment#classify}: substring keyword matching with bullish
 * terms checked before bearish ones.
 */
class TraderSentimentTest {

    @Test
    @DisplayName("inflected forms count: buying, selling, shorting")
    void inflectedForms() {
        assertEquals(TraderSentiment.BULLISH, TraderSentiment.classify("We recommend buying NVDA now"));
        assertEquals(TraderSentiment.BEARISH, TraderSentiment.classify("Start selling the position"));
        assertEquals(TraderSentiment.BEARISH, TraderSentiment.classify("Shorting is advised"));
    }

    @Test
    void bullishTermsWinOverBearish() {
        assertEquals(TraderSentiment.BULLISH, TraderSentiment.classify("Sell the calls, buy the shares"));
    }

    @Test
    void caseIsIgnored() {
        assertEquals(TraderSentiment.BEARISH, TraderSentiment.classify("BEARISH outlook"));
    }

    @Test
    void noKeywordOrBlankIsNeutral() {
        assertEquals(TraderSentiment.NEUTRAL, TraderSentiment.classify("Wait for the earnings call"));
        assertEquals(TraderSentiment.NEUTRAL, TraderSentiment.classify("  "));
        assertEquals(TraderSentiment.NEUTRAL, TraderSentiment.classify(null));
    }
}
