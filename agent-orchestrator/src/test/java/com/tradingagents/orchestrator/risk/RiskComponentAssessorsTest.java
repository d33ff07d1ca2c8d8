package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.common.risk.RiskComponentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the per-dimension risk heuristics on hand-computed inputs.
 */
class RiskComponentAssessorsTest {

    private static final double EPS = 1e-9;
    private static final IndicatorSnapshot NO_INDICATORS = IndicatorSnapshot.empty();

    private static IndicatorSnapshot snapshot(Double rsi, Double vol, Boolean clustering,
                                              Double sectorSentiment, Double pe, Double de) {
        return new IndicatorSnapshot(rsi, vol, clustering, sectorSentiment, pe, de);
    }

    // ── Market ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Market")
    class MarketTests {

        @Test
        void missingReportIsNeutralNoData() {
            RiskComponentResult r = MarketRiskAssessor.score("", NO_INDICATORS);
            assertEquals(0.5, r.score(), EPS);
            assertEquals(List.of("No market data available"), r.factors());
            assertEquals(0.3, r.confidence(), EPS);
        }

        @Test
        @DisplayName("overbought RSI with a rally: 0.3 + 0.45*0.3 - 0.1")
        void overboughtRally() {
            RiskComponentResult r = MarketRiskAssessor.score("Stocks rally on strong gains",
                snapshot(75.0, null, null, null, null, null));
            assertEquals(0.335, r.score(), EPS);
            assertEquals(List.of("RSI overbought condition", "Market rally indicators"), r.factors());
            assertEquals(0.6, r.confidence(), EPS);
        }

        @Test
        @DisplayName("unknown RSI yields a no-data factor, not a guess")
        void noRsi() {
            RiskComponentResult r = MarketRiskAssessor.score("Volatile session, sharp decline", NO_INDICATORS);
            assertEquals(0.74, r.score(), EPS);
            assertEquals("No RSI data available", r.factors().get(0));
            assertFalse(RiskComponentResult.isInformative(r.factors().get(0)));
        }
    }

    // ── Sentiment / News / Fundamentals ─────────────────────────────────────

    @Test
    void sentimentBearishPanic() {
        RiskComponentResult r = SentimentRiskAssessor.score("Bearish chatter turning to panic",
            snapshot(null, null, null, -0.5, null, null));
        assertEquals(0.85, r.score(), EPS);
        assertTrue(r.factors().contains("Negative sector sentiment"));
        assertTrue(r.factors().contains("Extreme sentiment - potential reversal risk"));
    }

    @Test
    void newsRegulatoryImpact() {
        RiskComponentResult r = NewsRiskAssessor.score("Breaking: SEC lawsuit filed");
        assertEquals(0.58, r.score(), EPS);
        assertEquals(List.of("News impact score: 0.10", "Regulatory/legal news risk"), r.factors());
    }

    @Test
    void newsImpactIsCapped() {
        assertEquals(0.5, NewsRiskAssessor.impactScore("breaking urgent major significant unprecedented"), EPS);
    }

    @Test
    void fundamentalsValuationAndStrength() {
        RiskComponentResult r = FundamentalRiskAssessor.score("Strong profit growth",
            snapshot(null, null, null, null, 35.0, 2.0));
        assertEquals(0.42, r.score(), EPS);
        assertEquals(List.of("High P/E ratio valuation risk", "High debt-to-equity ratio",
            "Strong fundamental indicators"), r.factors());
    }

    // ── Execution ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        void missingPlanScoresSixTenths() {
            RiskComponentResult r = ExecutionRiskAssessor.score(" ");
            assertEquals(0.6, r.score(), EPS);
            assertEquals(List.of("No trading plan available"), r.factors());
        }

        @Test
        void leveragedAllIn() {
            assertEquals(0.75, ExecutionRiskAssessor.score("Buy calls with options on margin, all in").score(), EPS);
        }

        @Test
        void stopLossLowersRisk() {
            assertEquals(0.1, ExecutionRiskAssessor.score("Buy with a stop loss at 95").score(), EPS);
        }
    }

    // ── Sector ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Sector")
    class SectorTests {

        @Test
        void energyIsCorrelated() {
            RiskComponentResult r = SectorRiskAssessor.score("XOM");
            assertEquals(0.55, r.score(), EPS);
            assertEquals(List.of("Energy sector commodity price risk", "High sector correlation risk"), r.factors());
        }

        @Test
        void defensiveIsCalmer() {
            assertEquals(0.27, SectorRiskAssessor.score("KO").score(), EPS);
        }

        @Test
        void unknownTickerIsGeneral() {
            RiskComponentResult r = SectorRiskAssessor.score("ZZZZ");
            assertEquals(0.3, r.score(), EPS);
            assertEquals(List.of("General market sector risk"), r.factors());
        }

        @Test
        void lookupIgnoresCase() {
            assertEquals(SectorRiskAssessor.Sector.TECHNOLOGY, SectorRiskAssessor.sectorOf("aapl"));
        }
    }

    // ── Volatility ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Volatility")
    class VolatilityTests {

        @Test
        void highClusteredAfterHours() {
            RiskComponentResult r = VolatilityRiskAssessor.score(snapshot(null, 0.35, true, null, null, null), false);
            assertEquals(0.75, r.score(), EPS);
        }

        @Test
        void calmDuringMarketHours() {
            RiskComponentResult r = VolatilityRiskAssessor.score(snapshot(null, 0.05, false, null, null, null), true);
            assertEquals(0.2, r.score(), EPS);
            assertEquals(List.of("Low recent volatility"), r.factors());
        }

        @Test
        void marketHoursFollowTheClock() {
            VolatilityRiskAssessor open = new VolatilityRiskAssessor(
                Clock.fixed(Instant.parse("2024-05-10T15:00:00Z"), ZoneOffset.UTC));
            VolatilityRiskAssessor closed = new VolatilityRiskAssessor(
                Clock.fixed(Instant.parse("2024-05-10T03:00:00Z"), ZoneOffset.UTC));
            assertTrue(open.isMarketHours());
            assertFalse(closed.isMarketHours());
        }
    }
}
