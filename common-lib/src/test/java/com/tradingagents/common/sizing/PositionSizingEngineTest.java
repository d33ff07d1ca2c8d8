package com.tradingagents.common.sizing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the Kelly estimate, the shrink-only chain and the recommended-size bounds.
 */
class PositionSizingEngineTest {

    // ── Kelly ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("kellyFraction()")
    class KellyTests {

        @Test
        @DisplayName("p=0.55 b=2 → 0.325 clamped to 0.20")
        void clampedToMax() {
            assertEquals(0.20, PositionSizingEngine.kellyFraction(0.55, 2.0), 1e-9);
        }

        @Test
        @DisplayName("p=0.5 b=1.5 → (0.75 − 0.5)/1.5")
        void unclamped() {
            assertEquals(0.25 / 1.5, PositionSizingEngine.kellyFraction(0.5, 1.5), 1e-9);
        }

        @Test
        @DisplayName("negative edge → 0")
        void negativeEdge() {
            assertEquals(0.0, PositionSizingEngine.kellyFraction(0.3, 1.0), 1e-9);
            assertEquals(0.0, PositionSizingEngine.kellyFraction(0.6, 0.0), 1e-9);
        }
    }

    // ── compute() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("compute()")
    class ComputeTests {

        @Test
        @DisplayName("defaults with risk 0.5 → 0.20 → 0.10 → 0.06, recommended 0.06")
        void defaultsChain() {
            PositionSizing s = PositionSizingEngine.compute(SizingInputs.defaults(0.5));
            assertEquals(0.20, s.kellySize(), 1e-9);
            assertEquals(0.10, s.riskAdjustedSize(), 1e-9);
            assertEquals(0.06, s.volatilityAdjustedSize(), 1e-9);
            assertEquals(0.06, s.portfolioConstrainedSize(), 1e-9);
            assertEquals(0.06, s.recommendedSize(), 1e-9);
        }

        @Test
        @DisplayName("half-Kelly caps the recommendation when shrink stages are mild")
        void halfKellyCap() {
            PositionSizing s = PositionSizingEngine.compute(
                new SizingInputs(0.55, 2.0, 0.0, 0.0, 100_000, 0.5));
            assertEquals(0.20, s.volatilityAdjustedSize(), 1e-9);
            assertEquals(0.10, s.recommendedSize(), 1e-9);
        }

        @Test
        @DisplayName("no edge still yields the 1% floor")
        void noEdgeFloor() {
            PositionSizing s = PositionSizingEngine.compute(
                new SizingInputs(0.2, 1.0, 0.9, 1.0, 100_000, 0.5));
            assertEquals(0.0, s.kellyFraction(), 1e-9);
            assertEquals(PositionSizingEngine.MIN_POSITION, s.recommendedSize(), 1e-9);
        }

        @Test
        @DisplayName("invariants hold across the parameter space")
        void invariants() {
            double[] winRates = {0.0, 0.3, 0.5, 0.55, 0.7, 1.0};
            double[] ratios = {0.5, 1.0, 2.0, 5.0};
            double[] vols = {-0.1, 0.0, 0.2, 0.45, 1.0};
            double[] risks = {0.0, 0.3, 0.7, 1.0};
            for (double p : winRates) for (double b : ratios) for (double v : vols) for (double r : risks) {
                PositionSizing s = PositionSizingEngine.compute(new SizingInputs(p, b, v, r, 100_000, 0.5));
                String ctx = "p=" + p + " b=" + b + " v=" + v + " r=" + r;
                assertTrue(s.recommendedSize() >= 0.01 && s.recommendedSize() <= 0.25, ctx);
                double minStage = Math.min(Math.min(s.kellySize(), s.riskAdjustedSize()),
                    Math.min(s.volatilityAdjustedSize(), s.portfolioConstrainedSize()));
                assertTrue(s.recommendedSize() <= minStage + 1e-12, ctx);
                assertTrue(s.riskAdjustedSize() <= s.kellySize() + 1e-12, ctx);
                assertTrue(s.volatilityAdjustedSize() <= s.riskAdjustedSize() + 1e-12, ctx);
                assertTrue(s.portfolioConstrainedSize() <= s.volatilityAdjustedSize() + 1e-12, ctx);
            }
        }

        @Test
        @DisplayName("fold caps a growing stage at its input")
        void foldIsShrinkOnly() {
            SizingStage doubling = (size, in) -> size * 2;
            double[] out = PositionSizingEngine.fold(0.1, SizingInputs.defaults(0.5), List.of(doubling, doubling));
            assertEquals(0.1, out[0], 1e-9);
            assertEquals(0.1, out[1], 1e-9);
        }
    }

    // ── PositionParameterExtractor ──────────────────────────────────────────

    @Nested
    @DisplayName("PositionParameterExtractor.extract()")
    class ExtractorTests {

        @Test
        @DisplayName("reads win rate, ratio, volatility, portfolio and tolerance from the plan")
        void readsParameters() {
            SizingInputs in = PositionParameterExtractor.extract(
                "Conservative entry: 60% win rate, 3:1 risk reward, 25% volatility on a $250,000 portfolio",
                0.4, 100_000);
            assertEquals(0.60, in.winRate(), 1e-9);
            assertEquals(3.0, in.winLossRatio(), 1e-9);
            assertEquals(0.25, in.volatility(), 1e-9);
            assertEquals(250_000, in.portfolioSize(), 1e-9);
            assertEquals(0.3, in.riskTolerance(), 1e-9);
            assertEquals(0.4, in.riskScore(), 1e-9);
        }

        @Test
        @DisplayName("blank plan → defaults")
        void blankPlan() {
            SizingInputs in = PositionParameterExtractor.extract("", 0.5, 50_000);
            assertEquals(SizingInputs.DEFAULT_WIN_RATE, in.winRate(), 1e-9);
            assertEquals(SizingInputs.DEFAULT_WIN_LOSS_RATIO, in.winLossRatio(), 1e-9);
            assertEquals(50_000, in.portfolioSize(), 1e-9);
        }
    }

    // ── PortfolioConstraints ────────────────────────────────────────────────

    @Test
    @DisplayName("sector and drawdown limits produce violations; thin portfolios produce warnings")
    void portfolioConstraints() {
        PortfolioConstraints.Check over = PortfolioConstraints.check(0.10, 0.35, 0.25, 10, 5);
        assertFalse(over.approved());
        assertEquals(2, over.violations().size());

        PortfolioConstraints.Check thin = PortfolioSnapshot.empty().check(0.05);
        assertTrue(thin.approved());
        assertEquals(2, thin.warnings().size());
    }
}
