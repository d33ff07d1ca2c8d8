package com.tradingagents.common.decision;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.risk.RiskLevel;
import com.tradingagents.common.sizing.PortfolioSnapshot;
import com.tradingagents.common.state.StatePropagator;
import com.tradingagents.common.state.TraderPlanPatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionSynthesizerTest {

    private final DecisionSynthesizer synthesizer = new DecisionSynthesizer(100_000, PortfolioSnapshot.empty());

    private static AgentState withPlan(String plan) {
        AgentState state = StatePropagator.createInitialState("AAPL", LocalDate.of(2024, 3, 1));
        return StatePropagator.updateState(state, new TraderPlanPatch(plan));
    }

    private static RiskAssessment risk(RiskLevel level, double score, double confidence) {
        return new RiskAssessment(level, score, confidence, Map.of(), List.of(), false, null, Instant.now());
    }

    // ── Gates ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("hold gates")
    class GateTests {

        @Test
        @DisplayName("HIGH risk forces HOLD even when the trader is bullish")
        void highRiskForcesHold() {
            TradeDecision d = synthesizer.decide(withPlan("Strong buy, go long on the breakout"),
                risk(RiskLevel.HIGH, 0.75, 0.8));
            assertEquals(DecisionAction.HOLD, d.action());
            assertEquals(TraderSentiment.BULLISH, d.sentiment());
            assertTrue(d.asDecisionString().startsWith("HOLD - High risk detected"));
        }

        @Test
        @DisplayName("score above 0.8 forces HOLD regardless of level label")
        void scoreAboveCeilingForcesHold() {
            TradeDecision d = synthesizer.decide(withPlan("buy"), risk(RiskLevel.MEDIUM, 0.85, 0.8));
            assertEquals(DecisionAction.HOLD, d.action());
        }

        @Test
        @DisplayName("confidence 0.2 forces HOLD with LOW risk and bullish sentiment")
        void lowConfidenceForcesHold() {
            TradeDecision d = synthesizer.decide(withPlan("Bullish setup, buy"), risk(RiskLevel.LOW, 0.2, 0.2));
            assertEquals(DecisionAction.HOLD, d.action());
            assertEquals("Insufficient confidence in analysis, requiring additional data", d.justification());
        }
    }

    // ── Table ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("decision table")
    class TableTests {

        @Test
        @DisplayName("BULLISH + LOW → BUY")
        void bullishLow() {
            assertEquals(DecisionAction.BUY,
                synthesizer.decide(withPlan("Go long"), risk(RiskLevel.LOW, 0.2, 0.8)).action());
        }

        @Test
        @DisplayName("BULLISH + MEDIUM → BUY_SMALL")
        void bullishMedium() {
            assertEquals(DecisionAction.BUY_SMALL,
                synthesizer.decide(withPlan("Buy a starter position"), risk(RiskLevel.MEDIUM, 0.5, 0.8)).action());
        }

        @Test
        @DisplayName("BEARISH + LOW → SELL")
        void bearishLow() {
            assertEquals(DecisionAction.SELL,
                synthesizer.decide(withPlan("Bearish, sell"), risk(RiskLevel.LOW, 0.25, 0.8)).action());
        }

        @Test
        @DisplayName("BEARISH + MEDIUM → SELL_SMALL")
        void bearishMedium() {
            assertEquals(DecisionAction.SELL_SMALL,
                synthesizer.decide(withPlan("Short the rally"), risk(RiskLevel.MEDIUM, 0.5, 0.8)).action());
        }

        @Test
        @DisplayName("inflected plan verbs still reach BUY and SELL")
        void inflectedPlans() {
            RiskAssessment low = risk(RiskLevel.LOW, 0.2, 0.8);
            assertEquals(DecisionAction.BUY, synthesizer.decide(withPlan("We recommend buying NVDA now"), low).action());
            assertEquals(DecisionAction.SELL, synthesizer.decide(withPlan("Start selling the position"), low).action());
            assertEquals(DecisionAction.SELL, synthesizer.decide(withPlan("Shorting is advised"), low).action());
        }

        @Test
        @DisplayName("NEUTRAL → HOLD with non-empty justification")
        void neutralHolds() {
            TradeDecision d = synthesizer.decide(withPlan("Wait for the earnings call"), risk(RiskLevel.LOW, 0.2, 0.8));
            assertEquals(DecisionAction.HOLD, d.action());
            assertFalse(d.justification().isBlank());
        }
    }

    @Test
    @DisplayName("missing risk assessment → HOLD - decision system error")
    void failureFallsBackToHold() {
        TradeDecision d = synthesizer.decide(withPlan("buy"), null);
        assertEquals("HOLD - decision system error", d.asDecisionString());
        assertEquals(0.05, d.sizing().recommendedSize(), 1e-9);
    }

    @Test
    @DisplayName("configured holdings replace the empty-book diversification warnings")
    void portfolioSnapshotIsUsed() {
        RiskAssessment low = risk(RiskLevel.LOW, 0.2, 0.8);
        TradeDecision emptyBook = synthesizer.decide(withPlan("buy"), low);
        TradeDecision diversified = new DecisionSynthesizer(100_000, new PortfolioSnapshot(0.1, 0.0, 8, 4))
            .decide(withPlan("buy"), low);

        assertTrue(emptyBook.constraintCheck().warnings().stream().anyMatch(w -> w.contains("only 0 positions")));
        assertTrue(diversified.constraintCheck().warnings().stream().noneMatch(w -> w.contains("diversification")));
    }

    @Test
    @DisplayName("sizing is always within bounds")
    void sizingWithinBounds() {
        TradeDecision d = synthesizer.decide(withPlan("Buy with 65% win rate and 2:1 reward"),
            risk(RiskLevel.LOW, 0.15, 0.85));
        assertTrue(d.sizing().recommendedSize() >= 0.01);
        assertTrue(d.sizing().recommendedSize() <= 0.25);
    }
}
