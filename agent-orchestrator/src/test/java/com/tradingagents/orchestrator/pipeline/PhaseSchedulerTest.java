package com.tradingagents.orchestrator.pipeline;

import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.debate.DebateRouter;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.DebateKind;
import com.tradingagents.common.model.InvestStance;
import com.tradingagents.common.model.RiskStance;
import com.tradingagents.common.state.FundamentalsReportPatch;
import com.tradingagents.common.state.InvestDebatePatch;
import com.tradingagents.common.state.InvestmentJudgePatch;
import com.tradingagents.common.state.MarketReportPatch;
import com.tradingagents.common.state.NewsReportPatch;
import com.tradingagents.common.state.RiskDebatePatch;
import com.tradingagents.common.state.SentimentReportPatch;
import com.tradingagents.common.state.StatePropagator;
import com.tradingagents.common.state.TraderPlanPatch;
import com.tradingagents.orchestrator.logger.WorkflowFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies {@link PhaseScheduler}: settle-don't-fail fan-out, declaration-order merge,
 * barrier ordering across phases and the bounded debate loop.
 */
class PhaseSchedulerTest {

    private final PhaseScheduler scheduler = new PhaseScheduler(new StageExecutor(), new WorkflowFlowLogger());

    private static AgentState initial() {
        return StatePropagator.createInitialState("NVDA", LocalDate.of(2024, 5, 10));
    }

    private static List<Stage<?>> analysts(Stage<?> news) {
        return List.of(
            FakeStage.of("Market Analyst", s -> Mono.just(new MarketReportPatch("uptrend", List.of("market msg")))),
            FakeStage.of("Social Analyst", s -> Mono.just(new SentimentReportPatch("upbeat", List.of("social msg")))),
            news,
            FakeStage.of("Fundamentals Analyst", s -> Mono.just(new FundamentalsReportPatch("solid", List.of()))));
    }

    // ── Parallel phase ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("Parallel phase")
    class ParallelTests {

        @Test
        @DisplayName("failing news analyst is excluded; the phase still completes")
        void failedStageExcluded() {
            ParallelPhase phase = new ParallelPhase("analysts",
                analysts(FakeStage.throwing("News Analyst", new IllegalStateException("feed down"))), false);

            AgentState result = scheduler.run(initial(), List.of(phase)).block();

            assertNotNull(result);
            assertEquals("uptrend", result.marketReport());
            assertEquals("upbeat", result.sentimentReport());
            assertEquals("solid", result.fundamentalsReport());
            assertEquals("", result.newsReport());
            assertEquals(List.of("Market Analyst", "Social Analyst", "Fundamentals Analyst"), result.agentsExecuted());
        }

        @Test
        @DisplayName("a phase where every stage fails still completes with empty reports")
        void allStagesFail() {
            ParallelPhase phase = new ParallelPhase("analysts", List.of(
                FakeStage.throwing("Market Analyst", new RuntimeException("x")),
                FakeStage.of("News Analyst", s -> Mono.<NewsReportPatch>error(new RuntimeException("y")))), false);

            AgentState result = scheduler.run(initial(), List.of(phase)).block();

            assertNotNull(result);
            assertTrue(result.agentsExecuted().isEmpty());
            assertEquals("", result.marketReport());
        }

        @Test
        @DisplayName("patches merge in declaration order regardless of completion order")
        void declarationOrderMerge() {
            ParallelPhase phase = new ParallelPhase("analysts", List.of(
                FakeStage.of("Slow", s -> Mono.delay(Duration.ofMillis(80))
                    .thenReturn(new MarketReportPatch("slow", List.of("slow msg")))),
                FakeStage.of("Fast", s -> Mono.just(new NewsReportPatch("fast", List.of("fast msg"))))), false);

            AgentState result = scheduler.run(initial(), List.of(phase)).block();

            assertNotNull(result);
            assertEquals(List.of("Slow", "Fast"), result.agentsExecuted());
            assertEquals(List.of("NVDA", "slow msg", "fast msg"), result.messages());
        }

        @Test
        @DisplayName("stages of one phase run concurrently")
        void stagesOverlap() {
            ParallelPhase phase = new ParallelPhase("analysts", List.of(
                FakeStage.of("Market Analyst", s -> Mono.delay(Duration.ofMillis(400))
                    .thenReturn(new MarketReportPatch("m", List.of()))),
                FakeStage.of("News Analyst", s -> Mono.delay(Duration.ofMillis(400))
                    .thenReturn(new NewsReportPatch("n", List.of())))), false);

            long start = System.nanoTime();
            AgentState result = scheduler.run(initial(), List.of(phase)).block();
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertNotNull(result);
            assertEquals(List.of("Market Analyst", "News Analyst"), result.agentsExecuted());
            assertTrue(elapsedMs < 800, "two 400ms stages took " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("all stages of a phase see the same input snapshot")
        void sameSnapshot() {
            FakeStage<MarketReportPatch> market = FakeStage.of("Market Analyst",
                s -> Mono.just(new MarketReportPatch("m", List.of())));
            FakeStage<NewsReportPatch> news = FakeStage.of("News Analyst",
                s -> Mono.just(new NewsReportPatch("n", List.of())));
            AgentState start = initial();

            scheduler.run(start, List.of(new ParallelPhase("analysts", List.of(market, news), false))).block();

            assertSame(start, market.seen().get(0));
            assertSame(start, news.seen().get(0));
        }

        @Test
        @DisplayName("reset marker clears the transcript after the phase")
        void messagesReset() {
            ParallelPhase phase = new ParallelPhase("analysts",
                analysts(FakeStage.of("News Analyst", s -> Mono.just(new NewsReportPatch("n", List.of("news msg"))))),
                true);

            AgentState result = scheduler.run(initial(), List.of(phase)).block();

            assertNotNull(result);
            assertTrue(result.messages().isEmpty());
            assertEquals("n", result.newsReport());
        }
    }

    // ── Barrier ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("next phase starts only after the previous one merged")
    void barrierBetweenPhases() {
        ParallelPhase analysts = new ParallelPhase("analysts", List.of(
            FakeStage.of("Market Analyst", s -> Mono.delay(Duration.ofMillis(50))
                .thenReturn(new MarketReportPatch("breakout", List.of())))), false);
        FakeStage<TraderPlanPatch> trader = FakeStage.of("Trader",
            s -> Mono.just(new TraderPlanPatch("plan based on " + s.marketReport())));

        AgentState result = scheduler.run(initial(), List.of(analysts, ParallelPhase.single("trader", trader))).block();

        assertNotNull(result);
        assertEquals("plan based on breakout", result.traderPlan());
        assertEquals(List.of("Market Analyst", "Trader"), result.agentsExecuted());
    }

    // ── Debate loop ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Debate loop")
    class DebateTests {

        private FakeStage<InvestDebatePatch> bull() {
            return FakeStage.of("Bull Researcher",
                s -> Mono.just(new InvestDebatePatch(InvestStance.BULL, "buy the breakout")));
        }

        private FakeStage<InvestDebatePatch> bear() {
            return FakeStage.of("Bear Researcher",
                s -> Mono.just(new InvestDebatePatch(InvestStance.BEAR, "valuation stretched")));
        }

        private DebateLoop investment(Stage<?> bull, Stage<?> bear, Stage<?> judge, int rounds) {
            return new DebateLoop("investment_debate", DebateKind.INVESTMENT, List.of(bull, bear), judge,
                new DebateRouter(DebateKind.INVESTMENT, rounds), WorkflowPhases::investmentFallback);
        }

        @Test
        @DisplayName("runs exactly maxRounds rounds, then the judge")
        void boundedRounds() {
            FakeStage<InvestDebatePatch> bull = bull();
            FakeStage<InvestmentJudgePatch> judge = FakeStage.of("Research Manager",
                s -> Mono.just(new InvestmentJudgePatch("BUY - bull case stronger")));

            AgentState result = scheduler.run(initial(), List.of(investment(bull, bear(), judge, 2))).block();

            assertNotNull(result);
            assertEquals(2, bull.calls());
            assertEquals(2, result.investDebate().round());
            assertEquals(4, result.investDebate().history().size());
            assertEquals("Bull Analyst: buy the breakout", result.investDebate().history().get(0));
            assertEquals("BUY - bull case stronger", result.investDebate().judgeDecision());
            assertEquals("BUY - bull case stronger", result.investmentPlan());
            assertEquals(List.of("Bull Researcher", "Bear Researcher", "Bull Researcher", "Bear Researcher",
                "Research Manager"), result.agentsExecuted());
        }

        @Test
        @DisplayName("bear sees the bull's argument from the same round")
        void speakersAreSequential() {
            FakeStage<InvestDebatePatch> bear = bear();
            FakeStage<InvestmentJudgePatch> judge = FakeStage.of("Research Manager",
                s -> Mono.just(new InvestmentJudgePatch("HOLD")));

            scheduler.run(initial(), List.of(investment(bull(), bear, judge, 1))).block();

            assertEquals("Bull Analyst: buy the breakout", bear.seen().get(0).investDebate().currentResponse());
        }

        @Test
        @DisplayName("failed judge falls back to a verdict derived from history")
        void judgeFailureFallsBack() {
            FakeStage<InvestDebatePatch> failingBear = FakeStage.of("Bear Researcher",
                s -> Mono.error(new RuntimeException("llm down")));

            AgentState result = scheduler.run(initial(), List.of(investment(bull(), failingBear,
                FakeStage.throwing("Research Manager", new RuntimeException("judge down")), 1))).block();

            assertNotNull(result);
            assertEquals("BUY - Verdict derived from 1 debate arguments", result.investmentPlan());
            assertEquals(1, result.investDebate().round());
            assertEquals(List.of("Bull Researcher"), result.agentsExecuted());
        }

        @Test
        @DisplayName("blank verdict with no arguments defaults to HOLD")
        void blankVerdictNoHistory() {
            AgentState result = scheduler.run(initial(), List.of(investment(
                FakeStage.throwing("Bull Researcher", new RuntimeException("x")),
                FakeStage.throwing("Bear Researcher", new RuntimeException("y")),
                FakeStage.of("Research Manager", s -> Mono.just(new InvestmentJudgePatch("  "))), 1))).block();

            assertNotNull(result);
            assertEquals("HOLD - No debate arguments recorded, defaulting to conservative stance",
                result.investDebate().judgeDecision());
        }

        @Test
        @DisplayName("risk discussion without a judge still ends in a conservative HOLD")
        void riskJudgeFailure() {
            DebateLoop risk = new DebateLoop("risk_discussion", DebateKind.RISK, List.of(
                    FakeStage.of("Risky Analyst", s -> Mono.just(new RiskDebatePatch(RiskStance.RISKY, "go big"))),
                    FakeStage.of("Safe Analyst", s -> Mono.just(new RiskDebatePatch(RiskStance.SAFE, "trim size"))),
                    FakeStage.of("Neutral Analyst", s -> Mono.just(new RiskDebatePatch(RiskStance.NEUTRAL, "balance")))),
                FakeStage.throwing("Risk Judge", new RuntimeException("engine down")),
                new DebateRouter(DebateKind.RISK, 1), WorkflowPhases::riskFallback);

            AgentState result = scheduler.run(initial(), List.of(risk)).block();

            assertNotNull(result);
            assertEquals("HOLD - decision system error", result.finalDecision());
            assertEquals(3, result.riskDebate().history().size());
            assertEquals("Neutral Analyst", result.riskDebate().latestSpeaker());
            assertNotNull(result.riskMetrics());
            assertEquals(0.05, result.positionSizing().recommendedSize(), 1e-9);
        }
    }
}
