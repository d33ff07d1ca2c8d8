package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.analysis.data.DataRequest;
import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.llm.ModelTier;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.InvestStance;
import com.tradingagents.common.model.RiskStance;
import com.tradingagents.common.state.InvestDebatePatch;
import com.tradingagents.common.state.RiskDebatePatch;
import com.tradingagents.common.state.StatePropagator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the LLM-backed stage bodies against recording fakes of the LLM and data clients.
 */
class StageBodiesTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 10);

    /** Records every prompt and answers with a fixed reply. */
    private static final class RecordingLlm implements LlmClient {
        final List<String> userPrompts = new ArrayList<>();
        final List<ModelTier> tiers = new ArrayList<>();
        private final String reply;

        RecordingLlm(String reply) { this.reply = reply; }

        @Override
        public Mono<String> invoke(String systemPrompt, String userPrompt, ModelTier tier) {
            userPrompts.add(userPrompt);
            tiers.add(tier);
            return Mono.just(reply);
        }
    }

    private static final class FakeData implements DataProviderClient {
        final List<DataRequest> requests = new ArrayList<>();
        private final boolean failing;

        FakeData(boolean failing) { this.failing = failing; }

        @Override
        public Mono<String> fetch(DataRequest request) {
            requests.add(request);
            return failing ? Mono.error(new IllegalStateException("provider down"))
                           : Mono.just(request.kind().path() + " feed for " + request.ticker());
        }

        @Override
        public Mono<List<Double>> closingPrices(String ticker, LocalDate tradeDate, int lookbackDays) {
            List<Double> closes = new ArrayList<>();
            for (int i = 0; i < 60; i++) closes.add(100.0 + i);
            Collections.reverse(closes);
            return Mono.just(closes);
        }

        @Override
        public Mono<IndicatorSnapshot> indicators(String ticker, LocalDate tradeDate) {
            return Mono.just(IndicatorSnapshot.empty());
        }
    }

    private static AgentState initial() {
        return StatePropagator.createInitialState("NVDA", DATE);
    }

    // ── Analysts ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Analysts")
    class AnalystTests {

        @Test
        @DisplayName("market analyst adds indicator readings to the prompt and returns its report")
        void marketAnalystReport() {
            RecordingLlm llm = new RecordingLlm("Strong uptrend.");
            MarketAnalyst analyst = new MarketAnalyst(llm, new FakeData(false));

            StepVerifier.create(analyst.process(initial()))
                .assertNext(patch -> {
                    assertEquals("Strong uptrend.", patch.report());
                    assertEquals(2, patch.messages().size());
                })
                .verifyComplete();

            assertEquals(ModelTier.QUICK, llm.tiers.get(0));
            assertTrue(llm.userPrompts.get(0).contains("Indicators:"));
            assertTrue(llm.userPrompts.get(0).contains("UPTREND"));
        }

        @Test
        void analystNameMatchesStage() {
            assertEquals("Market Analyst", new MarketAnalyst(new RecordingLlm(""), new FakeData(false)).name());
            assertEquals("News Analyst", new NewsAnalyst(new RecordingLlm(""), new FakeData(false)).name());
        }

        @Test
        @DisplayName("data failure surfaces as an error, LLM is never called")
        void dataFailurePropagates() {
            RecordingLlm llm = new RecordingLlm("unused");
            NewsAnalyst analyst = new NewsAnalyst(llm, new FakeData(true));

            StepVerifier.create(analyst.process(initial()))
                .expectErrorMessage("provider down")
                .verify();
            assertTrue(llm.userPrompts.isEmpty());
        }

        @Test
        @DisplayName("market analyst still reports from the feed when closing prices fail")
        void marketAnalystWithoutPrices() {
            RecordingLlm llm = new RecordingLlm("Range-bound.");
            DataProviderClient noPrices = new DataProviderClient() {
                @Override
                public Mono<String> fetch(DataRequest request) {
                    return Mono.just("price feed for " + request.ticker());
                }

                @Override
                public Mono<List<Double>> closingPrices(String ticker, LocalDate tradeDate, int lookbackDays) {
                    return Mono.error(new IllegalStateException("prices unavailable"));
                }

                @Override
                public Mono<IndicatorSnapshot> indicators(String ticker, LocalDate tradeDate) {
                    return Mono.just(IndicatorSnapshot.empty());
                }
            };

            StepVerifier.create(new MarketAnalyst(llm, noPrices).process(initial()))
                .assertNext(patch -> assertEquals("Range-bound.", patch.report()))
                .verifyComplete();

            assertTrue(llm.userPrompts.get(0).contains("price feed for NVDA"));
            assertTrue(llm.userPrompts.get(0).contains("Indicators: insufficient price data"));
        }

        @Test
        void indicatorSummaryWithoutPrices() {
            assertEquals("Indicators: insufficient price data", MarketAnalyst.indicatorSummary(List.of()));
        }
    }

    // ── Debaters and judges ─────────────────────────────────────────────────

    @Nested
    @DisplayName("Debaters and judges")
    class DebateTests {

        @Test
        @DisplayName("bear sees the bull's latest argument")
        void bearAnswersBull() {
            AgentState afterBull = StatePropagator.updateState(initial(),
                new InvestDebatePatch(InvestStance.BULL, "Revenue is compounding."));
            RecordingLlm llm = new RecordingLlm("Valuation is stretched.");

            StepVerifier.create(new BearResearcher(llm).process(afterBull))
                .assertNext(patch -> {
                    assertEquals(InvestStance.BEAR, patch.stance());
                    assertEquals("Valuation is stretched.", patch.argument());
                })
                .verifyComplete();
            assertTrue(llm.userPrompts.get(0).contains("Revenue is compounding."));
        }

        @Test
        void researchManagerUsesDeepModel() {
            RecordingLlm llm = new RecordingLlm("BUY - growth case wins");

            StepVerifier.create(new ResearchManager(llm).process(initial()))
                .assertNext(patch -> assertEquals("BUY - growth case wins", patch.verdict()))
                .verifyComplete();
            assertEquals(ModelTier.DEEP, llm.tiers.get(0));
        }

        @Test
        void traderProducesPlan() {
            RecordingLlm llm = new RecordingLlm("FINAL TRANSACTION PROPOSAL: **BUY**");

            StepVerifier.create(new Trader(llm).process(initial()))
                .assertNext(patch -> assertEquals("FINAL TRANSACTION PROPOSAL: **BUY**", patch.plan()))
                .verifyComplete();
            assertEquals(ModelTier.DEEP, llm.tiers.get(0));
        }

        @Test
        @DisplayName("risk debaters are named after their stance")
        void riskDebaters() {
            RecordingLlm llm = new RecordingLlm("Size it small.");
            SafeAnalyst safe = new SafeAnalyst(llm);

            assertEquals("Safe Analyst", safe.name());
            assertEquals("Risky Analyst", new RiskyAnalyst(llm).name());
            assertEquals("Neutral Analyst", new NeutralAnalyst(llm).name());

            RiskDebatePatch patch = safe.process(initial()).block();
            assertNotNull(patch);
            assertEquals(RiskStance.SAFE, patch.stance());
        }
    }
}
