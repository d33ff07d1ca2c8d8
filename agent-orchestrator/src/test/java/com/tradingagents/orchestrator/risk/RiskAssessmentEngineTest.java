package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.risk.RiskComponentResult;
import com.tradingagents.common.risk.RiskDimension;
import com.tradingagents.common.risk.RiskLevel;
import com.tradingagents.common.state.MarketReportPatch;
import com.tradingagents.common.state.NewsReportPatch;
import com.tradingagents.common.state.StatePropagator;
import com.tradingagents.common.state.TraderPlanPatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies {@link RiskAssessmentEngine}: per-component failure isolation, the all-failed
 * fail-safe, and output bounds.
 */
class RiskAssessmentEngineTest {

    private static final IndicatorSource NO_INDICATORS = (ticker, date) -> Mono.just(IndicatorSnapshot.empty());

    /** Assessor whose result Mono always errors. */
    private record FailingAssessor(RiskDimension dimension) implements RiskComponentAssessor {
        @Override
        public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
            return Mono.error(new IllegalStateException(dimension.label() + " feed down"));
        }
    }

    private static List<RiskComponentAssessor> realAssessors() {
        return new ArrayList<>(List.of(
            new MarketRiskAssessor(), new SentimentRiskAssessor(), new NewsRiskAssessor(),
            new FundamentalRiskAssessor(), new ExecutionRiskAssessor(), new SectorRiskAssessor(),
            new VolatilityRiskAssessor(Clock.fixed(Instant.parse("2024-05-10T15:00:00Z"), ZoneOffset.UTC))));
    }

    private static AgentState populated() {
        return StatePropagator.mergeAll(StatePropagator.createInitialState("XOM", LocalDate.of(2024, 5, 10)), List.of(
            new MarketReportPatch("Oil rally continues", List.of()),
            new NewsReportPatch("Quarterly earnings beat guidance", List.of()),
            new TraderPlanPatch("BUY with a stop loss")));
    }

    @Test
    void weightsSumToOne() {
        double sum = Arrays.stream(RiskDimension.values()).mapToDouble(RiskDimension::weight).sum();
        assertEquals(1.0, sum, 1e-12);
    }

    @Test
    @DisplayName("all seven components failing yields the HIGH fail-safe")
    void allComponentsFail() {
        List<RiskComponentAssessor> failing = Arrays.stream(RiskDimension.values())
            .<RiskComponentAssessor>map(FailingAssessor::new).toList();

        RiskAssessment risk = new RiskAssessmentEngine(failing, NO_INDICATORS).assess(populated()).block();

        assertNotNull(risk);
        assertEquals(RiskLevel.HIGH, risk.overallRisk());
        assertEquals(0.9, risk.overallScore(), 1e-9);
        assertEquals(0.1, risk.confidence(), 1e-9);
        assertTrue(risk.failSafe());
        assertFalse(risk.recommendations().isEmpty());
    }

    @Test
    @DisplayName("one failing component is replaced by its neutral result")
    void singleComponentFailure() {
        List<RiskComponentAssessor> assessors = realAssessors();
        assessors.set(2, new FailingAssessor(RiskDimension.NEWS));

        RiskAssessment risk = new RiskAssessmentEngine(assessors, NO_INDICATORS).assess(populated()).block();

        assertNotNull(risk);
        assertFalse(risk.failSafe());
        RiskComponentResult news = risk.components().get(RiskDimension.NEWS);
        assertTrue(news.degraded());
        assertEquals(0.5, news.score(), 1e-9);
        assertEquals(List.of("News risk assessment failed"), news.factors());
        assertEquals(7, risk.components().size());
    }

    @Test
    @DisplayName("unavailable indicators degrade to no-data factors, not failure")
    void indicatorSourceFails() {
        IndicatorSource broken = (ticker, date) -> Mono.error(new IllegalStateException("provider down"));

        RiskAssessment risk = new RiskAssessmentEngine(realAssessors(), broken).assess(populated()).block();

        assertNotNull(risk);
        assertFalse(risk.failSafe());
        assertTrue(risk.components().get(RiskDimension.MARKET).factors().contains("No RSI data available"));
    }

    @Test
    @DisplayName("score and confidence stay within bounds")
    void bounds() {
        RiskAssessment risk = new RiskAssessmentEngine(realAssessors(), NO_INDICATORS).assess(populated()).block();

        assertNotNull(risk);
        assertTrue(risk.overallScore() >= 0.0 && risk.overallScore() <= 1.0);
        assertTrue(risk.confidence() >= 0.2 && risk.confidence() <= 0.9);
        assertFalse(risk.recommendations().isEmpty());
        assertNotNull(risk.assessedAt());
    }

    @Test
    @DisplayName("an empty component result counts as a failure")
    void emptyComponentIsDegraded() {
        List<RiskComponentAssessor> assessors = realAssessors();
        assessors.set(0, new RiskComponentAssessor() {
            @Override
            public RiskDimension dimension() { return RiskDimension.MARKET; }

            @Override
            public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
                return Mono.empty();
            }
        });

        RiskAssessment risk = new RiskAssessmentEngine(assessors, NO_INDICATORS).assess(populated()).block();

        assertNotNull(risk);
        assertTrue(risk.components().get(RiskDimension.MARKET).degraded());
    }
}
