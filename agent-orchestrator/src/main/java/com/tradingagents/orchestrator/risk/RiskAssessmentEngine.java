package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.common.exception.RiskComponentFailureException;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskAggregator;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.risk.RiskComponentResult;
import com.tradingagents.common.risk.RiskDimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every {@link RiskComponentAssessor} concurrently and aggregates the results.
 *
 * <p>Failure handling, innermost first:
 * <ol>
 *   <li>indicator fetch fails: assessors receive an empty snapshot and report "no data"</li>
 *   <li>one assessor fails or stays empty: its dimension gets the degenerate neutral result</li>
 *   <li>aggregation fails (including all seven degraded): the HIGH fail-safe assessment</li>
 * </ol>
 * The returned {@code Mono} never errors.
 */
@Service
public class RiskAssessmentEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentEngine.class);

    private final List<RiskComponentAssessor> assessors;
    private final IndicatorSource indicatorSource;

    public RiskAssessmentEngine(List<RiskComponentAssessor> assessors, IndicatorSource indicatorSource) {
        this.assessors       = List.copyOf(assessors);
        this.indicatorSource = indicatorSource;
    }

    public Mono<RiskAssessment> assess(AgentState state) {
        return fetchIndicators(state)
            .flatMap(indicators -> Flux.fromIterable(assessors)
                .flatMap(assessor -> assessSafely(assessor, state, indicators))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue,
                    () -> new EnumMap<RiskDimension, RiskComponentResult>(RiskDimension.class)))
            .map(RiskAggregator::aggregate)
            .doOnNext(risk -> log.info("[RiskEngine] Assessment complete. ticker={} risk={} score={} confidence={}",
                state.ticker(), risk.overallRisk(), risk.overallScore(), risk.confidence()))
            .onErrorResume(e -> {
                log.error("[RiskEngine] Aggregate risk failure, using fail-safe. ticker={} reason={}",
                    state.ticker(), e.getMessage());
                return Mono.just(RiskAssessment.failSafe(e.getMessage()));
            });
    }

    private Mono<IndicatorSnapshot> fetchIndicators(AgentState state) {
        return Mono.defer(() -> indicatorSource.snapshot(state.ticker(), state.tradeDate()))
            .defaultIfEmpty(IndicatorSnapshot.empty())
            .onErrorResume(e -> {
                log.warn("[RiskEngine] Indicators unavailable, scoring without them. ticker={} reason={}",
                    state.ticker(), e.getMessage());
                return Mono.just(IndicatorSnapshot.empty());
            });
    }

    private Mono<Map.Entry<RiskDimension, RiskComponentResult>> assessSafely(
            RiskComponentAssessor assessor, AgentState state, IndicatorSnapshot indicators) {
        RiskDimension dimension = assessor.dimension();
        return Mono.defer(() -> assessor.assess(state, indicators))
            .switchIfEmpty(Mono.error(() -> new RiskComponentFailureException(dimension.label(), "no result")))
            .onErrorResume(e -> {
                RiskComponentFailureException failure = e instanceof RiskComponentFailureException rcf
                    ? rcf : new RiskComponentFailureException(dimension.label(), String.valueOf(e.getMessage()), e);
                log.warn("[RiskEngine] Component failed, using neutral result. {}", failure.getMessage());
                return Mono.just(RiskComponentResult.failed(dimension));
            })
            .map(result -> Map.entry(dimension, result));
    }
}
