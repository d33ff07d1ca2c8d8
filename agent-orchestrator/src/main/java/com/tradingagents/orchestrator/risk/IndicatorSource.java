package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/** Quantitative inputs for the risk components, fetched once per assessment. */
@FunctionalInterface
public interface IndicatorSource {

    Mono<IndicatorSnapshot> snapshot(String ticker, LocalDate tradeDate);
}
