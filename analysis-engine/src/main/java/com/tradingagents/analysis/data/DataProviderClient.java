package com.tradingagents.analysis.data;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Market, news, social and fundamentals data for stage bodies and risk assessors.
 * Failures surface as errors on the returned {@code Mono}; callers decide how to degrade.
 */
public interface DataProviderClient {

    /** Human-readable feed text for an analyst prompt. */
    Mono<String> fetch(DataRequest request);

    /** Closing prices, newest-first. */
    Mono<List<Double>> closingPrices(String ticker, LocalDate tradeDate, int lookbackDays);

    /** Price-derived indicators plus whatever fundamentals metrics the provider has. */
    Mono<IndicatorSnapshot> indicators(String ticker, LocalDate tradeDate);
}
