package com.tradingagents.analysis.indicator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Quantitative inputs for risk scoring. Any field may be {@code null} when the provider
 * has no data; consumers treat {@code null} as "no data", never as zero.
 */
public record IndicatorSnapshot(
    @JsonProperty("rsi") Double rsi,
    @JsonProperty("volatility") Double volatility,
    @JsonProperty("volatilityClustering") Boolean volatilityClustering,
    @JsonProperty("sectorSentiment") Double sectorSentiment,
    @JsonProperty("peRatio") Double peRatio,
    @JsonProperty("debtToEquity") Double debtToEquity
) {

    public static IndicatorSnapshot empty() {
        return new IndicatorSnapshot(null, null, null, null, null, null);
    }

    /** Snapshot from closing prices alone (newest-first); fundamentals stay unknown. */
    public static IndicatorSnapshot fromCloses(List<Double> closes) {
        double rsi = TechnicalIndicators.rsi(closes, 14);
        double vol = TechnicalIndicators.annualizedVolatility(closes, 20);
        return new IndicatorSnapshot(
            Double.isNaN(rsi) ? null : rsi,
            Double.isNaN(vol) ? null : vol,
            TechnicalIndicators.volatilityClustering(closes, 20),
            null, null, null);
    }

    public IndicatorSnapshot withFundamentals(Double sectorSentiment, Double peRatio, Double debtToEquity) {
        return new IndicatorSnapshot(rsi, volatility, volatilityClustering, sectorSentiment, peRatio, debtToEquity);
    }
}
