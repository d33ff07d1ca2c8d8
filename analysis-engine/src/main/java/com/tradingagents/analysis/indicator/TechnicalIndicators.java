package com.tradingagents.analysis.indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Input prices are expected newest-first (index 0 = most recent close).
 */
public final class TechnicalIndicators {

    private static final int TRADING_DAYS = 252;

    private TechnicalIndicators() {}

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Wilder-smoothed RSI.
     * @param prices  closing prices, newest-first
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1) return Double.NaN;

        List<Double> oldest = oldestFirst(prices);
        int n = oldest.size();

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Moving averages ─────────────────────────────────────────────────────

    /** @return SMA of the newest {@code period} closes, or NaN if insufficient data */
    public static double sma(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) sum += prices.get(i);
        return sum / period;
    }

    /** @return most-recent EMA value, or NaN if insufficient data */
    public static double ema(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        List<Double> oldest = oldestFirst(prices);
        double k = 2.0 / (period + 1);
        double ema = oldest.get(0);
        for (int i = 1; i < oldest.size(); i++) {
            ema = oldest.get(i) * k + ema * (1 - k);
        }
        return ema;
    }

    /** MACD line = EMA(12) - EMA(26) */
    public static double macd(List<Double> prices) {
        double ema12 = ema(prices, 12);
        double ema26 = ema(prices, 26);
        if (Double.isNaN(ema12) || Double.isNaN(ema26)) return Double.NaN;
        return ema12 - ema26;
    }

    // ── Volatility ──────────────────────────────────────────────────────────

    /**
     * Annualised standard deviation of daily simple returns over the newest {@code period}
     * returns (0.25 = 25%).
     */
    public static double annualizedVolatility(List<Double> prices, int period) {
        List<Double> returns = dailyReturns(prices);
        if (returns.size() < period || period < 2) return Double.NaN;
        return stdDev(returns.subList(0, period)) * Math.sqrt(TRADING_DAYS);
    }

    /**
     * True when the newest half of the window is markedly more volatile than the older half
     * (ratio above 1.5), a sign of volatility clustering.
     */
    public static boolean volatilityClustering(List<Double> prices, int period) {
        List<Double> returns = dailyReturns(prices);
        if (returns.size() < period || period < 4) return false;
        int half = period / 2;
        double recent = stdDev(returns.subList(0, half));
        double older  = stdDev(returns.subList(half, period));
        return older > 0 && recent / older > 1.5;
    }

    static List<Double> dailyReturns(List<Double> prices) {
        List<Double> returns = new ArrayList<>();
        if (prices == null) return returns;
        for (int i = 0; i + 1 < prices.size(); i++) {
            double prev = prices.get(i + 1);
            if (prev != 0) returns.add(prices.get(i) / prev - 1.0);
        }
        return returns;
    }

    private static double stdDev(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = 0;
        for (double v : values) variance += (v - mean) * (v - mean);
        return Math.sqrt(variance / values.size());
    }

    // ── Signal helpers ───────────────────────────────────────────────────────

    public static String rsiSignal(double rsi) {
        if (Double.isNaN(rsi)) return "INSUFFICIENT_DATA";
        if (rsi < 30) return "OVERSOLD";
        if (rsi > 70) return "OVERBOUGHT";
        return "NEUTRAL";
    }

    public static String trendSignal(double sma20, double sma50, double currentPrice) {
        if (Double.isNaN(sma20) || Double.isNaN(sma50)) return "INSUFFICIENT_DATA";
        if (currentPrice > sma20 && sma20 > sma50) return "UPTREND";
        if (currentPrice < sma20 && sma20 < sma50) return "DOWNTREND";
        return "SIDEWAYS";
    }

    private static List<Double> oldestFirst(List<Double> prices) {
        List<Double> copy = new ArrayList<>(prices);
        Collections.reverse(copy);
        return copy;
    }
}
