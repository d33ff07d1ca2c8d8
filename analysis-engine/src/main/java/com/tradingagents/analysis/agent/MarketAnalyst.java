package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.data.DataKind;
import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.analysis.data.DataRequest;
import com.tradingagents.analysis.indicator.TechnicalIndicators;
import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.AnalystType;
import com.tradingagents.common.state.MarketReportPatch;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Price-action analyst. Adds RSI, SMA20/50, MACD and volatility readings to the
 * price-history feed before prompting.
 */
@Component
public class MarketAnalyst extends AnalystStage<MarketReportPatch> {

    public MarketAnalyst(LlmClient llm, DataProviderClient data) {
        super(llm, data);
    }

    @Override
    public AnalystType type() { return AnalystType.MARKET; }

    @Override
    protected DataKind dataKind() { return DataKind.PRICE_HISTORY; }

    @Override
    protected String systemPrompt() { return Prompts.MARKET_SYSTEM; }

    @Override
    protected MarketReportPatch toPatch(String report, List<String> messages) {
        return new MarketReportPatch(report, messages);
    }

    @Override
    protected Mono<String> gatherData(AgentState state) {
        Mono<String> feed = data.fetch(DataRequest.of(DataKind.PRICE_HISTORY, state.ticker(), state.tradeDate()));
        // indicators are optional; the feed alone still makes a report
        Mono<List<Double>> closes = data.closingPrices(state.ticker(), state.tradeDate(),
                DataKind.PRICE_HISTORY.defaultLookbackDays())
            .onErrorReturn(List.of())
            .defaultIfEmpty(List.of());
        return Mono.zip(feed, closes, (text, prices) -> text + "\n\n" + indicatorSummary(prices));
    }

    static String indicatorSummary(List<Double> prices) {
        if (prices == null || prices.isEmpty()) return "Indicators: insufficient price data";
        double rsi   = TechnicalIndicators.rsi(prices, 14);
        double sma20 = TechnicalIndicators.sma(prices, 20);
        double sma50 = TechnicalIndicators.sma(prices, 50);
        double macd  = TechnicalIndicators.macd(prices);
        double vol   = TechnicalIndicators.annualizedVolatility(prices, 20);
        return String.format("Indicators: close=%.2f RSI14=%s (%s) SMA20=%s SMA50=%s trend=%s MACD=%s vol20=%s",
            prices.get(0), fmt(rsi), TechnicalIndicators.rsiSignal(rsi), fmt(sma20), fmt(sma50),
            TechnicalIndicators.trendSignal(sma20, sma50, prices.get(0)), fmt(macd), fmt(vol));
    }

    private static String fmt(double v) {
        return Double.isNaN(v) ? "N/A" : String.format("%.2f", v);
    }
}
