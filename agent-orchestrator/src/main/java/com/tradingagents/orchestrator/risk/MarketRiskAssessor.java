package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskComponentResult;
import com.tradingagents.common.risk.RiskDimension;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static com.tradingagents.orchestrator.risk.Keywords.containsAny;
import static com.tradingagents.orchestrator.risk.Keywords.lower;

/**
 * Market risk from the market report plus an RSI overlay.
 * Base 0.3; technical sub-score (base 0.3, overbought +0.15, oversold +0.10) contributes 30%.
 */
@Component
public class MarketRiskAssessor implements RiskComponentAssessor {

    @Override
    public RiskDimension dimension() {
        return RiskDimension.MARKET;
    }

    @Override
    public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
        return Mono.fromCallable(() -> score(state.marketReport(), indicators));
    }

    static RiskComponentResult score(String report, IndicatorSnapshot indicators) {
        if (report == null || report.isBlank()) {
            return RiskComponentResult.of(RiskComponentResult.NEUTRAL_SCORE,
                List.of(RiskComponentResult.noDataFactor("market data")));
        }
        List<String> factors = new ArrayList<>();
        double risk = 0.3;

        double technical = 0.3;
        Double rsi = indicators.rsi();
        if (rsi == null) {
            factors.add(RiskComponentResult.noDataFactor("RSI data"));
        } else if (rsi > 70) {
            technical += 0.15;
            factors.add("RSI overbought condition");
        } else if (rsi < 30) {
            technical += 0.10;
            factors.add("RSI oversold condition");
        }
        risk += technical * 0.3;

        String text = lower(report);
        if (containsAny(text, "volatility", "volatile")) {
            risk += 0.2;
            factors.add("High volatility environment");
        }
        if (containsAny(text, "decline", "drop", "fall")) {
            risk += 0.15;
            factors.add("Market decline indicators");
        }
        if (containsAny(text, "rally", "surge", "gain")) {
            risk -= 0.1;
            factors.add("Market rally indicators");
        }
        if (containsAny(text, "uncertain", "unclear")) {
            risk += 0.1;
            factors.add("Market uncertainty");
        }
        return RiskComponentResult.of(risk, factors);
    }
}
