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
 * Fundamental risk from the fundamentals report plus a valuation/leverage model
 * (base 0.3, P/E above 30 +0.10, debt/equity above 1.5 +0.15) contributing 40%.
 */
@Component
public class FundamentalRiskAssessor implements RiskComponentAssessor {

    @Override
    public RiskDimension dimension() {
        return RiskDimension.FUNDAMENTAL;
    }

    @Override
    public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
        return Mono.fromCallable(() -> score(state.fundamentalsReport(), indicators));
    }

    static RiskComponentResult score(String report, IndicatorSnapshot indicators) {
        if (report == null || report.isBlank()) {
            return RiskComponentResult.of(RiskComponentResult.NEUTRAL_SCORE,
                List.of(RiskComponentResult.noDataFactor("fundamental data")));
        }
        List<String> factors = new ArrayList<>();
        double risk = 0.3;

        double quant = 0.3;
        Double pe = indicators.peRatio();
        if (pe == null) {
            factors.add(RiskComponentResult.noDataFactor("P/E data"));
        } else if (pe > 30) {
            quant += 0.1;
            factors.add("High P/E ratio valuation risk");
        }
        Double debtToEquity = indicators.debtToEquity();
        if (debtToEquity == null) {
            factors.add(RiskComponentResult.noDataFactor("debt-to-equity data"));
        } else if (debtToEquity > 1.5) {
            quant += 0.15;
            factors.add("High debt-to-equity ratio");
        }
        risk += quant * 0.4;

        String text = lower(report);
        if (containsAny(text, "debt", "leverage")) {
            risk += 0.15;
            factors.add("Debt/leverage concerns");
        }
        if (containsAny(text, "loss", "negative")) {
            risk += 0.2;
            factors.add("Profitability concerns");
        }
        if (containsAny(text, "profit", "growth", "strong")) {
            risk -= 0.1;
            factors.add("Strong fundamental indicators");
        }
        return RiskComponentResult.of(risk, factors);
    }
}
