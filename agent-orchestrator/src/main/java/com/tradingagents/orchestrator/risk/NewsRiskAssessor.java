package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskComponentResult;
import com.tradingagents.common.risk.RiskDimension;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.tradingagents.orchestrator.risk.Keywords.containsAny;
import static com.tradingagents.orchestrator.risk.Keywords.lower;

/**
 * News risk from the news report. Impact words add 0.1 each to an impact score capped at 0.5,
 * which contributes 30%; regulatory, earnings and leadership topics add fixed increments.
 */
@Component
public class NewsRiskAssessor implements RiskComponentAssessor {

    private static final String[] IMPACT_WORDS = {"breaking", "urgent", "major", "significant", "unprecedented"};

    @Override
    public RiskDimension dimension() {
        return RiskDimension.NEWS;
    }

    @Override
    public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
        return Mono.fromCallable(() -> score(state.newsReport()));
    }

    static RiskComponentResult score(String report) {
        if (report == null || report.isBlank()) {
            return RiskComponentResult.of(RiskComponentResult.NEUTRAL_SCORE,
                List.of(RiskComponentResult.noDataFactor("news data")));
        }
        List<String> factors = new ArrayList<>();
        String text = lower(report);
        double risk = 0.3;

        double impact = impactScore(text);
        risk += impact * 0.3;
        factors.add(String.format(Locale.ROOT, "News impact score: %.2f", impact));

        if (containsAny(text, "regulation", "sec", "lawsuit")) {
            risk += 0.25;
            factors.add("Regulatory/legal news risk");
        }
        if (containsAny(text, "earnings", "revenue", "guidance")) {
            risk += 0.1;
            factors.add("Earnings-related news volatility");
        }
        if (containsAny(text, "ceo", "resignation", "leadership")) {
            risk += 0.15;
            factors.add("Leadership change risk");
        }
        return RiskComponentResult.of(risk, factors);
    }

    static double impactScore(String lowerText) {
        double impact = 0.0;
        for (String word : IMPACT_WORDS) {
            if (lowerText.contains(word)) impact += 0.1;
        }
        return Math.min(impact, 0.5);
    }
}
