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

/** Sentiment risk from the social report and sector sentiment (range -1..1). */
@Component
public class SentimentRiskAssessor implements RiskComponentAssessor {

    @Override
    public RiskDimension dimension() {
        return RiskDimension.SENTIMENT;
    }

    @Override
    public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
        return Mono.fromCallable(() -> score(state.sentimentReport(), indicators));
    }

    static RiskComponentResult score(String report, IndicatorSnapshot indicators) {
        if (report == null || report.isBlank()) {
            return RiskComponentResult.of(RiskComponentResult.NEUTRAL_SCORE,
                List.of(RiskComponentResult.noDataFactor("sentiment data")));
        }
        List<String> factors = new ArrayList<>();
        double risk = 0.3;

        Double sectorSentiment = indicators.sectorSentiment();
        if (sectorSentiment == null) {
            factors.add(RiskComponentResult.noDataFactor("sector sentiment data"));
        } else if (sectorSentiment < -0.3) {
            risk += 0.2;
            factors.add("Negative sector sentiment");
        }

        String text = lower(report);
        if (containsAny(text, "negative", "bearish", "pessimistic")) {
            risk += 0.2;
            factors.add("Negative market sentiment");
        }
        if (containsAny(text, "positive", "bullish", "optimistic")) {
            risk -= 0.1;
            factors.add("Positive market sentiment");
        }
        if (containsAny(text, "extreme", "euphoria", "panic")) {
            risk += 0.15;
            factors.add("Extreme sentiment - potential reversal risk");
        }
        return RiskComponentResult.of(risk, factors);
    }
}
