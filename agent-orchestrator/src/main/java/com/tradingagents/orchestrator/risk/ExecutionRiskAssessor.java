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

/** Execution risk read from the trader's plan. A missing plan scores 0.6. */
@Component
public class ExecutionRiskAssessor implements RiskComponentAssessor {

    static final double NO_PLAN_SCORE = 0.6;

    @Override
    public RiskDimension dimension() {
        return RiskDimension.EXECUTION;
    }

    @Override
    public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
        return Mono.fromCallable(() -> score(state.traderPlan()));
    }

    static RiskComponentResult score(String plan) {
        if (plan == null || plan.isBlank()) {
            return RiskComponentResult.of(NO_PLAN_SCORE, List.of(RiskComponentResult.noDataFactor("trading plan")));
        }
        List<String> factors = new ArrayList<>();
        String text = lower(plan);
        double risk = 0.2;

        if (containsAny(text, "leverage", "margin", "options")) {
            risk += 0.3;
            factors.add("Leveraged or derivative instruments");
        }
        if (containsAny(text, "all in", "maximum", "full position")) {
            risk += 0.25;
            factors.add("Large position size concentration");
        }
        if (containsAny(text, "stop loss", "risk management", "position size")) {
            risk -= 0.1;
            factors.add("Risk management controls in place");
        }
        return RiskComponentResult.of(risk, factors);
    }
}
