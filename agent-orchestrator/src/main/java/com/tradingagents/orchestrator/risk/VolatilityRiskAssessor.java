package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskComponentResult;
import com.tradingagents.common.risk.RiskDimension;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Short-horizon volatility risk: recent annualised volatility, volatility clustering, and
 * whether the assessment runs outside NYSE hours (14:00-21:00 UTC).
 */
@Component
public class VolatilityRiskAssessor implements RiskComponentAssessor {

    private final Clock clock;

    public VolatilityRiskAssessor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RiskDimension dimension() {
        return RiskDimension.VOLATILITY;
    }

    @Override
    public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
        return Mono.fromCallable(() -> score(indicators, isMarketHours()));
    }

    boolean isMarketHours() {
        int hour = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC).getHour();
        return hour >= 14 && hour < 21;
    }

    static RiskComponentResult score(IndicatorSnapshot indicators, boolean marketHours) {
        List<String> factors = new ArrayList<>();
        double risk = 0.3;

        Double volatility = indicators.volatility();
        if (volatility == null) {
            factors.add(RiskComponentResult.noDataFactor("volatility data"));
        } else if (volatility > 0.3) {
            risk += 0.3;
            factors.add("High recent volatility detected");
        } else if (volatility > 0.2) {
            risk += 0.15;
            factors.add("Moderate recent volatility");
        } else if (volatility < 0.1) {
            risk -= 0.1;
            factors.add("Low recent volatility");
        }

        if (Boolean.TRUE.equals(indicators.volatilityClustering())) {
            risk += 0.1;
            factors.add("Volatility clustering detected");
        }
        if (!marketHours) {
            risk += 0.05;
            factors.add("After-hours trading increased volatility");
        }
        return RiskComponentResult.of(risk, factors);
    }
}
