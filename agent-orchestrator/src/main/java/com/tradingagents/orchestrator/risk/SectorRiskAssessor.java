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
import java.util.Map;
import java.util.Set;

/**
 * Sector risk from a static ticker-to-sector map. Base 0.3, adjusted per sector, plus 0.1
 * for sectors that move together with the broad market.
 */
@Component
public class SectorRiskAssessor implements RiskComponentAssessor {

    enum Sector { TECHNOLOGY, ENERGY, FINANCE, HEALTHCARE, UTILITIES, CONSUMER_DEFENSIVE, GENERAL }

    private static final Map<String, Sector> SECTORS = Map.ofEntries(
        Map.entry("AAPL", Sector.TECHNOLOGY), Map.entry("MSFT", Sector.TECHNOLOGY),
        Map.entry("GOOGL", Sector.TECHNOLOGY), Map.entry("AMZN", Sector.TECHNOLOGY),
        Map.entry("XOM", Sector.ENERGY), Map.entry("CVX", Sector.ENERGY), Map.entry("COP", Sector.ENERGY),
        Map.entry("JPM", Sector.FINANCE), Map.entry("BAC", Sector.FINANCE), Map.entry("WFC", Sector.FINANCE),
        Map.entry("JNJ", Sector.HEALTHCARE), Map.entry("PFE", Sector.HEALTHCARE), Map.entry("UNH", Sector.HEALTHCARE),
        Map.entry("NEE", Sector.UTILITIES), Map.entry("SO", Sector.UTILITIES), Map.entry("DUK", Sector.UTILITIES),
        Map.entry("PG", Sector.CONSUMER_DEFENSIVE), Map.entry("KO", Sector.CONSUMER_DEFENSIVE),
        Map.entry("WMT", Sector.CONSUMER_DEFENSIVE)
    );

    private static final Set<Sector> HIGH_CORRELATION = Set.of(Sector.TECHNOLOGY, Sector.ENERGY, Sector.FINANCE);

    @Override
    public RiskDimension dimension() {
        return RiskDimension.SECTOR;
    }

    @Override
    public Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators) {
        return Mono.fromCallable(() -> score(state.ticker()));
    }

    static Sector sectorOf(String ticker) {
        if (ticker == null) return Sector.GENERAL;
        return SECTORS.getOrDefault(ticker.toUpperCase(Locale.ROOT), Sector.GENERAL);
    }

    static RiskComponentResult score(String ticker) {
        List<String> factors = new ArrayList<>();
        double risk = 0.3;
        Sector sector = sectorOf(ticker);

        switch (sector) {
            case TECHNOLOGY -> {
                risk += 0.1;
                factors.add("Technology sector volatility");
                String upper = ticker.toUpperCase(Locale.ROOT);
                if (upper.contains("CRYPTO") || upper.contains("BTC")) {
                    risk += 0.2;
                    factors.add("Cryptocurrency high volatility");
                }
            }
            case ENERGY -> {
                risk += 0.15;
                factors.add("Energy sector commodity price risk");
            }
            case FINANCE -> {
                risk += 0.05;
                factors.add("Financial sector interest rate risk");
            }
            case HEALTHCARE -> {
                risk += 0.08;
                factors.add("Healthcare regulatory risk");
            }
            case UTILITIES -> {
                risk -= 0.05;
                factors.add("Utilities sector stability");
            }
            case CONSUMER_DEFENSIVE -> {
                risk -= 0.03;
                factors.add("Consumer defensive stability");
            }
            case GENERAL -> factors.add("General market sector risk");
        }

        if (HIGH_CORRELATION.contains(sector)) {
            risk += 0.1;
            factors.add("High sector correlation risk");
        }
        return RiskComponentResult.of(risk, factors);
    }
}
