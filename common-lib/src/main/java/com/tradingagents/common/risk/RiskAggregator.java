package com.tradingagents.common.risk;

import com.tradingagents.common.exception.AggregateRiskFailureException;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the seven per-dimension results into one {@link RiskAssessment}.
 *
 * <h3>Formula</h3>
 * <pre>
 *   overallScore      = Σ weight(d) · score(d)                 (rounded to 3 decimals)
 *   completenessRatio = informative factors / all factors      (0 when there are none)
 *   confidence        = clamp(0.3 + 0.6 · completenessRatio, 0.2, 0.9)
 *   overallRisk       = LOW (&lt;0.30) | MEDIUM | HIGH (&gt;0.70)
 * </pre>
 *
 * <p>Dimensions missing from the input are filled with their degenerate neutral result.
 * If every dimension is degraded there is nothing to aggregate and
 * {@link AggregateRiskFailureException} is thrown; callers map that to
 * {@link RiskAssessment#failSafe(String)}.
 */
public final class RiskAggregator {

    static final double MIN_CONFIDENCE = 0.2;
    static final double MAX_CONFIDENCE = 0.9;

    private RiskAggregator() {}

    public static RiskAssessment aggregate(Map<RiskDimension, RiskComponentResult> results) {
        Map<RiskDimension, RiskComponentResult> complete = new EnumMap<>(RiskDimension.class);
        for (RiskDimension dimension : RiskDimension.values()) {
            RiskComponentResult result = results != null ? results.get(dimension) : null;
            complete.put(dimension, result != null ? result : RiskComponentResult.failed(dimension));
        }

        if (complete.values().stream().allMatch(RiskComponentResult::degraded)) {
            throw new AggregateRiskFailureException("risk-aggregator",
                "all " + complete.size() + " risk components failed");
        }

        double score = 0.0;
        int totalFactors = 0;
        int informativeFactors = 0;
        for (Map.Entry<RiskDimension, RiskComponentResult> e : complete.entrySet()) {
            score += e.getKey().weight() * e.getValue().score();
            for (String factor : e.getValue().factors()) {
                totalFactors++;
                if (RiskComponentResult.isInformative(factor)) informativeFactors++;
            }
        }
        score = RiskMath.round3(RiskMath.clamp01(score));

        double completeness = totalFactors == 0 ? 0.0 : (double) informativeFactors / totalFactors;
        double confidence = RiskMath.round3(
            RiskMath.clamp(0.3 + 0.6 * completeness, MIN_CONFIDENCE, MAX_CONFIDENCE));

        RiskLevel level = RiskLevel.fromScore(score);
        List<String> recommendations = RiskRecommendations.forLevel(level, score);

        return new RiskAssessment(level, score, confidence, complete, recommendations,
            false, null, Instant.now());
    }
}
