package com.tradingagents.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated risk picture for one run.
 *
 * <p>Always carries at least one recommendation. The fail-safe instance
 * ({@link #failSafe(String)}) reports HIGH risk with near-zero confidence so downstream
 * decisioning defaults to caution.
 */
public record RiskAssessment(
    @JsonProperty("overallRisk") RiskLevel overallRisk,
    @JsonProperty("overallScore") double overallScore,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("components") Map<RiskDimension, RiskComponentResult> components,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("failSafe") boolean failSafe,
    @JsonProperty("error") String error,
    @JsonProperty("assessedAt") Instant assessedAt
) {

    public static final double FAIL_SAFE_SCORE      = 0.9;
    public static final double FAIL_SAFE_CONFIDENCE = 0.1;

    public RiskAssessment {
        overallScore = RiskMath.clamp01(overallScore);
        confidence   = RiskMath.clamp01(confidence);
        components   = components == null || components.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(components));
        if (recommendations == null || recommendations.isEmpty()) {
            recommendations = RiskRecommendations.forLevel(overallRisk, overallScore);
        } else {
            recommendations = List.copyOf(recommendations);
        }
    }

    public static RiskAssessment failSafe(String reason) {
        return new RiskAssessment(RiskLevel.HIGH, FAIL_SAFE_SCORE, FAIL_SAFE_CONFIDENCE, Map.of(),
            List.of("Avoid new exposure until risk assessment is available",
                    "Treat all positions as high risk"),
            true, reason, Instant.now());
    }
}
