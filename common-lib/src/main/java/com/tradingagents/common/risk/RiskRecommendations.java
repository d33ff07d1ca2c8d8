package com.tradingagents.common.risk;

import java.util.List;

final class RiskRecommendations {

    private RiskRecommendations() {}

    static List<String> forLevel(RiskLevel level, double score) {
        if (level == RiskLevel.HIGH || score > 0.7) {
            return List.of(
                "Consider reducing position size or avoiding trade",
                "Wait for risk conditions to improve",
                "Implement strict stop-loss orders if position taken");
        }
        if (level == RiskLevel.MEDIUM || score > 0.4) {
            return List.of(
                "Use conservative position sizing",
                "Monitor position closely for risk changes",
                "Consider partial profit-taking on favorable moves");
        }
        return List.of(
            "Normal position sizing appropriate",
            "Standard risk management protocols",
            "Monitor for risk escalation signals");
    }
}
