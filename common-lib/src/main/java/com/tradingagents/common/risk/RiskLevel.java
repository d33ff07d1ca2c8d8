package com.tradingagents.common.risk;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    static final double LOW_THRESHOLD  = 0.30;
    static final double HIGH_THRESHOLD = 0.70;

    /** {@code <0.30 → LOW}, {@code >0.70 → HIGH}, otherwise MEDIUM. */
    public static RiskLevel fromScore(double score) {
        if (score < LOW_THRESHOLD) return LOW;
        if (score > HIGH_THRESHOLD) return HIGH;
        return MEDIUM;
    }
}
