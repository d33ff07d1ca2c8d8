package com.tradingagents.common.risk;

/** Small numeric helpers shared by the risk and sizing calculators. */
public final class RiskMath {

    private RiskMath() {}

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    public static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
