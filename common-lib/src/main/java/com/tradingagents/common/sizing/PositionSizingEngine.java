package com.tradingagents.common.sizing;

import com.tradingagents.common.risk.RiskMath;

import java.util.List;

/**
 * Kelly-based position sizing with a shrink-only adjustment chain.
 *
 * <h3>Pipeline</h3>
 * <pre>
 *   kellyFraction = clamp((b·p − q) / b, 0, 0.20)        q = 1 − p
 *   kellySize     = max(0.01, kellyFraction)
 *   riskAdjusted  = kellySize    × max(0.3, 1 − riskScore)
 *   volAdjusted   = riskAdjusted × max(0.2, 1 − 2·volatility)
 *   constrained   = clamp(volAdjusted, 0.01, 0.25)
 *   recommended   = clamp(min(0.5·kellySize, riskAdjusted, volAdjusted, constrained), 0.01, 0.25)
 * </pre>
 *
 * Each stage result is floored at {@link #MIN_POSITION} and capped at its input, so
 * {@code recommendedSize} never exceeds any intermediate size.
 */
public final class PositionSizingEngine {

    public static final double MIN_POSITION = 0.01;
    public static final double MAX_POSITION = 0.25;
    public static final double MAX_KELLY    = 0.20;

    static final SizingStage RISK_STAGE =
        (size, in) -> size * Math.min(1.0, Math.max(0.3, 1.0 - in.riskScore()));

    static final SizingStage VOLATILITY_STAGE =
        (size, in) -> size * Math.min(1.0, Math.max(0.2, 1.0 - 2.0 * in.volatility()));

    static final SizingStage PORTFOLIO_STAGE =
        (size, in) -> RiskMath.clamp(size, MIN_POSITION, MAX_POSITION);

    private static final List<SizingStage> CHAIN = List.of(RISK_STAGE, VOLATILITY_STAGE, PORTFOLIO_STAGE);

    private PositionSizingEngine() {}

    /**
     * @param inputs sizing parameters; missing or non-finite values fall back to defaults
     * @return {@link PositionSizing}, never null
     */
    public static PositionSizing compute(SizingInputs inputs) {
        double kellyFraction = kellyFraction(inputs.winRate(), inputs.winLossRatio());
        double kellySize = Math.max(MIN_POSITION, kellyFraction);

        double[] stages = fold(kellySize, inputs, CHAIN);
        double riskAdjusted = stages[0];
        double volAdjusted  = stages[1];
        double constrained  = stages[2];

        double recommended = Math.min(Math.min(0.5 * kellySize, riskAdjusted), Math.min(volAdjusted, constrained));
        recommended = RiskMath.clamp(recommended, MIN_POSITION, MAX_POSITION);

        String reasoning = String.format(
            "p=%.2f b=%.2f kelly=%.3f risk=%.2f vol=%.2f → risk-adj=%.3f vol-adj=%.3f constrained=%.3f recommended=%.3f",
            inputs.winRate(), inputs.winLossRatio(), kellyFraction, inputs.riskScore(), inputs.volatility(),
            riskAdjusted, volAdjusted, constrained, recommended);

        return new PositionSizing(kellyFraction, kellySize, riskAdjusted, volAdjusted,
            constrained, recommended, reasoning);
    }

    /** {@code (b·p − q) / b} clamped to [0, 0.20]; 0 when b is not positive. */
    public static double kellyFraction(double winRate, double winLossRatio) {
        if (!(winLossRatio > 0) || Double.isNaN(winRate)) return 0.0;
        double p = RiskMath.clamp01(winRate);
        double q = 1.0 - p;
        return RiskMath.clamp((winLossRatio * p - q) / winLossRatio, 0.0, MAX_KELLY);
    }

    /**
     * Applies {@code stages} left to right. Each result is capped at the previous size and
     * floored at {@link #MIN_POSITION}; the starting size is at least that floor, so the
     * floor never lifts a value above its predecessor.
     */
    static double[] fold(double start, SizingInputs inputs, List<SizingStage> stages) {
        double[] out = new double[stages.size()];
        double size = start;
        for (int i = 0; i < stages.size(); i++) {
            double next = stages.get(i).shrink(size, inputs);
            if (Double.isNaN(next)) next = MIN_POSITION;
            size = Math.max(MIN_POSITION, Math.min(size, next));
            out[i] = size;
        }
        return out;
    }
}
