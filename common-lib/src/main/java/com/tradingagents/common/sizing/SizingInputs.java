package com.tradingagents.common.sizing;

/**
 * Parameters of one sizing computation.
 *
 * @param winRate        probability of a winning trade, p
 * @param winLossRatio   average win / average loss, b
 * @param volatility     annualised volatility as a fraction (0.2 = 20%)
 * @param riskScore      overall risk score from the risk assessment, in [0,1]
 * @param portfolioSize  portfolio value in account currency
 * @param riskTolerance  0.3 conservative, 0.5 moderate, 0.8 aggressive
 */
public record SizingInputs(
    double winRate,
    double winLossRatio,
    double volatility,
    double riskScore,
    double portfolioSize,
    double riskTolerance
) {
    public static final double DEFAULT_WIN_RATE       = 0.55;
    public static final double DEFAULT_WIN_LOSS_RATIO = 2.0;
    public static final double DEFAULT_VOLATILITY     = 0.20;
    public static final double DEFAULT_PORTFOLIO_SIZE = 100_000;
    public static final double MODERATE_TOLERANCE     = 0.5;

    public static SizingInputs defaults(double riskScore) {
        return new SizingInputs(DEFAULT_WIN_RATE, DEFAULT_WIN_LOSS_RATIO, DEFAULT_VOLATILITY,
            riskScore, DEFAULT_PORTFOLIO_SIZE, MODERATE_TOLERANCE);
    }

    public SizingInputs withRiskScore(double score) {
        return new SizingInputs(winRate, winLossRatio, volatility, score, portfolioSize, riskTolerance);
    }
}
