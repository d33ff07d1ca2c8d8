package com.tradingagents.common.sizing;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads sizing parameters out of a trader's free-text plan ("60% win rate", "3:1 risk reward",
 * "25% volatility", "$250,000 portfolio", "conservative"). Anything not mentioned keeps its
 * default.
 */
public final class PositionParameterExtractor {

    private static final Pattern WIN_RATE     = Pattern.compile("(\\d+(?:\\.\\d+)?)%?\\s*win\\s*rate");
    private static final Pattern WIN_LOSS     = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?::|to|risk.reward|rr)");
    private static final Pattern VOLATILITY   = Pattern.compile("(\\d+(?:\\.\\d+)?)%?\\s*volatility");
    private static final Pattern PORTFOLIO    = Pattern.compile("\\$?(\\d+(?:,\\d+)*(?:\\.\\d+)?)\\s*(?:portfolio|account|capital)");

    private PositionParameterExtractor() {}

    public static SizingInputs extract(String plan, double riskScore, double defaultPortfolioSize) {
        SizingInputs defaults = SizingInputs.defaults(riskScore);
        if (plan == null || plan.isBlank()) {
            return new SizingInputs(defaults.winRate(), defaults.winLossRatio(), defaults.volatility(),
                riskScore, defaultPortfolioSize, defaults.riskTolerance());
        }
        String text = plan.toLowerCase(Locale.ROOT);

        double winRate = firstNumber(WIN_RATE, text)
            .map(v -> v > 1 ? v / 100.0 : v)
            .orElse(defaults.winRate());
        double winLoss = firstNumber(WIN_LOSS, text)
            .filter(v -> v > 0)
            .orElse(defaults.winLossRatio());
        double volatility = firstNumber(VOLATILITY, text)
            .map(v -> v > 1 ? v / 100.0 : v)
            .orElse(defaults.volatility());
        double portfolio = firstNumber(PORTFOLIO, text)
            .filter(v -> v > 0)
            .orElse(defaultPortfolioSize);

        return new SizingInputs(winRate, winLoss, volatility, riskScore, portfolio, riskTolerance(text));
    }

    static double riskTolerance(String lowerText) {
        if (lowerText.contains("conservative")) return 0.3;
        if (lowerText.contains("aggressive")) return 0.8;
        return SizingInputs.MODERATE_TOLERANCE;
    }

    private static Optional<Double> firstNumber(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(Double.parseDouble(m.group(1).replace(",", "")));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
