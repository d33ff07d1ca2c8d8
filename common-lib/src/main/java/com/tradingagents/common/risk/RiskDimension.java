package com.tradingagents.common.risk;

/**
 * The seven independent risk dimensions and their fixed aggregation weights.
 * Weights sum to 1.0.
 */
public enum RiskDimension {
    MARKET("market", 0.20),
    SENTIMENT("sentiment", 0.15),
    NEWS("news", 0.15),
    FUNDAMENTAL("fundamental", 0.20),
    EXECUTION("execution", 0.10),
    SECTOR("sector", 0.15),
    VOLATILITY("volatility", 0.05);

    private final String label;
    private final double weight;

    RiskDimension(String label, double weight) {
        this.label = label;
        this.weight = weight;
    }

    public String label() { return label; }

    public double weight() { return weight; }
}
