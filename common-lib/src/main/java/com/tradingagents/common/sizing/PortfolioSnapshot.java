package com.tradingagents.common.sizing;

/**
 * Current holdings relevant to {@link PortfolioConstraints}.
 *
 * @param sectorWeight  existing allocation to the ticker's sector, fraction of portfolio
 * @param drawdown      current drawdown, fraction
 * @param openPositions number of open positions
 * @param sectorCount   number of distinct sectors held
 */
public record PortfolioSnapshot(double sectorWeight, double drawdown, int openPositions, int sectorCount) {

    public static PortfolioSnapshot empty() {
        return new PortfolioSnapshot(0.0, 0.0, 0, 0);
    }

    public PortfolioConstraints.Check check(double proposedSize) {
        return PortfolioConstraints.check(proposedSize, sectorWeight, drawdown, openPositions, sectorCount);
    }
}
