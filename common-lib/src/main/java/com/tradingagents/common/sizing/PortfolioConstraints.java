package com.tradingagents.common.sizing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Portfolio-level limits checked against a proposed position.
 * Limits: position 1–25%, sector 40%, drawdown 20%, at least 5 positions across 3 sectors.
 * Values above 80% of a limit produce a warning instead of a violation.
 */
public final class PortfolioConstraints {

    public static final double SECTOR_LIMIT    = 0.40;
    public static final double DRAWDOWN_LIMIT  = 0.20;
    public static final int    MIN_POSITIONS   = 5;
    public static final int    MIN_SECTORS     = 3;
    private static final double WARNING_RATIO  = 0.8;

    private PortfolioConstraints() {}

    /**
     * @param proposedSize         fraction of portfolio for the new position
     * @param currentSectorWeight  existing allocation to the position's sector
     * @param currentDrawdown      current portfolio drawdown as a fraction
     * @param openPositions        number of positions already held
     * @param sectorCount          number of distinct sectors held
     */
    public static Check check(double proposedSize, double currentSectorWeight, double currentDrawdown,
                              int openPositions, int sectorCount) {
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (proposedSize > PositionSizingEngine.MAX_POSITION) {
            violations.add(String.format("Proposed position size %.1f%% exceeds maximum limit of %.1f%%",
                proposedSize * 100, PositionSizingEngine.MAX_POSITION * 100));
        } else if (proposedSize < PositionSizingEngine.MIN_POSITION) {
            warnings.add(String.format("Proposed position size %.1f%% is below minimum of %.1f%%",
                proposedSize * 100, PositionSizingEngine.MIN_POSITION * 100));
        }

        double sectorAfter = currentSectorWeight + proposedSize;
        if (sectorAfter > SECTOR_LIMIT) {
            violations.add(String.format("New sector allocation %.1f%% exceeds maximum sector limit of %.1f%%",
                sectorAfter * 100, SECTOR_LIMIT * 100));
        } else if (sectorAfter > SECTOR_LIMIT * WARNING_RATIO) {
            warnings.add(String.format("New sector allocation %.1f%% approaches maximum sector limit of %.1f%%",
                sectorAfter * 100, SECTOR_LIMIT * 100));
        }

        if (currentDrawdown > DRAWDOWN_LIMIT) {
            violations.add(String.format("Current portfolio drawdown %.1f%% exceeds maximum limit of %.1f%%",
                currentDrawdown * 100, DRAWDOWN_LIMIT * 100));
        } else if (currentDrawdown > DRAWDOWN_LIMIT * WARNING_RATIO) {
            warnings.add(String.format("Current portfolio drawdown %.1f%% approaches maximum limit of %.1f%%",
                currentDrawdown * 100, DRAWDOWN_LIMIT * 100));
        }

        if (openPositions < MIN_POSITIONS) {
            warnings.add("Portfolio has only " + openPositions + " positions, minimum recommended is "
                + MIN_POSITIONS + " for proper diversification");
        }
        if (sectorCount < MIN_SECTORS) {
            warnings.add("Portfolio spans only " + sectorCount + " sectors, minimum recommended is "
                + MIN_SECTORS + " for sector diversification");
        }

        return new Check(violations.isEmpty(), List.copyOf(violations), List.copyOf(warnings));
    }

    public record Check(
        @JsonProperty("approved") boolean approved,
        @JsonProperty("violations") List<String> violations,
        @JsonProperty("warnings") List<String> warnings
    ) {}
}
