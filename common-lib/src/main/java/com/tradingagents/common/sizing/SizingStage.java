package com.tradingagents.common.sizing;

/**
 * One step of the position-sizing shrink chain. Implementations may return any value;
 * {@link PositionSizingEngine} caps each result at the incoming size so the chain can
 * only shrink.
 */
@FunctionalInterface
public interface SizingStage {
    double shrink(double size, SizingInputs inputs);
}
