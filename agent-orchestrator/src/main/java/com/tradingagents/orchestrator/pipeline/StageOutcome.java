package com.tradingagents.orchestrator.pipeline;

import com.tradingagents.common.state.StatePatch;

/**
 * Settled result of one stage run: either a patch to merge or the captured failure.
 * Failures travel as values so they never cross a join boundary as exceptions.
 */
public record StageOutcome(String stageName, StatePatch patch, Throwable error) {

    public static StageOutcome ok(String stageName, StatePatch patch) {
        return new StageOutcome(stageName, patch, null);
    }

    public static StageOutcome failed(String stageName, Throwable error) {
        return new StageOutcome(stageName, null, error);
    }

    public boolean isOk() {
        return error == null && patch != null;
    }
}
