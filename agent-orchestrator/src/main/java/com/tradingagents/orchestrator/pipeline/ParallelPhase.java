package com.tradingagents.orchestrator.pipeline;

import com.tradingagents.analysis.stage.Stage;

import java.util.List;

/**
 * Stages that run concurrently against the same input snapshot. Successful patches merge in
 * declaration order. A single-stage phase is simply a sequential step.
 *
 * @param resetMessages clear the message transcript once the phase has merged
 */
public record ParallelPhase(String name, List<Stage<?>> stages, boolean resetMessages) implements Phase {

    public ParallelPhase {
        stages = List.copyOf(stages);
    }

    public static ParallelPhase single(String name, Stage<?> stage) {
        return new ParallelPhase(name, List.of(stage), false);
    }
}
