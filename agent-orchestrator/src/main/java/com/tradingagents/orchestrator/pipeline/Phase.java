package com.tradingagents.orchestrator.pipeline;

/**
 * A barrier-separated group of stages. The scheduler starts the next phase only after every
 * stage of this one has settled.
 */
public sealed interface Phase permits ParallelPhase, DebateLoop {

    String name();
}
