package com.tradingagents.orchestrator.pipeline;

import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.debate.DebateRouter;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.DebateKind;
import com.tradingagents.common.state.StatePatch;

import java.util.List;
import java.util.function.Function;

/**
 * A bounded debate: each round runs {@code speakers} one after another, then the router
 * decides whether to debate again or hand over to {@code judge}.
 *
 * @param fallbackVerdict builds the terminal patch when the judge fails or leaves no verdict
 */
public record DebateLoop(
    String name,
    DebateKind kind,
    List<Stage<?>> speakers,
    Stage<?> judge,
    DebateRouter router,
    Function<AgentState, StatePatch> fallbackVerdict
) implements Phase {

    public DebateLoop {
        speakers = List.copyOf(speakers);
        if (router.kind() != kind) {
            throw new IllegalArgumentException("router kind " + router.kind() + " does not match debate " + kind);
        }
    }

    public int completedRounds(AgentState state) {
        return switch (kind) {
            case INVESTMENT -> state.investDebate().round();
            case RISK       -> state.riskDebate().round();
        };
    }

    public boolean hasVerdict(AgentState state) {
        return switch (kind) {
            case INVESTMENT -> state.investDebate().hasVerdict();
            case RISK       -> state.riskDebate().hasVerdict();
        };
    }

    public List<String> history(AgentState state) {
        return switch (kind) {
            case INVESTMENT -> state.investDebate().history();
            case RISK       -> state.riskDebate().history();
        };
    }
}
