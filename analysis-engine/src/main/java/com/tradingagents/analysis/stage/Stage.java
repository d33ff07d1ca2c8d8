package com.tradingagents.analysis.stage;

import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.state.StatePatch;
import reactor.core.publisher.Mono;

/**
 * One named unit of work in the workflow. Reads the state and emits the patch type it owns.
 *
 * <p>Implementations call external services (LLM, data providers) and may fail; the
 * orchestrator isolates those failures. Retries belong inside the implementation, around
 * its outbound calls.
 *
 * @param <P> the only patch type this stage may produce
 */
public interface Stage<P extends StatePatch> {

    /** Display name, recorded in {@code agentsExecuted} on success. */
    String name();

    Mono<P> process(AgentState state);
}
