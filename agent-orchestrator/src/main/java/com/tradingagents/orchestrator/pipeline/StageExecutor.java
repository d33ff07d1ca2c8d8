package com.tradingagents.orchestrator.pipeline;

import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.exception.StageFailureException;
import com.tradingagents.common.model.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Runs one stage against a state snapshot and settles it into a {@link StageOutcome}.
 *
 * <p>The returned {@code Mono} always emits exactly one outcome and never errors. A stage that
 * throws, errors, or completes empty becomes a failed outcome carrying a
 * {@link StageFailureException}. No retries happen here.
 */
@Component
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    public Mono<StageOutcome> execute(Stage<?> stage, AgentState state) {
        String name = stage.name();
        long start = System.currentTimeMillis();
        return Mono.defer(() -> stage.process(state))
            .map(patch -> {
                log.info("[StageExecutor] Stage completed. stage={} ticker={} latencyMs={}",
                    name, state.ticker(), System.currentTimeMillis() - start);
                return StageOutcome.ok(name, patch);
            })
            .switchIfEmpty(Mono.fromSupplier(() -> StageOutcome.failed(name,
                new StageFailureException(name, "stage produced no output"))))
            .onErrorResume(e -> {
                log.warn("[StageExecutor] Stage failed, excluding from merge. stage={} ticker={} reason={}",
                    name, state.ticker(), e.getMessage());
                return Mono.just(StageOutcome.failed(name,
                    new StageFailureException(name, String.valueOf(e.getMessage()), e)));
            });
    }
}
