package com.tradingagents.orchestrator.pipeline;

import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.debate.DebatePhase;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.state.DebateRoundPatch;
import com.tradingagents.common.state.MessageResetPatch;
import com.tradingagents.common.state.StageExecutedPatch;
import com.tradingagents.common.state.StatePropagator;
import com.tradingagents.common.trace.TraceContextUtil;
import com.tradingagents.orchestrator.logger.WorkflowFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs an ordered list of phases over one {@link AgentState}.
 *
 * <h3>Semantics</h3>
 * <ul>
 *   <li>Phases run strictly one after another (full barrier).</li>
 *   <li>Inside a {@link ParallelPhase} all stages are subscribed at once against the same
 *       snapshot; every outcome is awaited and a failure only drops that stage's patch.</li>
 *   <li>Successful patches merge in declaration order, each followed by a
 *       {@link StageExecutedPatch}. Failed stages never appear in {@code agentsExecuted}.</li>
 *   <li>A {@link DebateLoop} runs its speakers round by round under its router, records each
 *       completed round, then judges. A missing verdict is replaced by the loop's fallback.</li>
 * </ul>
 *
 * The returned {@code Mono} does not error on stage failures; those are settled by
 * {@link StageExecutor}.
 */
@Component
public class PhaseScheduler {

    private static final Logger log = LoggerFactory.getLogger(PhaseScheduler.class);

    private final StageExecutor executor;
    private final WorkflowFlowLogger flowLogger;

    public PhaseScheduler(StageExecutor executor, WorkflowFlowLogger flowLogger) {
        this.executor   = executor;
        this.flowLogger = flowLogger;
    }

    public Mono<AgentState> run(AgentState initial, List<Phase> phases) {
        Mono<AgentState> chain = Mono.just(initial);
        for (Phase phase : phases) {
            chain = chain.flatMap(state -> runPhase(phase, state));
        }
        return chain;
    }

    Mono<AgentState> runPhase(Phase phase, AgentState state) {
        if (phase instanceof ParallelPhase parallel) {
            return runParallel(parallel, state);
        }
        DebateLoop loop = (DebateLoop) phase;
        int executedBefore = state.agentsExecuted().size();
        int roundsBefore = loop.completedRounds(state);
        return runDebate(loop, state)
            .flatMap(done -> Mono.deferContextual(ctx -> {
                int attempted = loop.speakers().size() * (loop.completedRounds(done) - roundsBefore) + 1;
                int succeeded = done.agentsExecuted().size() - executedBefore;
                flowLogger.phaseCompleted(loop.name(), succeeded, attempted - succeeded,
                    TraceContextUtil.getRunId(ctx));
                return Mono.just(done);
            }));
    }

    // ── Parallel fan-out / settle-don't-fail join ──────────────────────────────

    private Mono<AgentState> runParallel(ParallelPhase phase, AgentState state) {
        return Flux.fromIterable(phase.stages())
            .flatMapSequential(stage -> executor.execute(stage, state))
            .collectList()
            .flatMap(outcomes -> Mono.deferContextual(ctx -> {
                AgentState merged = merge(state, outcomes);
                if (phase.resetMessages()) {
                    merged = StatePropagator.updateState(merged, new MessageResetPatch());
                }
                long ok = outcomes.stream().filter(StageOutcome::isOk).count();
                flowLogger.phaseCompleted(phase.name(), (int) ok, (int) (outcomes.size() - ok),
                    TraceContextUtil.getRunId(ctx));
                return Mono.just(merged);
            }));
    }

    static AgentState merge(AgentState state, List<StageOutcome> outcomes) {
        AgentState current = state;
        for (StageOutcome outcome : outcomes) {
            if (!outcome.isOk()) continue;
            current = StatePropagator.updateState(current, outcome.patch());
            current = StatePropagator.updateState(current, new StageExecutedPatch(outcome.stageName()));
        }
        return current;
    }

    // ── Bounded debate ─────────────────────────────────────────────────────────

    private Mono<AgentState> runDebate(DebateLoop loop, AgentState state) {
        DebatePhase next = loop.router().next(DebatePhase.DEBATING,
            loop.completedRounds(state), loop.hasVerdict(state));
        if (next == DebatePhase.DEBATING) {
            return runSpeakers(loop.speakers(), state)
                .map(afterRound -> StatePropagator.updateState(afterRound, new DebateRoundPatch(loop.kind())))
                .doOnNext(afterRound -> log.info("[PhaseScheduler] Debate round complete. phase={} round={}/{} ticker={}",
                    loop.name(), loop.completedRounds(afterRound), loop.router().maxRounds(), afterRound.ticker()))
                .flatMap(afterRound -> runDebate(loop, afterRound));
        }
        return judge(loop, state);
    }

    private Mono<AgentState> runSpeakers(List<Stage<?>> speakers, AgentState state) {
        Mono<AgentState> chain = Mono.just(state);
        for (Stage<?> speaker : speakers) {
            chain = chain.flatMap(current -> executor.execute(speaker, current)
                .map(outcome -> merge(current, List.of(outcome))));
        }
        return chain;
    }

    private Mono<AgentState> judge(DebateLoop loop, AgentState state) {
        // JUDGING → DONE
        return executor.execute(loop.judge(), state)
            .map(outcome -> {
                AgentState judged = merge(state, List.of(outcome));
                if (!loop.hasVerdict(judged)) {
                    log.warn("[PhaseScheduler] No verdict from judge, deriving from history. phase={} judge={} arguments={}",
                        loop.name(), loop.judge().name(), loop.history(judged).size());
                    judged = StatePropagator.updateState(judged, loop.fallbackVerdict().apply(judged));
                }
                return judged;
            });
    }
}
