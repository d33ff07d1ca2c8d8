package com.tradingagents.orchestrator.service;

import com.tradingagents.common.exception.InvalidRunRequestException;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.signal.SignalProcessor;
import com.tradingagents.common.signal.TradeAction;
import com.tradingagents.common.state.LoggableState;
import com.tradingagents.common.state.StatePropagator;
import com.tradingagents.common.trace.TraceContextUtil;
import com.tradingagents.orchestrator.logger.WorkflowFlowLogger;
import com.tradingagents.orchestrator.persistence.ExecutionRecord;
import com.tradingagents.orchestrator.persistence.RunLogSink;
import com.tradingagents.orchestrator.pipeline.PhaseScheduler;
import com.tradingagents.orchestrator.pipeline.WorkflowPhases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Entry point for one workflow run: builds the initial state, runs the canonical phases,
 * persists the loggable projection and reports the processed signal.
 *
 * <p>{@link #execute} always completes with a result. It reports an error only when the
 * request itself is invalid; stage, risk, decision and persistence failures have already
 * been degraded further down.
 */
@Service
public class WorkflowFacade {

    private static final Logger log = LoggerFactory.getLogger(WorkflowFacade.class);

    private static final Pattern TICKER = Pattern.compile("^[A-Z0-9][A-Z0-9.\\-^=]{0,14}$");

    private final PhaseScheduler scheduler;
    private final WorkflowPhases phases;
    private final RunLogSink runLogSink;
    private final WorkflowFlowLogger flowLogger;
    private final boolean runLogEnabled;
    private final int maxRunsPerTicker;

    // ticker → most recent runs, at most maxRunsPerTicker dates each; written only here
    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();

    public WorkflowFacade(PhaseScheduler scheduler, WorkflowPhases phases, RunLogSink runLogSink,
                          WorkflowFlowLogger flowLogger,
                          @Value("${workflow.run-log.enabled:true}") boolean runLogEnabled,
                          @Value("${workflow.run-log.max-runs-per-ticker:30}") int maxRunsPerTicker) {
        if (maxRunsPerTicker < 1) {
            throw new IllegalArgumentException("workflow.run-log.max-runs-per-ticker must be at least 1, got "
                + maxRunsPerTicker);
        }
        this.scheduler     = scheduler;
        this.phases        = phases;
        this.runLogSink    = runLogSink;
        this.flowLogger    = flowLogger;
        this.runLogEnabled    = runLogEnabled;
        this.maxRunsPerTicker = maxRunsPerTicker;
    }

    public Mono<ExecutionResult> execute(String ticker, LocalDate tradeDate) {
        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            final String runId = UUID.randomUUID().toString();

            AgentState validated;
            try {
                validated = initialState(ticker, tradeDate);
            } catch (InvalidRunRequestException e) {
                TraceContextUtil.withMdc(runId, () ->
                    log.warn("Run rejected. ticker={} tradeDate={} reason={}", ticker, tradeDate, e.getMessage()));
                return Mono.just(ExecutionResult.rejected(ticker, tradeDate, runId, e.getMessage(),
                    System.currentTimeMillis() - startTime));
            }
            final AgentState initial = validated;

            TraceContextUtil.withMdc(runId, () ->
                log.info("Run started. ticker={} tradeDate={} runId={}", initial.ticker(), tradeDate, runId));

            Mono<ExecutionResult> pipeline = Mono.just(initial)
                .doOnEach(flowLogger.stage(WorkflowFlowLogger.RUN_STARTED))
                .flatMap(state -> scheduler.run(state, phases.canonical()))
                .flatMap(finalState -> persist(finalState, runId).thenReturn(finalState))
                .map(finalState -> {
                    TradeAction signal = SignalProcessor.extract(finalState.finalDecision());
                    long elapsed = System.currentTimeMillis() - startTime;
                    TraceContextUtil.withMdc(runId, () ->
                        log.info("Run complete. ticker={} signal={} finalDecision=\"{}\" agentsExecuted={} latencyMs={} runId={}",
                            finalState.ticker(), signal, finalState.finalDecision(),
                            finalState.agentsExecuted().size(), elapsed, runId));
                    return ExecutionResult.success(runId, finalState, signal, elapsed);
                })
                .onErrorResume(e -> {
                    // stage-level failures are settled earlier; this is an orchestration bug
                    TraceContextUtil.withMdc(runId, () ->
                        log.error("Run failed unexpectedly, defaulting to HOLD. ticker={} runId={}",
                            initial.ticker(), runId, e));
                    return Mono.just(ExecutionResult.failed(runId, initial,
                        "workflow error: " + e.getMessage(), System.currentTimeMillis() - startTime));
                })
                .doOnEach(flowLogger.stage(WorkflowFlowLogger.RUN_COMPLETED));

            return TraceContextUtil.withRunId(pipeline, runId);
        });
    }

    static AgentState initialState(String ticker, LocalDate tradeDate) {
        String normalized = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        if (!normalized.isEmpty() && !TICKER.matcher(normalized).matches()) {
            throw new InvalidRunRequestException("Invalid ticker symbol: '" + ticker + "'");
        }
        AgentState state = StatePropagator.createInitialState(normalized.isEmpty() ? null : normalized, tradeDate);
        List<String> problems = StatePropagator.validateState(state);
        if (!problems.isEmpty()) {
            throw new InvalidRunRequestException(String.join("; ", problems));
        }
        return state;
    }

    /** Adds the run to the ticker's record and hands it to the sink. Never errors. */
    private Mono<Void> persist(AgentState finalState, String runId) {
        if (!runLogEnabled) return Mono.empty();
        LoggableState loggable = StatePropagator.extractLoggableState(finalState);
        ExecutionRecord record = records.compute(finalState.ticker(), (t, existing) ->
            (existing != null ? existing : ExecutionRecord.empty(t)).with(finalState.tradeDate(), loggable, maxRunsPerTicker));

        return Mono.fromRunnable(() -> runLogSink.writeRunLog(finalState.ticker(), finalState.tradeDate(), record))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> flowLogger.logWithRunId(WorkflowFlowLogger.RUN_LOGGED, runId))
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(runId, () ->
                    log.warn("Run log not written (non-fatal). ticker={} reason={}", finalState.ticker(), e.getMessage()));
                return Mono.empty();
            })
            .then();
    }
}
