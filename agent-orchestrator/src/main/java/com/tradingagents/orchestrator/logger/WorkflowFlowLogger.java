package com.tradingagents.orchestrator.logger;

import com.tradingagents.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Lifecycle logging for one workflow run. Pure side effects; never alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #RUN_STARTED}: initial state built, phases about to run</li>
 *   <li>{@link #PHASE_COMPLETED}: a phase barrier was reached (once per phase)</li>
 *   <li>{@link #RISK_ASSESSED}: the seven risk components were aggregated</li>
 *   <li>{@link #DECISION_SYNTHESIZED}: final action and sizing chosen</li>
 *   <li>{@link #RUN_LOGGED}: loggable state handed to the run-log sink</li>
 *   <li>{@link #RUN_COMPLETED}: result returned to the caller</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads runId from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(WorkflowFlowLogger.RUN_COMPLETED))
 * </pre>
 */
@Component
public class WorkflowFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(WorkflowFlowLogger.class);

    public static final String RUN_STARTED          = "RUN_STARTED";
    public static final String PHASE_COMPLETED      = "PHASE_COMPLETED";
    public static final String RISK_ASSESSED        = "RISK_ASSESSED";
    public static final String DECISION_SYNTHESIZED = "DECISION_SYNTHESIZED";
    public static final String RUN_LOGGED           = "RUN_LOGGED";
    public static final String RUN_COMPLETED        = "RUN_COMPLETED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The runId is read from the signal's context and bridged to MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            TraceContextUtil.withMdc(runId, () ->
                log.info("[WorkflowFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    /** Logs a completed phase barrier with its stage tally. */
    public void phaseCompleted(String phaseName, int succeeded, int failed, String runId) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[WorkflowFlow] stage={} phase={} succeeded={} failed={} runId={}",
                PHASE_COMPLETED, phaseName, succeeded, failed, runId)
        );
    }

    /** For call sites that already hold the runId outside a {@code doOnEach}. */
    public void logWithRunId(String stageName, String runId) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[WorkflowFlow] stage={} runId={}", stageName, runId)
        );
    }
}
