package com.tradingagents.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the per-run identifier through reactive pipelines.
 *
 * <p>The Reactor Context holds {@code runId} for the whole run. MDC is written only for the
 * duration of a single log statement via {@link #withMdc}, never left on a thread.
 *
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, runId);
 *     ...
 *     .doOnEach(signal -&gt; TraceContextUtil.getRunId(signal.getContextView()))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private TraceContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context. {@code contextWrite} applies upstream, so
     * call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** @return the runId, or {@code "unknown"}; never {@code null} */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /** Bridges {@code runId} into MDC while {@code logAction} runs, then removes it. */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
