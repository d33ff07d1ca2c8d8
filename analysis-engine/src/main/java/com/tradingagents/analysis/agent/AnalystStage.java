package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.data.DataKind;
import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.analysis.data.DataRequest;
import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.llm.ModelTier;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.AnalystType;
import com.tradingagents.common.state.StatePatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Phase-1 analyst: fetch one data feed, have the LLM turn it into a report.
 *
 * @param <P> the report patch this analyst owns
 */
public abstract class AnalystStage<P extends StatePatch> implements Stage<P> {

    private static final Logger log = LoggerFactory.getLogger(AnalystStage.class);

    protected final LlmClient llm;
    protected final DataProviderClient data;

    protected AnalystStage(LlmClient llm, DataProviderClient data) {
        this.llm = llm;
        this.data = data;
    }

    public abstract AnalystType type();

    protected abstract DataKind dataKind();

    protected abstract String systemPrompt();

    protected abstract P toPatch(String report, List<String> messages);

    @Override
    public String name() {
        return type().stageName();
    }

    /** Raw feed text for the prompt. Subclasses may enrich it. */
    protected Mono<String> gatherData(AgentState state) {
        return data.fetch(DataRequest.of(dataKind(), state.ticker(), state.tradeDate()));
    }

    @Override
    public Mono<P> process(AgentState state) {
        log.info("[{}] Analyzing ticker={} date={}", name(), state.ticker(), state.tradeDate());
        return gatherData(state)
            .flatMap(feed -> llm.invoke(systemPrompt(),
                Prompts.analystPrompt(state, dataKind().path() + " data", feed), ModelTier.QUICK))
            .map(report -> toPatch(report, List.of(
                name() + " requested " + dataKind().path() + " data for " + state.ticker(),
                name() + ": " + report)));
    }
}
