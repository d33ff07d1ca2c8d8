package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.llm.ModelTier;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.state.TraderPlanPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Turns the investment plan into a concrete trading plan. */
@Component
public class Trader implements Stage<TraderPlanPatch> {

    private static final Logger log = LoggerFactory.getLogger(Trader.class);

    private final LlmClient llm;

    public Trader(LlmClient llm) {
        this.llm = llm;
    }

    @Override
    public String name() {
        return "Trader";
    }

    @Override
    public Mono<TraderPlanPatch> process(AgentState state) {
        log.info("[{}] Drafting plan for ticker={}", name(), state.ticker());
        return llm.invoke(Prompts.TRADER_SYSTEM, Prompts.traderPrompt(state), ModelTier.DEEP)
            .map(TraderPlanPatch::new);
    }
}
