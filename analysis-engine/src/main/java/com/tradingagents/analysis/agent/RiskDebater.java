package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.llm.ModelTier;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.RiskStance;
import com.tradingagents.common.state.RiskDebatePatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/** One voice in the risky/safe/neutral discussion of the trader's plan. */
public abstract class RiskDebater implements Stage<RiskDebatePatch> {

    private static final Logger log = LoggerFactory.getLogger(RiskDebater.class);

    private final LlmClient llm;
    private final RiskStance stance;
    private final String systemPrompt;

    protected RiskDebater(LlmClient llm, RiskStance stance, String systemPrompt) {
        this.llm = llm;
        this.stance = stance;
        this.systemPrompt = systemPrompt;
    }

    public RiskStance stance() {
        return stance;
    }

    @Override
    public String name() {
        return stance.speaker();
    }

    @Override
    public Mono<RiskDebatePatch> process(AgentState state) {
        log.info("[{}] Round {} argument for ticker={}",
            name(), state.riskDebate().round() + 1, state.ticker());
        return llm.invoke(systemPrompt, Prompts.riskPrompt(state, state.riskDebate().history()), ModelTier.QUICK)
            .map(argument -> new RiskDebatePatch(stance, argument));
    }
}
