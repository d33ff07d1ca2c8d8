package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.llm.ModelTier;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.InvestDebateState;
import com.tradingagents.common.model.InvestStance;
import com.tradingagents.common.state.InvestDebatePatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * One side of the bull/bear debate. Reads the four reports plus the debate so far and
 * answers the other side's latest argument.
 */
public abstract class InvestmentDebater implements Stage<InvestDebatePatch> {

    private static final Logger log = LoggerFactory.getLogger(InvestmentDebater.class);

    private final LlmClient llm;
    private final InvestStance stance;
    private final String systemPrompt;

    protected InvestmentDebater(LlmClient llm, InvestStance stance, String systemPrompt) {
        this.llm = llm;
        this.stance = stance;
        this.systemPrompt = systemPrompt;
    }

    public InvestStance stance() {
        return stance;
    }

    @Override
    public Mono<InvestDebatePatch> process(AgentState state) {
        InvestDebateState debate = state.investDebate();
        log.info("[{}] Round {} argument for ticker={}", name(), debate.round() + 1, state.ticker());
        return llm.invoke(systemPrompt,
                Prompts.debatePrompt(state, debate.history(), debate.currentResponse()),
                ModelTier.QUICK)
            .map(argument -> new InvestDebatePatch(stance, argument));
    }
}
