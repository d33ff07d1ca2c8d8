package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.llm.ModelTier;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.state.InvestmentJudgePatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Judges the bull/bear debate on the deep model. The verdict doubles as the investment plan
 * handed to the trader.
 */
@Component
public class ResearchManager implements Stage<InvestmentJudgePatch> {

    private static final Logger log = LoggerFactory.getLogger(ResearchManager.class);

    private final LlmClient llm;

    public ResearchManager(LlmClient llm) {
        this.llm = llm;
    }

    @Override
    public String name() {
        return "Research Manager";
    }

    @Override
    public Mono<InvestmentJudgePatch> process(AgentState state) {
        log.info("[{}] Judging {} debate arguments for ticker={}",
            name(), state.investDebate().history().size(), state.ticker());
        return llm.invoke(Prompts.RESEARCH_MANAGER_SYSTEM,
                Prompts.judgePrompt(state, state.investDebate().history()), ModelTier.DEEP)
            .map(InvestmentJudgePatch::new);
    }
}
