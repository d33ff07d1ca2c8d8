package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.InvestStance;
import org.springframework.stereotype.Component;

@Component
public class BearResearcher extends InvestmentDebater {

    public BearResearcher(LlmClient llm) {
        super(llm, InvestStance.BEAR, Prompts.BEAR_SYSTEM);
    }

    @Override
    public String name() {
        return "Bear Researcher";
    }
}
