package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.InvestStance;
import org.springframework.stereotype.Component;

@Component
public class BullResearcher extends InvestmentDebater {

    public BullResearcher(LlmClient llm) {
        super(llm, InvestStance.BULL, Prompts.BULL_SYSTEM);
    }

    @Override
    public String name() {
        return "Bull Researcher";
    }
}
