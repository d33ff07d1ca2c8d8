package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.RiskStance;
import org.springframework.stereotype.Component;

@Component
public class NeutralAnalyst extends RiskDebater {

    public NeutralAnalyst(LlmClient llm) {
        super(llm, RiskStance.NEUTRAL, Prompts.NEUTRAL_SYSTEM);
    }
}
