package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.RiskStance;
import org.springframework.stereotype.Component;

@Component
public class RiskyAnalyst extends RiskDebater {

    public RiskyAnalyst(LlmClient llm) {
        super(llm, RiskStance.RISKY, Prompts.RISKY_SYSTEM);
    }
}
