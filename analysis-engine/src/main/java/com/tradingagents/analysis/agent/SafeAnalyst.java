package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.RiskStance;
import org.springframework.stereotype.Component;

@Component
public class SafeAnalyst extends RiskDebater {

    public SafeAnalyst(LlmClient llm) {
        super(llm, RiskStance.SAFE, Prompts.SAFE_SYSTEM);
    }
}
