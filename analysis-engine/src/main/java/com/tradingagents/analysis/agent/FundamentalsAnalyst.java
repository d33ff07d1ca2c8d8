package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.data.DataKind;
import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.AnalystType;
import com.tradingagents.common.state.FundamentalsReportPatch;
import org.springframework.stereotype.Component;

import java.util.List;

/** Financial statements and valuation analyst. */
@Component
public class FundamentalsAnalyst extends AnalystStage<FundamentalsReportPatch> {

    public FundamentalsAnalyst(LlmClient llm, DataProviderClient data) {
        super(llm, data);
    }

    @Override
    public AnalystType type() { return AnalystType.FUNDAMENTALS; }

    @Override
    protected DataKind dataKind() { return DataKind.FUNDAMENTALS; }

    @Override
    protected String systemPrompt() { return Prompts.FUNDAMENTALS_SYSTEM; }

    @Override
    protected FundamentalsReportPatch toPatch(String report, List<String> messages) {
        return new FundamentalsReportPatch(report, messages);
    }
}
