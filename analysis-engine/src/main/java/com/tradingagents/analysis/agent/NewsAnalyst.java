package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.data.DataKind;
import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.AnalystType;
import com.tradingagents.common.state.NewsReportPatch;
import org.springframework.stereotype.Component;

import java.util.List;

/** Company and macro news analyst. */
@Component
public class NewsAnalyst extends AnalystStage<NewsReportPatch> {

    public NewsAnalyst(LlmClient llm, DataProviderClient data) {
        super(llm, data);
    }

    @Override
    public AnalystType type() { return AnalystType.NEWS; }

    @Override
    protected DataKind dataKind() { return DataKind.NEWS; }

    @Override
    protected String systemPrompt() { return Prompts.NEWS_SYSTEM; }

    @Override
    protected NewsReportPatch toPatch(String report, List<String> messages) {
        return new NewsReportPatch(report, messages);
    }
}
