package com.tradingagents.analysis.agent;

import com.tradingagents.analysis.data.DataKind;
import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.prompt.Prompts;
import com.tradingagents.common.model.AnalystType;
import com.tradingagents.common.state.SentimentReportPatch;
import org.springframework.stereotype.Component;

import java.util.List;

/** Social-media sentiment analyst. */
@Component
public class SocialAnalyst extends AnalystStage<SentimentReportPatch> {

    public SocialAnalyst(LlmClient llm, DataProviderClient data) {
        super(llm, data);
    }

    @Override
    public AnalystType type() { return AnalystType.SOCIAL; }

    @Override
    protected DataKind dataKind() { return DataKind.SOCIAL; }

    @Override
    protected String systemPrompt() { return Prompts.SOCIAL_SYSTEM; }

    @Override
    protected SentimentReportPatch toPatch(String report, List<String> messages) {
        return new SentimentReportPatch(report, messages);
    }
}
