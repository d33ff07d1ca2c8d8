package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.decision.DecisionSynthesizer;
import com.tradingagents.common.decision.TradeDecision;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.state.RiskJudgePatch;
import com.tradingagents.orchestrator.logger.WorkflowFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Closes the risk discussion: assesses risk, synthesizes the decision, and writes the final
 * decision string with the metrics and sizing behind it.
 */
@Component
public class RiskJudgeStage implements Stage<RiskJudgePatch> {

    private static final Logger log = LoggerFactory.getLogger(RiskJudgeStage.class);

    private final RiskAssessmentEngine riskEngine;
    private final DecisionSynthesizer synthesizer;
    private final WorkflowFlowLogger flowLogger;

    public RiskJudgeStage(RiskAssessmentEngine riskEngine, DecisionSynthesizer synthesizer,
                          WorkflowFlowLogger flowLogger) {
        this.riskEngine  = riskEngine;
        this.synthesizer = synthesizer;
        this.flowLogger  = flowLogger;
    }

    @Override
    public String name() {
        return "Risk Judge";
    }

    @Override
    public Mono<RiskJudgePatch> process(AgentState state) {
        return riskEngine.assess(state)
            .doOnEach(flowLogger.stage(WorkflowFlowLogger.RISK_ASSESSED))
            .map(risk -> {
                TradeDecision decision = synthesizer.decide(state, risk);
                String finalDecision = decision.asDecisionString();
                log.info("[RiskJudge] ticker={} finalDecision=\"{}\" size={}",
                    state.ticker(), finalDecision, decision.sizing().recommendedSize());
                return new RiskJudgePatch(finalDecision, finalDecision, risk, decision.sizing());
            })
            .doOnEach(flowLogger.stage(WorkflowFlowLogger.DECISION_SYNTHESIZED));
    }
}
