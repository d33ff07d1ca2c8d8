package com.tradingagents.orchestrator.risk;

import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskDimension;
import com.tradingagents.common.risk.RiskComponentResult;
import reactor.core.publisher.Mono;

/**
 * Scores one risk dimension. Missing inputs must yield a "no data" factor, not a guess.
 * Errors are allowed; {@link RiskAssessmentEngine} replaces them with the neutral result.
 */
public interface RiskComponentAssessor {

    RiskDimension dimension();

    Mono<RiskComponentResult> assess(AgentState state, IndicatorSnapshot indicators);
}
