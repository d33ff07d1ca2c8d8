package com.tradingagents.common.decision;

import com.tradingagents.common.exception.DecisionFailureException;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.sizing.PortfolioConstraints;
import com.tradingagents.common.sizing.PortfolioSnapshot;
import com.tradingagents.common.sizing.PositionParameterExtractor;
import com.tradingagents.common.sizing.PositionSizing;
import com.tradingagents.common.sizing.PositionSizingEngine;
import com.tradingagents.common.sizing.SizingInputs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Maps trader sentiment and the risk aggregate to a final action with position sizing.
 *
 * <ol>
 *   <li>classify the trader plan ({@link TraderSentiment#classify})</li>
 *   <li>look up the action in {@link DecisionTable}</li>
 *   <li>size the position with {@link PositionSizingEngine}, parameters read from the plan</li>
 *   <li>check the recommended size against {@link PortfolioConstraints}</li>
 * </ol>
 *
 * <p>Never throws. Any failure yields {@code HOLD - decision system error} with conservative sizing.
 */
public class DecisionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(DecisionSynthesizer.class);

    public static final String FAILURE_JUSTIFICATION = "decision system error";

    private final double defaultPortfolioSize;
    private final PortfolioSnapshot portfolio;

    public DecisionSynthesizer(double defaultPortfolioSize, PortfolioSnapshot portfolio) {
        this.defaultPortfolioSize = defaultPortfolioSize;
        this.portfolio = portfolio != null ? portfolio : PortfolioSnapshot.empty();
    }

    public TradeDecision decide(AgentState state, RiskAssessment risk) {
        try {
            if (risk == null) {
                throw new DecisionFailureException("decision-synthesizer", "risk assessment is missing");
            }
            TraderSentiment sentiment = TraderSentiment.classify(state.traderPlan());
            DecisionTable.Entry entry = DecisionTable.lookup(sentiment, risk);

            SizingInputs inputs = PositionParameterExtractor.extract(
                state.traderPlan(), risk.overallScore(), defaultPortfolioSize);
            PositionSizing sizing = PositionSizingEngine.compute(inputs);
            PortfolioConstraints.Check check = portfolio.check(sizing.recommendedSize());

            log.info("[DecisionSynthesizer] ticker={} sentiment={} risk={} score={} confidence={} → action={} size={}",
                state.ticker(), sentiment, risk.overallRisk(), risk.overallScore(), risk.confidence(),
                entry.action(), String.format("%.3f", sizing.recommendedSize()));
            if (!check.approved()) {
                log.warn("[DecisionSynthesizer] Portfolio constraint violations. ticker={} violations={}",
                    state.ticker(), check.violations());
            }

            return new TradeDecision(entry.action(), sizing, entry.justification(), sentiment, check);
        } catch (RuntimeException e) {
            log.error("[DecisionSynthesizer] Decision failed, defaulting to HOLD. ticker={} reason={}",
                state != null ? state.ticker() : "unknown", e.getMessage(), e);
            return fallback(e.getMessage());
        }
    }

    static TradeDecision fallback(String reason) {
        return new TradeDecision(DecisionAction.HOLD, PositionSizing.conservativeDefault(reason),
            FAILURE_JUSTIFICATION, TraderSentiment.NEUTRAL,
            new PortfolioConstraints.Check(true, List.of(), List.of()));
    }
}
