package com.tradingagents.orchestrator.pipeline;

import com.tradingagents.analysis.agent.AnalystStage;
import com.tradingagents.analysis.agent.BearResearcher;
import com.tradingagents.analysis.agent.BullResearcher;
import com.tradingagents.analysis.agent.NeutralAnalyst;
import com.tradingagents.analysis.agent.ResearchManager;
import com.tradingagents.analysis.agent.RiskyAnalyst;
import com.tradingagents.analysis.agent.SafeAnalyst;
import com.tradingagents.analysis.agent.Trader;
import com.tradingagents.analysis.stage.Stage;
import com.tradingagents.common.debate.DebateRouter;
import com.tradingagents.common.decision.DecisionSynthesizer;
import com.tradingagents.common.model.AgentState;
import com.tradingagents.common.model.AnalystType;
import com.tradingagents.common.model.DebateKind;
import com.tradingagents.common.risk.RiskAssessment;
import com.tradingagents.common.sizing.PositionSizing;
import com.tradingagents.common.state.InvestmentJudgePatch;
import com.tradingagents.common.state.RiskJudgePatch;
import com.tradingagents.common.state.StatePatch;
import com.tradingagents.orchestrator.config.WorkflowSettings;
import com.tradingagents.orchestrator.risk.RiskJudgeStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The canonical four-phase workflow:
 * <ol>
 *   <li>analysts: selected analysts in parallel, transcript cleared afterwards</li>
 *   <li>investment debate: bull then bear per round, research manager judges</li>
 *   <li>trader: single stage</li>
 *   <li>risk discussion: risky, safe, neutral per round, risk judge decides</li>
 * </ol>
 */
@Component
public class WorkflowPhases {

    private static final Logger log = LoggerFactory.getLogger(WorkflowPhases.class);

    public static final String ANALYSTS          = "analysts";
    public static final String INVESTMENT_DEBATE = "investment_debate";
    public static final String TRADER            = "trader";
    public static final String RISK_DISCUSSION   = "risk_discussion";

    private final List<Phase> phases;

    public WorkflowPhases(WorkflowSettings settings,
                          List<AnalystStage<?>> analysts,
                          BullResearcher bull, BearResearcher bear, ResearchManager researchManager,
                          Trader trader,
                          RiskyAnalyst risky, SafeAnalyst safe, NeutralAnalyst neutral,
                          RiskJudgeStage riskJudge) {
        this.phases = List.of(
            new ParallelPhase(ANALYSTS, selectAnalysts(settings.selectedAnalysts(), analysts), true),
            new DebateLoop(INVESTMENT_DEBATE, DebateKind.INVESTMENT, List.of(bull, bear), researchManager,
                new DebateRouter(DebateKind.INVESTMENT, settings.maxDebateRounds()),
                WorkflowPhases::investmentFallback),
            ParallelPhase.single(TRADER, trader),
            new DebateLoop(RISK_DISCUSSION, DebateKind.RISK, List.of(risky, safe, neutral), riskJudge,
                new DebateRouter(DebateKind.RISK, settings.maxRiskDiscussRounds()),
                WorkflowPhases::riskFallback)
        );
        log.info("[WorkflowPhases] Configured. analysts={} maxDebateRounds={} maxRiskDiscussRounds={}",
            settings.selectedAnalysts(), settings.maxDebateRounds(), settings.maxRiskDiscussRounds());
    }

    public List<Phase> canonical() {
        return phases;
    }

    static List<Stage<?>> selectAnalysts(List<AnalystType> selected, List<AnalystStage<?>> available) {
        Map<AnalystType, AnalystStage<?>> byType = new EnumMap<>(AnalystType.class);
        available.forEach(a -> byType.put(a.type(), a));
        List<Stage<?>> stages = new ArrayList<>();
        for (AnalystType type : selected) {
            AnalystStage<?> stage = byType.get(type);
            if (stage == null) {
                throw new IllegalStateException("No analyst stage registered for " + type.key());
            }
            stages.add(stage);
        }
        return stages;
    }

    static StatePatch investmentFallback(AgentState state) {
        return new InvestmentJudgePatch(DebateRouter.summarizeVerdict(state.investDebate().history()));
    }

    /** Verdict from the discussion, but the decision itself stays HOLD at conservative size. */
    static StatePatch riskFallback(AgentState state) {
        String reason = "risk judge unavailable";
        return new RiskJudgePatch(
            DebateRouter.summarizeVerdict(state.riskDebate().history()),
            "HOLD - " + DecisionSynthesizer.FAILURE_JUSTIFICATION,
            RiskAssessment.failSafe(reason),
            PositionSizing.conservativeDefault(reason));
    }
}
