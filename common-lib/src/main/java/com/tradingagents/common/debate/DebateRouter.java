package com.tradingagents.common.debate;

import com.tradingagents.common.model.DebateKind;
import com.tradingagents.common.signal.SignalProcessor;
import com.tradingagents.common.signal.TradeAction;

import java.util.List;

/**
 * Bounded debate state machine: {@code DEBATING → JUDGING → DONE}.
 *
 * <pre>
 *   DEBATING --(round &lt; maxRounds and no verdict)--&gt; DEBATING   (round + 1)
 *   DEBATING --(round &gt;= maxRounds or verdict)-----&gt; JUDGING
 *   JUDGING  ----------------------------------------&gt; DONE
 *   DONE     ----------------------------------------&gt; DONE
 * </pre>
 *
 * The investment debate and the risk discussion each use their own instance with their own
 * bound. Instances are immutable and hold no per-run state; the round counter lives in the
 * debate sub-state of {@code AgentState}.
 */
public final class DebateRouter {

    private final DebateKind kind;
    private final int maxRounds;

    public DebateRouter(DebateKind kind, int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1 for " + kind + " debate, got " + maxRounds);
        }
        this.kind = kind;
        this.maxRounds = maxRounds;
    }

    public DebateKind kind() { return kind; }

    public int maxRounds() { return maxRounds; }

    /**
     * @param current        the phase the machine is in
     * @param completedRounds rounds completed so far
     * @param verdictPresent whether a terminal verdict already exists
     * @return the next phase
     */
    public DebatePhase next(DebatePhase current, int completedRounds, boolean verdictPresent) {
        return switch (current) {
            case DEBATING -> verdictPresent || completedRounds >= maxRounds
                ? DebatePhase.JUDGING
                : DebatePhase.DEBATING;
            case JUDGING, DONE -> DebatePhase.DONE;
        };
    }

    /**
     * Deterministic verdict built from the debate history alone, used when the judge
     * produced nothing usable.
     */
    public static String summarizeVerdict(List<String> history) {
        if (history == null || history.isEmpty()) {
            return "HOLD - No debate arguments recorded, defaulting to conservative stance";
        }
        TradeAction majority = SignalProcessor.extractMajority(history);
        return majority.name() + " - Verdict derived from " + history.size() + " debate arguments";
    }
}
