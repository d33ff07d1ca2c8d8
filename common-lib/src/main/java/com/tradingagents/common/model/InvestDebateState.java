package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Bull/bear investment debate. {@code history} interleaves both sides in speaking order;
 * {@code round} counts completed debate rounds (one argument from each side).
 */
public record InvestDebateState(
    @JsonProperty("bullHistory") List<String> bullHistory,
    @JsonProperty("bearHistory") List<String> bearHistory,
    @JsonProperty("history") List<String> history,
    @JsonProperty("currentResponse") String currentResponse,
    @JsonProperty("judgeDecision") String judgeDecision,
    @JsonProperty("round") int round
) {

    public InvestDebateState {
        bullHistory     = bullHistory != null ? List.copyOf(bullHistory) : List.of();
        bearHistory     = bearHistory != null ? List.copyOf(bearHistory) : List.of();
        history         = history != null ? List.copyOf(history) : List.of();
        currentResponse = currentResponse != null ? currentResponse : "";
        judgeDecision   = judgeDecision != null ? judgeDecision : "";
    }

    public static InvestDebateState empty() {
        return new InvestDebateState(List.of(), List.of(), List.of(), "", "", 0);
    }

    public boolean hasVerdict() {
        return !judgeDecision.isBlank();
    }

    public InvestDebateState append(InvestStance stance, String argument) {
        String entry = stance.speaker() + ": " + argument;
        List<String> bull = stance == InvestStance.BULL ? appended(bullHistory, entry) : bullHistory;
        List<String> bear = stance == InvestStance.BEAR ? appended(bearHistory, entry) : bearHistory;
        return new InvestDebateState(bull, bear, appended(history, entry), entry, judgeDecision, round);
    }

    public InvestDebateState nextRound() {
        return new InvestDebateState(bullHistory, bearHistory, history, currentResponse, judgeDecision, round + 1);
    }

    public InvestDebateState withJudgeDecision(String decision) {
        return new InvestDebateState(bullHistory, bearHistory, history, currentResponse, decision, round);
    }

    private static List<String> appended(List<String> list, String entry) {
        List<String> copy = new ArrayList<>(list);
        copy.add(entry);
        return copy;
    }
}
