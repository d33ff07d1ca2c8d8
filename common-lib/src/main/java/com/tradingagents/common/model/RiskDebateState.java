package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Risky/safe/neutral risk discussion. {@code round} counts completed rotations through all
 * three speakers.
 */
public record RiskDebateState(
    @JsonProperty("riskyHistory") List<String> riskyHistory,
    @JsonProperty("safeHistory") List<String> safeHistory,
    @JsonProperty("neutralHistory") List<String> neutralHistory,
    @JsonProperty("history") List<String> history,
    @JsonProperty("latestSpeaker") String latestSpeaker,
    @JsonProperty("currentResponse") String currentResponse,
    @JsonProperty("judgeDecision") String judgeDecision,
    @JsonProperty("round") int round
) {

    public RiskDebateState {
        riskyHistory    = riskyHistory != null ? List.copyOf(riskyHistory) : List.of();
        safeHistory     = safeHistory != null ? List.copyOf(safeHistory) : List.of();
        neutralHistory  = neutralHistory != null ? List.copyOf(neutralHistory) : List.of();
        history         = history != null ? List.copyOf(history) : List.of();
        latestSpeaker   = latestSpeaker != null ? latestSpeaker : "";
        currentResponse = currentResponse != null ? currentResponse : "";
        judgeDecision   = judgeDecision != null ? judgeDecision : "";
    }

    public static RiskDebateState empty() {
        return new RiskDebateState(List.of(), List.of(), List.of(), List.of(), "", "", "", 0);
    }

    public boolean hasVerdict() {
        return !judgeDecision.isBlank();
    }

    public RiskDebateState append(RiskStance stance, String argument) {
        String entry = stance.speaker() + ": " + argument;
        return new RiskDebateState(
            stance == RiskStance.RISKY ? appended(riskyHistory, entry) : riskyHistory,
            stance == RiskStance.SAFE ? appended(safeHistory, entry) : safeHistory,
            stance == RiskStance.NEUTRAL ? appended(neutralHistory, entry) : neutralHistory,
            appended(history, entry),
            stance.speaker(), entry, judgeDecision, round);
    }

    public RiskDebateState nextRound() {
        return new RiskDebateState(riskyHistory, safeHistory, neutralHistory, history,
            latestSpeaker, currentResponse, judgeDecision, round + 1);
    }

    public RiskDebateState withJudgeDecision(String decision) {
        return new RiskDebateState(riskyHistory, safeHistory, neutralHistory, history,
            latestSpeaker, currentResponse, decision, round);
    }

    private static List<String> appended(List<String> list, String entry) {
        List<String> copy = new ArrayList<>(list);
        copy.add(entry);
        return copy;
    }
}
