package com.tradingagents.orchestrator.config;

import com.tradingagents.common.model.AnalystType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Run-shape settings resolved once at startup.
 *
 * @param selectedAnalysts     Phase-1 analysts in configured order, no duplicates
 * @param maxDebateRounds      bound for the bull/bear debate
 * @param maxRiskDiscussRounds bound for the risky/safe/neutral discussion
 */
public record WorkflowSettings(
    List<AnalystType> selectedAnalysts,
    int maxDebateRounds,
    int maxRiskDiscussRounds
) {

    public WorkflowSettings {
        selectedAnalysts = List.copyOf(selectedAnalysts);
        if (selectedAnalysts.isEmpty()) {
            throw new IllegalArgumentException("workflow.selected-analysts must name at least one analyst");
        }
        if (maxDebateRounds < 1 || maxRiskDiscussRounds < 1) {
            throw new IllegalArgumentException("debate round bounds must be at least 1, got debate="
                + maxDebateRounds + " risk=" + maxRiskDiscussRounds);
        }
    }

    /**
     * Parses a comma-separated analyst list such as {@code market,news}.
     *
     * @throws IllegalArgumentException on an unknown analyst name
     */
    public static List<AnalystType> parseAnalysts(String csv) {
        List<AnalystType> analysts = new ArrayList<>();
        if (csv == null) return analysts;
        for (String key : csv.split(",")) {
            if (key.isBlank()) continue;
            AnalystType type = AnalystType.fromKey(key).orElseThrow(() -> new IllegalArgumentException(
                "Unknown analyst '" + key.trim() + "' in workflow.selected-analysts. Allowed: "
                    + Arrays.stream(AnalystType.values()).map(AnalystType::key).toList()));
            if (!analysts.contains(type)) analysts.add(type);
        }
        return analysts;
    }
}
