package com.tradingagents.common.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SignalValidation(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("issues") List<String> issues
) {
    public SignalValidation {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
