package com.tradingagents.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record RunRequest(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("tradeDate") LocalDate tradeDate
) {}
