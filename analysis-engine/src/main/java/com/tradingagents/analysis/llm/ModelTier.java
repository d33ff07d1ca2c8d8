package com.tradingagents.analysis.llm;

/** Quick models serve analysts and debaters; deep models serve the judges. */
public enum ModelTier {
    QUICK,
    DEEP
}
