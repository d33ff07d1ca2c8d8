package com.tradingagents.analysis.llm;

/**
 * Maps a {@link ModelTier} to a Claude model name.
 *
 * <ul>
 *   <li>{@code QUICK} → Haiku: analysts and debaters, many calls per run.</li>
 *   <li>{@code DEEP} → Sonnet: research manager and trader, one call each.</li>
 * </ul>
 *
 * Blank overrides fall back to the built-in defaults.
 */
public final class ModelSelector {

    public static final String QUICK_MODEL = "claude-haiku-4-5-20251001";
    public static final String DEEP_MODEL  = "claude-sonnet-4-6";

    private ModelSelector() {}

    public static String selectModel(ModelTier tier, String quickOverride, String deepOverride) {
        return switch (tier) {
            case QUICK -> quickOverride != null && !quickOverride.isBlank() ? quickOverride : QUICK_MODEL;
            case DEEP  -> deepOverride != null && !deepOverride.isBlank() ? deepOverride : DEEP_MODEL;
        };
    }
}
