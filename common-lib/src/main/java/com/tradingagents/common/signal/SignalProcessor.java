package com.tradingagents.common.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword classifier turning free-text decisions into a {@link TradeAction}.
 *
 * <h3>Priority</h3>
 * <ol>
 *   <li>A leading action token ({@code "BUY_SMALL - ..."}, {@code "Sell: ..."})</li>
 *   <li>Explicit action keywords: buy, then sell, then hold</li>
 *   <li>Generic sentiment keywords: bullish → BUY, bearish → SELL</li>
 *   <li>Otherwise HOLD</li>
 * </ol>
 *
 * <p>Matching is plain keyword presence and does not understand negation:
 * "no reason to sell" classifies as SELL.
 *
 * <p>Every public method is total: null, empty or unexpected input never throws.
 */
public final class SignalProcessor {

    private static final Logger log = LoggerFactory.getLogger(SignalProcessor.class);

    private static final Pattern LEADING_ACTION =
        Pattern.compile("^[^a-z]*(buy|sell|hold)(?:_small)?\\b");

    private static final Pattern BUY_ACTION =
        Pattern.compile("\\b(?:buy(?:_small)?|buying|purchase|go long|accumulate)\\b");
    private static final Pattern SELL_ACTION =
        Pattern.compile("\\b(?:sell(?:_small)?|selling|liquidate|go short|short position|sell short)\\b");
    private static final Pattern HOLD_ACTION =
        Pattern.compile("\\b(?:hold|holding|wait|stay on the sidelines)\\b");

    private static final Pattern BULLISH =
        Pattern.compile("\\b(?:bullish|upside|outperform|uptrend)\\b");
    private static final Pattern BEARISH =
        Pattern.compile("\\b(?:bearish|downside|underperform|downtrend)\\b");

    // ── Confidence ──────────────────────────────────────────────────────────

    private static final List<Pattern> CONFIDENCE_PATTERNS = List.of(
        Pattern.compile("confidence[:\\s]+(\\d+(?:\\.\\d+)?)%?"),
        Pattern.compile("(\\d+(?:\\.\\d+)?)%\\s*confiden"),
        Pattern.compile("certainty[:\\s]+(\\d+(?:\\.\\d+)?)%?"),
        Pattern.compile("probability[:\\s]+(\\d+(?:\\.\\d+)?)%?")
    );
    private static final Pattern STRONG_LANGUAGE =
        Pattern.compile("\\b(?:strong|strongly|definitely|clearly|high confidence|very confident)\\b");
    private static final Pattern WEAK_LANGUAGE =
        Pattern.compile("\\b(?:uncertain|unclear|might|possibly|maybe|low confidence)\\b");

    static final double STRONG_CONFIDENCE  = 0.8;
    static final double WEAK_CONFIDENCE    = 0.3;
    static final double DEFAULT_CONFIDENCE = 0.5;

    // ── Validation ──────────────────────────────────────────────────────────

    static final int MIN_SIGNAL_LENGTH = 10;
    static final int MAX_SIGNAL_LENGTH = 10_000;
    private static final Pattern FINANCIAL_TERMS = Pattern.compile(
        "price|market|stock|trade|investment|analysis|recommendation|decision|risk");

    private SignalProcessor() {}

    public static TradeAction extract(String text) {
        if (text == null || text.isBlank()) return TradeAction.HOLD;
        try {
            String lower = text.toLowerCase(Locale.ROOT).trim();

            Matcher lead = LEADING_ACTION.matcher(lower);
            if (lead.find()) return TradeAction.valueOf(lead.group(1).toUpperCase(Locale.ROOT));

            if (BUY_ACTION.matcher(lower).find())  return TradeAction.BUY;
            if (SELL_ACTION.matcher(lower).find()) return TradeAction.SELL;
            if (HOLD_ACTION.matcher(lower).find()) return TradeAction.HOLD;

            if (BULLISH.matcher(lower).find()) return TradeAction.BUY;
            if (BEARISH.matcher(lower).find()) return TradeAction.SELL;
            return TradeAction.HOLD;
        } catch (RuntimeException e) {
            log.warn("[SignalProcessor] Extraction failed, defaulting to HOLD. reason={}", e.getMessage());
            return TradeAction.HOLD;
        }
    }

    /**
     * Majority vote over several texts. An empty input or a tie for first place yields HOLD.
     */
    public static TradeAction extractMajority(List<String> texts) {
        if (texts == null || texts.isEmpty()) return TradeAction.HOLD;
        Map<TradeAction, Integer> votes = new EnumMap<>(TradeAction.class);
        for (String text : texts) {
            votes.merge(extract(text), 1, Integer::sum);
        }
        TradeAction winner = TradeAction.HOLD;
        int best = -1;
        boolean tied = false;
        for (Map.Entry<TradeAction, Integer> e : votes.entrySet()) {
            if (e.getValue() > best) {
                winner = e.getKey();
                best = e.getValue();
                tied = false;
            } else if (e.getValue() == best) {
                tied = true;
            }
        }
        return tied ? TradeAction.HOLD : winner;
    }

    /**
     * Confidence expressed in the text, in [0,1]. Explicit percentages win; otherwise strong
     * wording gives 0.8, hedging gives 0.3, and anything else 0.5.
     */
    public static double extractConfidence(String text) {
        if (text == null || text.isBlank()) return DEFAULT_CONFIDENCE;
        try {
            String lower = text.toLowerCase(Locale.ROOT);
            for (Pattern pattern : CONFIDENCE_PATTERNS) {
                Matcher m = pattern.matcher(lower);
                if (m.find()) {
                    double value = Double.parseDouble(m.group(1));
                    if (value > 1.0) value /= 100.0;
                    return Math.max(0.0, Math.min(1.0, value));
                }
            }
            if (STRONG_LANGUAGE.matcher(lower).find()) return STRONG_CONFIDENCE;
            if (WEAK_LANGUAGE.matcher(lower).find()) return WEAK_CONFIDENCE;
            return DEFAULT_CONFIDENCE;
        } catch (RuntimeException e) {
            log.warn("[SignalProcessor] Confidence extraction failed. reason={}", e.getMessage());
            return DEFAULT_CONFIDENCE;
        }
    }

    public static SignalValidation validate(String text) {
        List<String> issues = new ArrayList<>();
        if (text == null || text.isBlank()) {
            issues.add("Signal is empty");
            return new SignalValidation(false, issues);
        }
        String trimmed = text.trim();
        if (trimmed.length() < MIN_SIGNAL_LENGTH) {
            issues.add("Signal is too short (minimum " + MIN_SIGNAL_LENGTH + " characters)");
        }
        if (trimmed.length() > MAX_SIGNAL_LENGTH) {
            issues.add("Signal is too long (maximum " + MAX_SIGNAL_LENGTH + " characters)");
        }
        if (!FINANCIAL_TERMS.matcher(trimmed.toLowerCase(Locale.ROOT)).find()) {
            issues.add("Signal does not contain financial terminology");
        }
        return new SignalValidation(issues.isEmpty(), issues);
    }
}
