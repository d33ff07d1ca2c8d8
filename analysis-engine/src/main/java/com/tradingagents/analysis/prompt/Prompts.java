package com.tradingagents.analysis.prompt;

import com.tradingagents.common.model.AgentState;

import java.util.List;

/**
 * Prompt templates for every stage. Pure string assembly; no I/O.
 */
public final class Prompts {

    private static final String NONE = "(not available)";

    private Prompts() {}

    // ── Analysts ────────────────────────────────────────────────────────────

    public static final String MARKET_SYSTEM = """
        You are a market analyst. Using the price history and technical indicators provided,
        write a detailed report on trend, momentum and volatility for the ticker. Be specific
        about levels and indicator readings. End with a markdown table summarising key points.""";

    public static final String SOCIAL_SYSTEM = """
        You are a social media and sentiment analyst. Using the posts provided, write a report on
        public sentiment toward the company over the past week, noting shifts in tone and the
        implications for traders. End with a markdown table summarising key points.""";

    public static final String NEWS_SYSTEM = """
        You are a news researcher. Using the articles provided, write a report on recent company
        and macroeconomic news relevant to trading the ticker. Flag regulatory, earnings and
        leadership events explicitly. End with a markdown table summarising key points.""";

    public static final String FUNDAMENTALS_SYSTEM = """
        You are a fundamentals analyst. Using the financial data provided, write a report on the
        company's financial position: profitability, growth, leverage and valuation.
        End with a markdown table summarising key points.""";

    public static String analystPrompt(AgentState state, String dataLabel, String data) {
        return "Ticker: " + state.ticker() + "\n"
            + "Trade date: " + state.tradeDate() + "\n\n"
            + dataLabel + ":\n" + orNone(data);
    }

    // ── Investment debate ───────────────────────────────────────────────────

    public static final String BULL_SYSTEM = """
        You are a bull analyst advocating for investing in the stock. Build an evidence-based case
        around growth potential, competitive advantages and positive indicators. Address the bear
        analyst's latest argument directly. Respond conversationally, without special formatting.""";

    public static final String BEAR_SYSTEM = """
        You are a bear analyst arguing against investing in the stock. Emphasise risks, challenges
        and negative indicators. Address the bull analyst's latest argument directly.
        Respond conversationally, without special formatting.""";

    public static final String RESEARCH_MANAGER_SYSTEM = """
        You are the research manager judging the bull/bear debate. Summarise the strongest points
        from each side and commit to a recommendation: Buy, Sell, or Hold only if strongly
        justified. Then give the trader a concrete investment plan with rationale and actions.""";

    public static String debatePrompt(AgentState state, List<String> history, String opponentLast) {
        return reportsBlock(state)
            + "Debate history:\n" + joinOrNone(history) + "\n\n"
            + "Last argument from the other side:\n" + orNone(opponentLast);
    }

    public static String judgePrompt(AgentState state, List<String> history) {
        return reportsBlock(state)
            + "Debate history:\n" + joinOrNone(history);
    }

    // ── Trader ──────────────────────────────────────────────────────────────

    public static final String TRADER_SYSTEM = """
        You are a trader. Based on the analysts' reports and the research manager's investment
        plan, decide on a trade. State expected win rate, risk/reward ratio and volatility if you
        can estimate them. Always end with 'FINAL TRANSACTION PROPOSAL: **BUY/HOLD/SELL**'.""";

    public static String traderPrompt(AgentState state) {
        return reportsBlock(state)
            + "Proposed investment plan:\n" + orNone(state.investmentPlan());
    }

    // ── Risk discussion ─────────────────────────────────────────────────────

    public static final String RISKY_SYSTEM = """
        You are the risky risk analyst. Champion high-reward opportunities in the trader's plan,
        challenge overly cautious views from the safe and neutral analysts, and argue for bold
        positioning where the upside justifies it.""";

    public static final String SAFE_SYSTEM = """
        You are the safe risk analyst. Protect assets and minimise volatility. Critically examine
        the trader's plan for exposure that could cause losses, and counter the risky and neutral
        analysts where they overlook downside.""";

    public static final String NEUTRAL_SYSTEM = """
        You are the neutral risk analyst. Weigh the benefits and risks of the trader's plan,
        challenge both the risky and safe analysts where they are too optimistic or too cautious,
        and advocate a balanced strategy.""";

    public static String riskPrompt(AgentState state, List<String> history) {
        return reportsBlock(state)
            + "Trader's plan:\n" + orNone(state.traderPlan()) + "\n\n"
            + "Discussion so far:\n" + joinOrNone(history);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static String reportsBlock(AgentState state) {
        return "Ticker: " + state.ticker() + " (" + state.tradeDate() + ")\n\n"
            + "Market report:\n" + orNone(state.marketReport()) + "\n\n"
            + "Sentiment report:\n" + orNone(state.sentimentReport()) + "\n\n"
            + "News report:\n" + orNone(state.newsReport()) + "\n\n"
            + "Fundamentals report:\n" + orNone(state.fundamentalsReport()) + "\n\n";
    }

    private static String orNone(String s) {
        return s == null || s.isBlank() ? NONE : s;
    }

    private static String joinOrNone(List<String> lines) {
        return lines == null || lines.isEmpty() ? NONE : String.join("\n\n", lines);
    }
}
