package com.tradingagents.analysis.data;

/** Text feeds served by the data provider, one per analyst. */
public enum DataKind {
    PRICE_HISTORY("price-history", 60),
    SOCIAL("social", 7),
    NEWS("news", 7),
    FUNDAMENTALS("fundamentals", 365);

    private final String path;
    private final int defaultLookbackDays;

    DataKind(String path, int defaultLookbackDays) {
        this.path = path;
        this.defaultLookbackDays = defaultLookbackDays;
    }

    public String path() { return path; }

    public int defaultLookbackDays() { return defaultLookbackDays; }
}
